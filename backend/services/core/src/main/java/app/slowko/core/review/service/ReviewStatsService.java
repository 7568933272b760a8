package app.slowko.core.review.service;

import app.slowko.core.review.domain.ReviewStats;
import app.slowko.core.review.repository.ReviewProgressRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

@Service
public class ReviewStatsService {

    private final ReviewProgressRepository progressRepo;
    private final Clock clock;

    public ReviewStatsService(ReviewProgressRepository progressRepo, Clock clock) {
        this.progressRepo = progressRepo;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public ReviewStats getReviewStats(long userId) {
        var counts = progressRepo.countByStage(userId, clock.instant());
        if (counts == null || counts.getTotal() == 0) {
            return ReviewStats.EMPTY;
        }
        return new ReviewStats(
                counts.getTotal(),
                counts.getDueNow(),
                counts.getMastered(),
                counts.getLearning(),
                counts.getFresh()
        );
    }
}
