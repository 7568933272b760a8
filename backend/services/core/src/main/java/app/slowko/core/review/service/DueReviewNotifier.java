package app.slowko.core.review.service;

import app.slowko.core.review.api.DueReviewsAvailableEvent;
import app.slowko.core.review.repository.ReviewProgressRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
public class DueReviewNotifier {

    private static final Logger log = LoggerFactory.getLogger(DueReviewNotifier.class);

    private final ReviewProgressRepository progressRepo;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public DueReviewNotifier(ReviewProgressRepository progressRepo,
                             ApplicationEventPublisher events,
                             Clock clock) {
        this.progressRepo = progressRepo;
        this.events = events;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${app.srs.due-check-interval-ms:3600000}",
            initialDelayString = "${app.srs.due-check-initial-delay-ms:60000}"
    )
    public void poll() {
        try {
            int notified = publishDueReviews();
            if (notified > 0) {
                log.info("Due review check: {} learner(s) have reviews waiting", notified);
            }
        } catch (RuntimeException ex) {
            log.warn("Due review check failed, retrying on next tick", ex);
        }
    }

    /**
     * @return number of learners an event was published for
     */
    public int publishDueReviews() {
        Instant now = clock.instant();
        var dueUsers = progressRepo.findUsersWithDueReviews(now);
        for (var row : dueUsers) {
            events.publishEvent(new DueReviewsAvailableEvent(row.getUserId(), row.getDueCount(), now));
        }
        return dueUsers.size();
    }
}
