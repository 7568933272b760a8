package app.slowko.core.review.service;

import app.slowko.core.review.domain.ReviewStats;
import app.slowko.core.review.repository.ReviewProgressRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewStatsServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T08:00:00Z");

    @Mock
    ReviewProgressRepository progressRepo;

    ReviewStatsService service;

    @BeforeEach
    void setup() {
        service = new ReviewStatsService(progressRepo, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void getReviewStats_mapsStageCounts() {
        when(progressRepo.countByStage(42L, NOW)).thenReturn(new CountsStub(12, 5, 3, 6, 3));

        ReviewStats stats = service.getReviewStats(42L);

        assertThat(stats).isEqualTo(new ReviewStats(12, 5, 3, 6, 3));
    }

    @Test
    void getReviewStats_userWithoutProgressGetsZeros() {
        when(progressRepo.countByStage(42L, NOW)).thenReturn(new CountsStub(0, 0, 0, 0, 0));

        assertThat(service.getReviewStats(42L)).isEqualTo(ReviewStats.EMPTY);
    }

    private record CountsStub(long total, long dueNow, long mastered, long learning, long fresh)
            implements ReviewProgressRepository.ReviewCountsProjection {

        @Override
        public long getTotal() {
            return total;
        }

        @Override
        public long getDueNow() {
            return dueNow;
        }

        @Override
        public long getMastered() {
            return mastered;
        }

        @Override
        public long getLearning() {
            return learning;
        }

        @Override
        public long getFresh() {
            return fresh;
        }
    }
}
