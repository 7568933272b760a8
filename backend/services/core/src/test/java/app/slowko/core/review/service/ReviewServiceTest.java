package app.slowko.core.review.service;

import app.slowko.core.review.algorithm.Sm2Scheduler;
import app.slowko.core.review.api.ReviewItemPort;
import app.slowko.core.review.config.SrsProps;
import app.slowko.core.review.entity.ReviewProgressEntity;
import app.slowko.core.review.repository.ReviewProgressRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T08:00:00Z");

    @Mock
    ReviewProgressRepository progressRepo;

    @Mock
    ReviewItemPort items;

    ReviewService reviewService;

    @BeforeEach
    void setup() {
        SrsProps props = SrsProps.defaults();
        reviewService = new ReviewService(
                progressRepo,
                items,
                new Sm2Scheduler(props),
                props,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void getDueItems_defaultsToSessionSizeAndReturnsEarliestFirst() {
        List<ReviewProgressEntity> due = IntStream.range(0, 10)
                .mapToObj(i -> progress(i + 1L, 42L, NOW.minus(Duration.ofHours(20 - i))))
                .toList();
        when(progressRepo.findDue(eq(42L), eq(NOW), any(Pageable.class))).thenReturn(due);

        List<ReviewProgressEntity> result = reviewService.getDueItems(42L);

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(progressRepo).findDue(eq(42L), eq(NOW), page.capture());
        assertThat(page.getValue().getPageNumber()).isZero();
        assertThat(page.getValue().getPageSize()).isEqualTo(10);
        assertThat(result).hasSize(10);
        assertThat(result).allMatch(p -> !p.getNextReviewAt().isAfter(NOW));
    }

    @Test
    void getDueItems_usesExplicitLimit() {
        when(progressRepo.findDue(eq(42L), eq(NOW), any(Pageable.class))).thenReturn(List.of());

        assertThat(reviewService.getDueItems(42L, 3)).isEmpty();

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(progressRepo).findDue(eq(42L), eq(NOW), page.capture());
        assertThat(page.getValue().getPageSize()).isEqualTo(3);
    }

    @Test
    void getDueItems_rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> reviewService.getDueItems(42L, 0))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(progressRepo);
    }

    @Test
    void applyAnswer_unknownProgressIsIgnored() {
        when(progressRepo.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        assertThat(reviewService.applyAnswer(99L, 5, true)).isEmpty();

        verify(progressRepo, never()).save(any());
    }

    @Test
    void applyAnswer_perfectRecallTwiceGivesOneThenSixDays() {
        ReviewProgressEntity fresh = progress(7L, 42L, NOW);
        when(progressRepo.findByIdForUpdate(7L)).thenReturn(Optional.of(fresh));
        when(progressRepo.save(any(ReviewProgressEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        ReviewProgressEntity first = reviewService.applyAnswer(7L, 5, true).orElseThrow();

        assertThat(first.getIntervalDays()).isEqualTo(1);
        assertThat(first.getRepetitions()).isEqualTo(1);
        assertThat(first.getEasinessFactor()).isGreaterThanOrEqualTo(2.5);
        assertThat(first.getNextReviewAt()).isEqualTo(NOW.plus(Duration.ofDays(1)));
        assertThat(first.getLastReviewedAt()).isEqualTo(NOW);
        assertThat(first.getLastQuality()).isEqualTo(5);
        assertThat(first.getStage()).isEqualTo(1);

        ReviewProgressEntity second = reviewService.applyAnswer(7L, 5, true).orElseThrow();

        assertThat(second.getIntervalDays()).isEqualTo(6);
        assertThat(second.getRepetitions()).isEqualTo(2);
        assertThat(second.getStage()).isEqualTo(2);
        assertThat(second.getTimesReviewed()).isEqualTo(2);
        assertThat(second.getTimesCorrect()).isEqualTo(2);
        assertThat(second.getTimesWrong()).isZero();
    }

    @Test
    void applyAnswer_lapseMakesItemDueNowAndCountsWrongAnswer() {
        ReviewProgressEntity learned = progress(7L, 42L, NOW.minus(Duration.ofDays(1)));
        learned.setRepetitions(4);
        learned.setStage(4);
        learned.setIntervalDays(20);
        learned.setEasinessFactor(2.4);
        learned.setTimesReviewed(4);
        learned.setTimesCorrect(4);
        when(progressRepo.findByIdForUpdate(7L)).thenReturn(Optional.of(learned));
        when(progressRepo.save(any(ReviewProgressEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        ReviewProgressEntity out = reviewService.applyAnswer(7L, false).orElseThrow();

        assertThat(out.getLastQuality()).isEqualTo(1);
        assertThat(out.getRepetitions()).isZero();
        assertThat(out.getIntervalDays()).isZero();
        assertThat(out.getStage()).isZero();
        assertThat(out.getNextReviewAt()).isEqualTo(NOW);
        assertThat(out.getTimesReviewed()).isEqualTo(5);
        assertThat(out.getTimesCorrect()).isEqualTo(4);
        assertThat(out.getTimesWrong()).isEqualTo(1);
        assertThat(out.getEasinessFactor()).isGreaterThanOrEqualTo(1.3).isLessThan(2.4);
    }

    @Test
    void applyAnswer_rejectsQualityOutsideScaleBeforeTouchingStore() {
        assertThatThrownBy(() -> reviewService.applyAnswer(7L, 6, true))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(progressRepo);
    }

    @Test
    void applyAnswer_progressOfAnotherUserIsTreatedAsUnknown() {
        when(progressRepo.findByIdForUpdate(7L)).thenReturn(Optional.of(progress(7L, 42L, NOW)));

        assertThat(reviewService.applyAnswer(1000L, 7L, 4, true)).isEmpty();

        verify(progressRepo, never()).save(any());
    }

    @Test
    void addItemToUser_createsProgressDueImmediately() {
        when(items.exists(5L)).thenReturn(true);
        when(progressRepo.findByUserIdAndItemId(42L, 5L)).thenReturn(Optional.empty());
        when(progressRepo.saveAndFlush(any(ReviewProgressEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        ReviewProgressEntity created = reviewService.addItemToUser(42L, 5L).orElseThrow();

        assertThat(created.getUserId()).isEqualTo(42L);
        assertThat(created.getItemId()).isEqualTo(5L);
        assertThat(created.getRepetitions()).isZero();
        assertThat(created.getIntervalDays()).isZero();
        assertThat(created.getEasinessFactor()).isEqualTo(2.5);
        assertThat(created.getNextReviewAt()).isEqualTo(NOW);
        assertThat(created.getStage()).isZero();
    }

    @Test
    void addItemToUser_isIdempotent() {
        when(items.exists(5L)).thenReturn(true);
        when(progressRepo.findByUserIdAndItemId(42L, 5L)).thenReturn(Optional.of(progress(1L, 42L, NOW)));

        assertThat(reviewService.addItemToUser(42L, 5L)).isEmpty();

        verify(progressRepo, never()).saveAndFlush(any());
    }

    @Test
    void addItemToUser_uniqueViolationWithRereadableRowIsReportedAsExisting() {
        // only covers stores where the re-read still works after the failed insert;
        // in an aborted PostgreSQL transaction the re-read fails and the error propagates
        when(items.exists(5L)).thenReturn(true);
        when(progressRepo.findByUserIdAndItemId(42L, 5L))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(progress(1L, 42L, NOW)));
        when(progressRepo.saveAndFlush(any(ReviewProgressEntity.class)))
                .thenThrow(new DataIntegrityViolationException("uq_review_progress_user_item"));

        assertThat(reviewService.addItemToUser(42L, 5L)).isEmpty();
    }

    @Test
    void addItemToUser_integrityViolationWithoutExistingRowPropagates() {
        when(items.exists(5L)).thenReturn(true);
        when(progressRepo.findByUserIdAndItemId(42L, 5L)).thenReturn(Optional.empty());
        when(progressRepo.saveAndFlush(any(ReviewProgressEntity.class)))
                .thenThrow(new DataIntegrityViolationException("review_progress_item_id_fkey"));

        assertThatThrownBy(() -> reviewService.addItemToUser(42L, 5L))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void addItemToUser_unknownItemIsNotFound() {
        when(items.exists(999L)).thenReturn(false);

        assertThatThrownBy(() -> reviewService.addItemToUser(42L, 999L))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
        verifyNoInteractions(progressRepo);
    }

    @Test
    void removeItemFromUser_reportsWhetherRowExisted() {
        when(progressRepo.deleteByUserIdAndItemId(42L, 5L)).thenReturn(1);
        when(progressRepo.deleteByUserIdAndItemId(42L, 6L)).thenReturn(0);

        assertThat(reviewService.removeItemFromUser(42L, 5L)).isTrue();
        assertThat(reviewService.removeItemFromUser(42L, 6L)).isFalse();
    }

    private static ReviewProgressEntity progress(long id, long userId, Instant nextReviewAt) {
        ReviewProgressEntity p = new ReviewProgressEntity();
        p.setId(id);
        p.setUserId(userId);
        p.setItemId(id * 10);
        p.setEasinessFactor(2.5);
        p.setNextReviewAt(nextReviewAt);
        p.setCreatedAt(NOW.minus(Duration.ofDays(3)));
        return p;
    }
}
