package app.slowko.core.review.service;

import app.slowko.core.review.algorithm.Sm2Schedule;
import app.slowko.core.review.algorithm.Sm2Scheduler;
import app.slowko.core.review.api.ReviewItemPort;
import app.slowko.core.review.config.SrsProps;
import app.slowko.core.review.domain.RecallQuality;
import app.slowko.core.review.entity.ReviewProgressEntity;
import app.slowko.core.review.repository.ReviewProgressRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewProgressRepository progressRepo;
    private final ReviewItemPort items;
    private final Sm2Scheduler scheduler;
    private final SrsProps props;
    private final Clock clock;

    public ReviewService(ReviewProgressRepository progressRepo,
                         ReviewItemPort items,
                         Sm2Scheduler scheduler,
                         SrsProps props,
                         Clock clock) {
        this.progressRepo = progressRepo;
        this.items = items;
        this.scheduler = scheduler;
        this.props = props;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<ReviewProgressEntity> getDueItems(long userId) {
        return getDueItems(userId, null);
    }

    /**
     * Items whose next review time has passed, most overdue first.
     *
     * @param limit batch size, {@code null} falls back to {@code app.srs.max-items-per-session}
     */
    @Transactional(readOnly = true)
    public List<ReviewProgressEntity> getDueItems(long userId, Integer limit) {
        int size = (limit == null) ? props.maxItemsPerSession() : limit;
        if (size <= 0) {
            throw new IllegalArgumentException("Limit must be positive, got " + size);
        }
        Instant now = clock.instant();
        return progressRepo.findDue(userId, now, PageRequest.of(0, size));
    }

    /**
     * Reschedules a reviewed item. Unknown ids are ignored since the caller may hold a stale id.
     *
     * @return the updated row, empty when the id is unknown
     */
    @Transactional
    public Optional<ReviewProgressEntity> applyAnswer(long progressId, int quality, boolean wasCorrect) {
        return answerProgress(progressId, null, quality, wasCorrect);
    }

    /**
     * Same as {@link #applyAnswer(long, int, boolean)} but progress owned by another learner counts as unknown.
     */
    @Transactional
    public Optional<ReviewProgressEntity> applyAnswer(long userId, long progressId, int quality, boolean wasCorrect) {
        return answerProgress(progressId, Long.valueOf(userId), quality, wasCorrect);
    }

    private Optional<ReviewProgressEntity> answerProgress(long progressId, Long ownerId, int quality, boolean wasCorrect) {
        RecallQuality grade = RecallQuality.fromCode(quality);

        Optional<ReviewProgressEntity> found = progressRepo.findByIdForUpdate(progressId)
                .filter(p -> ownerId == null || p.getUserId() == ownerId);
        if (found.isEmpty()) {
            log.debug("Ignoring answer for unknown review progress {}", progressId);
            return Optional.empty();
        }

        ReviewProgressEntity progress = found.get();
        Instant now = clock.instant();

        Sm2Schedule schedule = scheduler.computeNextSchedule(
                grade.code(),
                progress.getRepetitions(),
                progress.getEasinessFactor(),
                progress.getIntervalDays()
        );

        progress.setLastQuality(grade.code());
        progress.setIntervalDays(schedule.intervalDays());
        progress.setEasinessFactor(schedule.easinessFactor());
        progress.setRepetitions(schedule.repetitions());
        progress.setNextReviewAt(now.plus(schedule.intervalDays(), ChronoUnit.DAYS));
        progress.setLastReviewedAt(now);
        progress.setTimesReviewed(progress.getTimesReviewed() + 1);
        if (wasCorrect) {
            progress.setTimesCorrect(progress.getTimesCorrect() + 1);
        } else {
            progress.setTimesWrong(progress.getTimesWrong() + 1);
        }
        progress.setStage(schedule.stage());

        log.debug("Progress {} graded {}: interval={}d ef={} reps={}",
                progressId, grade.code(), schedule.intervalDays(), schedule.easinessFactor(), schedule.repetitions());

        return Optional.of(progressRepo.save(progress));
    }

    /**
     * Answer where only right or wrong is known, graded with {@link RecallQuality#forAnswer(boolean)}.
     */
    @Transactional
    public Optional<ReviewProgressEntity> applyAnswer(long progressId, boolean wasCorrect) {
        return answerProgress(progressId, null, RecallQuality.forAnswer(wasCorrect).code(), wasCorrect);
    }

    /**
     * Enrols an item into full scheduling, due immediately.
     *
     * @return the new row, empty if the user already tracks the item
     * @throws ResponseStatusException with 404 if the item is not in the vocabulary
     */
    @Transactional
    public Optional<ReviewProgressEntity> addItemToUser(long userId, long itemId) {
        if (!items.exists(itemId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Vocabulary item " + itemId + " not found");
        }
        if (progressRepo.findByUserIdAndItemId(userId, itemId).isPresent()) {
            return Optional.empty();
        }

        try {
            return Optional.of(progressRepo.saveAndFlush(newProgress(userId, itemId, clock.instant())));
        } catch (DataIntegrityViolationException ex) {
            // concurrent enrolment of the same pair won the unique constraint
            if (progressRepo.findByUserIdAndItemId(userId, itemId).isPresent()) {
                return Optional.empty();
            }
            throw ex;
        }
    }

    @Transactional
    public boolean removeItemFromUser(long userId, long itemId) {
        return progressRepo.deleteByUserIdAndItemId(userId, itemId) > 0;
    }

    private ReviewProgressEntity newProgress(long userId, long itemId, Instant now) {
        ReviewProgressEntity progress = new ReviewProgressEntity();
        progress.setUserId(userId);
        progress.setItemId(itemId);
        progress.setStage(0);
        progress.setRepetitions(0);
        progress.setEasinessFactor(scheduler.initialEasinessFactor());
        progress.setIntervalDays(0);
        progress.setNextReviewAt(now);
        progress.setLastQuality(0);
        progress.setLastReviewedAt(null);
        progress.setTimesReviewed(0);
        progress.setTimesCorrect(0);
        progress.setTimesWrong(0);
        progress.setCreatedAt(now);
        return progress;
    }
}
