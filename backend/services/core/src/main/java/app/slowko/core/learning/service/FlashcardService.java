package app.slowko.core.learning.service;

import app.slowko.core.learning.api.VocabularyCatalogPort;
import app.slowko.core.learning.api.VocabularyCatalogPort.VocabularyItemView;
import app.slowko.core.learning.config.LearningProps;
import app.slowko.core.learning.domain.FlashcardSelection;
import app.slowko.core.learning.domain.LearningStats;
import app.slowko.core.learning.entity.ExposureStatsEntity;
import app.slowko.core.learning.repository.ExposureStatsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class FlashcardService {

    private static final Logger log = LoggerFactory.getLogger(FlashcardService.class);

    private final ExposureStatsRepository statsRepo;
    private final VocabularyCatalogPort catalog;
    private final LearningProps props;
    private final Clock clock;

    public FlashcardService(ExposureStatsRepository statsRepo,
                            VocabularyCatalogPort catalog,
                            LearningProps props,
                            Clock clock) {
        this.statsRepo = statsRepo;
        this.catalog = catalog;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Picks the most urgent flashcard for the learner.
     * <p>
     * Candidates are visited by item id; the first one with the strictly highest priority wins.
     * Tracked candidates get their selection priority written back. An untracked winner is scored
     * {@link PriorityRanking#NEW_ITEM_PRIORITY} and gets its stats row created here, so whatever is
     * shown can receive feedback.
     *
     * @param excludeItemIds items already shown in the current round, may be {@code null}
     * @return empty when no eligible item is left
     */
    @Transactional
    public Optional<FlashcardSelection> selectNext(long userId, Collection<Long> excludeItemIds) {
        List<VocabularyItemView> candidates = new ArrayList<>(
                catalog.listByDifficulty(props.difficultyLevels(), excludeItemIds == null ? List.of() : excludeItemIds)
        );
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        candidates.sort(Comparator.comparingLong(VocabularyItemView::itemId));

        List<Long> itemIds = candidates.stream().map(VocabularyItemView::itemId).toList();
        Map<Long, ExposureStatsEntity> statsByItem = statsRepo.findByUserIdAndItemIdIn(userId, itemIds).stream()
                .collect(Collectors.toMap(ExposureStatsEntity::getItemId, Function.identity()));

        Instant now = clock.instant();
        List<ExposureStatsEntity> touched = new ArrayList<>(statsByItem.size() + 1);

        VocabularyItemView best = null;
        double bestPriority = Double.NEGATIVE_INFINITY;
        for (VocabularyItemView candidate : candidates) {
            ExposureStatsEntity stats = statsByItem.get(candidate.itemId());
            double priority;
            if (stats == null) {
                priority = PriorityRanking.NEW_ITEM_PRIORITY;
            } else {
                priority = PriorityRanking.selectionPriority(
                        stats.getKnowCount(),
                        stats.getDontKnowCount(),
                        stats.getLastShownAt(),
                        now
                );
                stats.setPriorityScore(priority);
                stats.setUpdatedAt(now);
                touched.add(stats);
            }

            if (priority > bestPriority) {
                best = candidate;
                bestPriority = priority;
            }
        }

        ExposureStatsEntity bestStats = statsByItem.get(best.itemId());
        if (bestStats == null) {
            bestStats = newStats(userId, best.itemId(), now);
            touched.add(bestStats);
        }

        statsRepo.saveAll(touched);

        log.debug("User {} next flashcard: item {} with priority {} out of {} candidates",
                userId, best.itemId(), bestPriority, candidates.size());

        return Optional.of(new FlashcardSelection(best, bestStats, bestPriority));
    }

    /**
     * Records whether the learner knew the word. Unknown ids are ignored.
     *
     * @return the updated stats, empty when the id is unknown
     */
    @Transactional
    public Optional<ExposureStatsEntity> recordFeedback(long statsId, boolean knowsWord) {
        return updateStats(statsId, null, knowsWord);
    }

    /**
     * Same as {@link #recordFeedback(long, boolean)} but stats owned by another learner count as unknown.
     */
    @Transactional
    public Optional<ExposureStatsEntity> recordFeedback(long userId, long statsId, boolean knowsWord) {
        return updateStats(statsId, Long.valueOf(userId), knowsWord);
    }

    private Optional<ExposureStatsEntity> updateStats(long statsId, Long ownerId, boolean knowsWord) {
        Optional<ExposureStatsEntity> found = statsRepo.findByIdForUpdate(statsId)
                .filter(s -> ownerId == null || s.getUserId() == ownerId);
        if (found.isEmpty()) {
            log.debug("Ignoring feedback for unknown exposure stats {}", statsId);
            return Optional.empty();
        }

        ExposureStatsEntity stats = found.get();
        Instant now = clock.instant();

        if (knowsWord) {
            stats.setKnowCount(stats.getKnowCount() + 1);
        } else {
            stats.setDontKnowCount(stats.getDontKnowCount() + 1);
        }
        stats.setLastShownAt(now);
        stats.setPriorityScore(PriorityRanking.feedbackPriority(stats.getKnowCount(), stats.getDontKnowCount()));
        stats.setUpdatedAt(now);

        return Optional.of(statsRepo.save(stats));
    }

    /**
     * Starts tracking an item picked from the vocabulary browser, regardless of its level.
     *
     * @return the new stats, empty if the item is already tracked
     * @throws ResponseStatusException with 404 if the item is not in the vocabulary
     */
    @Transactional
    public Optional<ExposureStatsEntity> addToLearning(long userId, long itemId) {
        if (!catalog.exists(itemId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Vocabulary item " + itemId + " not found");
        }
        if (statsRepo.findByUserIdAndItemId(userId, itemId).isPresent()) {
            return Optional.empty();
        }
        try {
            return Optional.of(statsRepo.saveAndFlush(newStats(userId, itemId, clock.instant())));
        } catch (DataIntegrityViolationException ex) {
            if (statsRepo.findByUserIdAndItemId(userId, itemId).isPresent()) {
                return Optional.empty();
            }
            throw ex;
        }
    }

    @Transactional
    public boolean removeFromLearning(long userId, long itemId) {
        return statsRepo.deleteByUserIdAndItemId(userId, itemId) > 0;
    }

    @Transactional(readOnly = true)
    public LearningStats getLearningStats(long userId) {
        var counts = statsRepo.countByKnowledge(userId);
        if (counts == null || counts.getTotal() == 0) {
            return LearningStats.EMPTY;
        }
        long total = counts.getTotal();
        long known = counts.getKnown();
        long withFeedback = counts.getWithFeedback();

        long available = catalog.countByDifficulty(props.difficultyLevels());
        long fresh = Math.max(0, available - total);

        return new LearningStats(total, known, Math.max(0, withFeedback - known), fresh);
    }

    private static ExposureStatsEntity newStats(long userId, long itemId, Instant now) {
        ExposureStatsEntity stats = new ExposureStatsEntity();
        stats.setUserId(userId);
        stats.setItemId(itemId);
        stats.setKnowCount(0);
        stats.setDontKnowCount(0);
        stats.setLastShownAt(null);
        stats.setPriorityScore(PriorityRanking.NEW_ITEM_PRIORITY);
        stats.setCreatedAt(now);
        stats.setUpdatedAt(now);
        return stats;
    }
}
