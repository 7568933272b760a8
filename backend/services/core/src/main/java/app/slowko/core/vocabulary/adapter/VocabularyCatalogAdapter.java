package app.slowko.core.vocabulary.adapter;

import app.slowko.core.learning.api.VocabularyCatalogPort;
import app.slowko.core.review.api.ReviewItemPort;
import app.slowko.core.vocabulary.entity.VocabularyItemEntity;
import app.slowko.core.vocabulary.repository.VocabularyItemRepository;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class VocabularyCatalogAdapter implements VocabularyCatalogPort, ReviewItemPort {

    private final VocabularyItemRepository repository;

    public VocabularyCatalogAdapter(VocabularyItemRepository repository) {
        this.repository = repository;
    }

    @Override
    public List<VocabularyItemView> listByDifficulty(Collection<String> difficultyLevels, Collection<Long> excludeItemIds) {
        if (difficultyLevels == null || difficultyLevels.isEmpty()) {
            return List.of();
        }

        // "not in ()" is not portable, so the unfiltered query covers the empty case
        List<VocabularyItemEntity> items = (excludeItemIds == null || excludeItemIds.isEmpty())
                ? repository.findByDifficultyLevelInOrderByIdAsc(difficultyLevels)
                : repository.findEligibleExcluding(difficultyLevels, excludeItemIds);

        return items.stream()
                .map(VocabularyCatalogAdapter::toView)
                .toList();
    }

    @Override
    public long countByDifficulty(Collection<String> difficultyLevels) {
        if (difficultyLevels == null || difficultyLevels.isEmpty()) {
            return 0;
        }
        return repository.countByDifficultyLevelIn(difficultyLevels);
    }

    @Override
    public boolean exists(long itemId) {
        return repository.existsById(itemId);
    }

    private static VocabularyItemView toView(VocabularyItemEntity e) {
        return new VocabularyItemView(
                e.getId(),
                e.getWord(),
                e.getTranslationUa(),
                e.getTranslationRu(),
                e.getExampleSentence(),
                e.getDifficultyLevel(),
                e.getCategory()
        );
    }
}
