package app.slowko.core.learning.api;

import java.util.Collection;
import java.util.List;

public interface VocabularyCatalogPort {

    record VocabularyItemView(
            long itemId,
            String word,
            String translationUa,
            String translationRu,
            String exampleSentence,
            String difficultyLevel,
            String category
    ) {}

    /**
     * Items of the given difficulty levels, ordered by item id ascending.
     */
    List<VocabularyItemView> listByDifficulty(Collection<String> difficultyLevels, Collection<Long> excludeItemIds);

    long countByDifficulty(Collection<String> difficultyLevels);

    boolean exists(long itemId);
}
