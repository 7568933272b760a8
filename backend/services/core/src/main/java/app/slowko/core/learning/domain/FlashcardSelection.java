package app.slowko.core.learning.domain;

import app.slowko.core.learning.api.VocabularyCatalogPort.VocabularyItemView;
import app.slowko.core.learning.entity.ExposureStatsEntity;

public record FlashcardSelection(
        VocabularyItemView item,
        ExposureStatsEntity stats,
        double priority
) {
}
