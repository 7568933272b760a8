package app.slowko.core.learning.controller.dto;

import app.slowko.core.learning.domain.FlashcardSelection;
import app.slowko.core.learning.entity.ExposureStatsEntity;

public record FlashcardResponse(
        long statsId,
        long itemId,
        String word,
        String translationUa,
        String translationRu,
        String exampleSentence,
        String difficultyLevel,
        String category,
        int knowCount,
        int dontKnowCount,
        double priority
) {
    public static FlashcardResponse from(FlashcardSelection selection) {
        var item = selection.item();
        ExposureStatsEntity stats = selection.stats();
        return new FlashcardResponse(
                stats.getId() == null ? 0L : stats.getId(),
                item.itemId(),
                item.word(),
                item.translationUa(),
                item.translationRu(),
                item.exampleSentence(),
                item.difficultyLevel(),
                item.category(),
                stats.getKnowCount(),
                stats.getDontKnowCount(),
                selection.priority()
        );
    }
}
