package app.slowko.core.learning.controller.dto;

import app.slowko.core.learning.entity.ExposureStatsEntity;
import app.slowko.core.learning.service.PriorityRanking;

import java.time.Instant;

public record ExposureStatsResponse(
        long statsId,
        long itemId,
        int knowCount,
        int dontKnowCount,
        Instant lastShownAt,
        double priorityScore,
        boolean mastered
) {
    public static ExposureStatsResponse from(ExposureStatsEntity s) {
        return new ExposureStatsResponse(
                s.getId(),
                s.getItemId(),
                s.getKnowCount(),
                s.getDontKnowCount(),
                s.getLastShownAt(),
                s.getPriorityScore(),
                PriorityRanking.isMastered(s.getKnowCount(), s.getDontKnowCount())
        );
    }
}
