package app.slowko.core.review.controller.dto;

import app.slowko.core.review.entity.ReviewProgressEntity;

import java.time.Instant;

public record ReviewProgressResponse(
        long progressId,
        long itemId,
        int stage,
        int repetitions,
        double easinessFactor,
        int intervalDays,
        Instant nextReviewAt,
        int lastQuality,
        Instant lastReviewedAt,
        int timesReviewed,
        int timesCorrect,
        int timesWrong
) {
    public static ReviewProgressResponse from(ReviewProgressEntity p) {
        return new ReviewProgressResponse(
                p.getId(),
                p.getItemId(),
                p.getStage(),
                p.getRepetitions(),
                p.getEasinessFactor(),
                p.getIntervalDays(),
                p.getNextReviewAt(),
                p.getLastQuality(),
                p.getLastReviewedAt(),
                p.getTimesReviewed(),
                p.getTimesCorrect(),
                p.getTimesWrong()
        );
    }
}
