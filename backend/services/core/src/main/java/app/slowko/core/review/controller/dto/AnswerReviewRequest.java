package app.slowko.core.review.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * @param quality recall grade 0..5; when absent it is derived from {@code correct}
 * @param correct whether the chosen answer was right
 */
public record AnswerReviewRequest(
        @Min(0) @Max(5) Integer quality,
        @NotNull Boolean correct
) {}
