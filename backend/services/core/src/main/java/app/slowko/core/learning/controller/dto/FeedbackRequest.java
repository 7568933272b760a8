package app.slowko.core.learning.controller.dto;

import jakarta.validation.constraints.NotNull;

public record FeedbackRequest(
        @NotNull Boolean knowsWord
) {}
