package app.slowko.core.review.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-user counts over review progress rows. Mastered means stage 4 or 5, learning stages 1 to 3,
 * fresh stage 0.
 */
public record ReviewStats(
        long total,
        long dueNow,
        long mastered,
        long learning,
        @JsonProperty("new") long fresh
) {
    public static final ReviewStats EMPTY = new ReviewStats(0, 0, 0, 0, 0);
}
