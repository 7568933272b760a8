package app.slowko.core.review.api;

import java.time.Instant;

/**
 * Published when a learner has reviews waiting. The chat layer listens and decides whether to
 * send a reminder.
 */
public record DueReviewsAvailableEvent(
        long userId,
        long dueCount,
        Instant checkedAt
) {
}
