package app.slowko.core.learning.service;

import java.time.Duration;
import java.time.Instant;

/**
 * Urgency scores for first-pass flashcard learning. Higher means show sooner.
 * <p>
 * Selection and feedback use two separate curves: selection favours items not shown for a while,
 * feedback escalates items the learner keeps missing. They are tuned independently.
 */
public final class PriorityRanking {

    public static final double NEW_ITEM_PRIORITY = 100.0;
    public static final double MIN_FEEDBACK_PRIORITY = 1.0;
    public static final double MASTERY_DISCOUNT = 50.0;
    public static final int MASTERY_KNOW_COUNT = 3;

    private PriorityRanking() {
    }

    /**
     * Score recomputed when an already tracked item competes for the next slot.
     * {@code lastShownAt == null} counts as shown today.
     */
    public static double selectionPriority(int knowCount, int dontKnowCount, Instant lastShownAt, Instant now) {
        long daysSinceShown = daysSince(lastShownAt, now);
        double priority = dontKnowCount * 3.0
                - knowCount * 1.0
                + daysSinceShown * 2.0
                + 10.0;
        return Math.max(0.0, priority);
    }

    /**
     * Score stored right after the learner said whether they know the item.
     */
    public static double feedbackPriority(int knowCount, int dontKnowCount) {
        double mistakeBonus = Math.pow(dontKnowCount, 1.5) * 20;
        double knowledgePenalty = Math.pow(knowCount, 0.8) * 8;
        if (isMastered(knowCount, dontKnowCount)) {
            knowledgePenalty += MASTERY_DISCOUNT;
        }
        return Math.max(MIN_FEEDBACK_PRIORITY, NEW_ITEM_PRIORITY + mistakeBonus - knowledgePenalty);
    }

    /**
     * A single "don't know" revokes mastery for good.
     */
    public static boolean isMastered(int knowCount, int dontKnowCount) {
        return knowCount >= MASTERY_KNOW_COUNT && dontKnowCount == 0;
    }

    static long daysSince(Instant lastShownAt, Instant now) {
        if (lastShownAt == null || !lastShownAt.isBefore(now)) {
            return 0;
        }
        return Duration.between(lastShownAt, now).toDays();
    }
}
