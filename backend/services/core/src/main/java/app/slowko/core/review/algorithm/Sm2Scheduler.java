package app.slowko.core.review.algorithm;

import app.slowko.core.review.config.SrsProps;
import app.slowko.core.review.domain.RecallQuality;
import org.springframework.stereotype.Component;

/**
 * SuperMemo-2 schedule computation. Stateless and deterministic.
 */
@Component
public class Sm2Scheduler {

    private final SrsProps props;

    public Sm2Scheduler(SrsProps props) {
        this.props = props;
    }

    /**
     * Computes the schedule that follows a review graded {@code quality}.
     * <p>
     * A lapse (quality below 3) resets repetitions and interval. A successful recall picks the
     * interval from the repetition count before the review: the initial interval, then the
     * graduation interval, then the previous interval scaled by the previous easiness factor.
     * The easiness factor is updated on every review and never drops below the configured floor.
     * <p>
     * An easiness factor below the floor, e.g. after the floor was raised in configuration, is
     * lifted to the floor before use.
     *
     * @throws IllegalArgumentException if quality is outside 0..5 or repetitions or interval are negative
     */
    public Sm2Schedule computeNextSchedule(int quality, int repetitions, double easinessFactor, int intervalDays) {
        RecallQuality grade = RecallQuality.fromCode(quality);
        if (repetitions < 0) {
            throw new IllegalArgumentException("Repetitions must not be negative, got " + repetitions);
        }
        if (intervalDays < 0) {
            throw new IllegalArgumentException("Interval must not be negative, got " + intervalDays);
        }
        if (Double.isNaN(easinessFactor) || Double.isInfinite(easinessFactor)) {
            throw new IllegalArgumentException("Easiness factor must be finite, got " + easinessFactor);
        }

        double floor = props.minimumEasinessFactor();
        double ef = Math.max(floor, easinessFactor);

        int nextInterval;
        int nextRepetitions;
        if (grade.isLapse()) {
            nextInterval = 0;
            nextRepetitions = 0;
        } else {
            if (repetitions == 0) {
                nextInterval = props.initialIntervalDays();
            } else if (repetitions == 1) {
                nextInterval = props.graduationIntervalDays();
            } else {
                // half-even, so 12.5 days becomes 12
                nextInterval = (int) Math.rint(intervalDays * ef);
            }
            nextInterval = cap(nextInterval);
            nextRepetitions = repetitions + 1;
        }

        int distance = 5 - grade.code();
        double nextEf = ef + (0.1 - distance * (0.08 + distance * 0.02));
        nextEf = Math.max(floor, nextEf);

        return new Sm2Schedule(nextInterval, nextEf, nextRepetitions);
    }

    public double initialEasinessFactor() {
        return props.initialEasinessFactor();
    }

    private int cap(int interval) {
        Integer max = props.maximumIntervalDays();
        if (max == null) {
            return interval;
        }
        return Math.min(max, interval);
    }
}
