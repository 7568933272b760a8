package app.slowko.core.review.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning of the SM-2 scheduler and the review session.
 *
 * @param minimumEasinessFactor  floor for the easiness factor
 * @param initialEasinessFactor  easiness assigned to newly enrolled items
 * @param initialIntervalDays    interval after the first successful recall
 * @param graduationIntervalDays interval after the second successful recall
 * @param maximumIntervalDays    optional ceiling for the interval, {@code null} leaves growth unbounded
 * @param maxItemsPerSession     default size of a due-review batch
 */
@ConfigurationProperties(prefix = "app.srs")
public record SrsProps(
        Double minimumEasinessFactor,
        Double initialEasinessFactor,
        Integer initialIntervalDays,
        Integer graduationIntervalDays,
        Integer maximumIntervalDays,
        Integer maxItemsPerSession
) {
    public static final double DEFAULT_MINIMUM_EASINESS_FACTOR = 1.3;
    public static final double DEFAULT_INITIAL_EASINESS_FACTOR = 2.5;
    public static final int DEFAULT_INITIAL_INTERVAL_DAYS = 1;
    public static final int DEFAULT_GRADUATION_INTERVAL_DAYS = 6;
    public static final int DEFAULT_MAX_ITEMS_PER_SESSION = 10;

    public SrsProps {
        if (minimumEasinessFactor == null) minimumEasinessFactor = DEFAULT_MINIMUM_EASINESS_FACTOR;
        if (initialEasinessFactor == null) initialEasinessFactor = DEFAULT_INITIAL_EASINESS_FACTOR;
        if (initialIntervalDays == null) initialIntervalDays = DEFAULT_INITIAL_INTERVAL_DAYS;
        if (graduationIntervalDays == null) graduationIntervalDays = DEFAULT_GRADUATION_INTERVAL_DAYS;
        if (maxItemsPerSession == null || maxItemsPerSession <= 0) maxItemsPerSession = DEFAULT_MAX_ITEMS_PER_SESSION;
        if (maximumIntervalDays != null && maximumIntervalDays <= 0) maximumIntervalDays = null;

        if (initialEasinessFactor < minimumEasinessFactor) {
            throw new IllegalArgumentException("app.srs.initial-easiness-factor must not be below app.srs.minimum-easiness-factor");
        }
        if (initialIntervalDays < 0 || graduationIntervalDays < 0) {
            throw new IllegalArgumentException("app.srs intervals must not be negative");
        }
    }

    public static SrsProps defaults() {
        return new SrsProps(null, null, null, null, null, null);
    }
}
