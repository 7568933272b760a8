package app.slowko.core.review.algorithm;

public record Sm2Schedule(
        int intervalDays,
        double easinessFactor,
        int repetitions
) {
    public static final int MAX_STAGE = 5;

    public int stage() {
        return Math.min(MAX_STAGE, repetitions);
    }
}
