package app.slowko.core.learning.domain;

/**
 * Flashcard progress of a learner. {@code newWords} counts eligible catalog items without stats,
 * and is zero until the learner has seen a first flashcard.
 */
public record LearningStats(
        long totalWords,
        long knownWords,
        long learningWords,
        long newWords
) {
    public static final LearningStats EMPTY = new LearningStats(0, 0, 0, 0);
}
