package app.slowko.core.learning.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * @param difficultyLevels vocabulary levels offered in flashcard learning
 */
@ConfigurationProperties(prefix = "app.learning")
public record LearningProps(
        List<String> difficultyLevels
) {
    public static final List<String> DEFAULT_DIFFICULTY_LEVELS = List.of("A1", "A2");

    public LearningProps {
        difficultyLevels = (difficultyLevels == null || difficultyLevels.isEmpty())
                ? DEFAULT_DIFFICULTY_LEVELS
                : List.copyOf(difficultyLevels);
    }

    public static LearningProps defaults() {
        return new LearningProps(null);
    }
}
