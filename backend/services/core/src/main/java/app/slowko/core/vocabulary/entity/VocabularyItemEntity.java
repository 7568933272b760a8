package app.slowko.core.vocabulary.entity;

import jakarta.persistence.*;

@Entity
@Table(name = "vocabulary_items", schema = "slowko")
public class VocabularyItemEntity {

    @Id
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "word", nullable = false)
    private String word;

    @Column(name = "translation_ua", nullable = false)
    private String translationUa;

    @Column(name = "translation_ru", nullable = false)
    private String translationRu;

    @Column(name = "context_sentence")
    private String contextSentence;

    @Column(name = "example_sentence")
    private String exampleSentence;

    @Column(name = "difficulty_level", nullable = false)
    private String difficultyLevel;

    @Column(name = "category")
    private String category;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getWord() {
        return word;
    }

    public void setWord(String word) {
        this.word = word;
    }

    public String getTranslationUa() {
        return translationUa;
    }

    public void setTranslationUa(String translationUa) {
        this.translationUa = translationUa;
    }

    public String getTranslationRu() {
        return translationRu;
    }

    public void setTranslationRu(String translationRu) {
        this.translationRu = translationRu;
    }

    public String getContextSentence() {
        return contextSentence;
    }

    public void setContextSentence(String contextSentence) {
        this.contextSentence = contextSentence;
    }

    public String getExampleSentence() {
        return exampleSentence;
    }

    public void setExampleSentence(String exampleSentence) {
        this.exampleSentence = exampleSentence;
    }

    public String getDifficultyLevel() {
        return difficultyLevel;
    }

    public void setDifficultyLevel(String difficultyLevel) {
        this.difficultyLevel = difficultyLevel;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }
}
