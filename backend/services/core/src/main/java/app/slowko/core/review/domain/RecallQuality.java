package app.slowko.core.review.domain;

/**
 * SuperMemo-2 recall grade.
 */
public enum RecallQuality {
    BLACKOUT(0),
    INCORRECT_FAMILIAR(1),
    INCORRECT_REMEMBERED(2),
    CORRECT_DIFFICULT(3),
    CORRECT_HESITANT(4),
    PERFECT(5);

    public static final int PASSING_CODE = 3;

    private final int code;

    RecallQuality(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isLapse() {
        return code < PASSING_CODE;
    }

    public static RecallQuality fromCode(int code) {
        for (RecallQuality q : values()) {
            if (q.code == code) return q;
        }
        throw new IllegalArgumentException("Recall quality must be between 0 and 5, got " + code);
    }

    /**
     * Grade for a multiple-choice answer where only right or wrong is known.
     */
    public static RecallQuality forAnswer(boolean correct) {
        return correct ? CORRECT_HESITANT : INCORRECT_FAMILIAR;
    }
}
