package info.isaksson.erland.tokenexport.classify;

public enum Confidence {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    /** Numeric grade for sorting and filtering. */
    public final int score;

    Confidence(int score) {
        this.score = score;
    }
}
