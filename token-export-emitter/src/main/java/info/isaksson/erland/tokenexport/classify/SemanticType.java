package info.isaksson.erland.tokenexport.classify;

/**
 * Semantic token type inferred for a variable value.
 */
public enum SemanticType {
    ALIAS(null),
    COLOR("color"),
    DIMENSION("dimension"),
    OPACITY("number"),
    FONT_WEIGHT("fontWeight"),
    DURATION("duration"),
    MULTIPLIER("number"),
    FONT_FAMILY("fontFamily"),
    NUMBER("number"),
    STRING("string");

    /** {@code $type} tag written to canonical documents; null for aliases (they take the target's type). */
    public final String canonicalType;

    SemanticType(String canonicalType) {
        this.canonicalType = canonicalType;
    }
}
