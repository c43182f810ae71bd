package info.isaksson.erland.tokenexport.classify;

import java.util.Objects;

/** Outcome of {@link TypeClassifier#classify}. Not persisted. */
public final class ClassificationResult {
    public final SemanticType semanticType;
    public final Confidence confidence;
    public final String reason;

    /** Optional. */
    public final SchemaHint schemaHint;

    public ClassificationResult(SemanticType semanticType, Confidence confidence, String reason, SchemaHint schemaHint) {
        this.semanticType = Objects.requireNonNull(semanticType, "semanticType must not be null");
        this.confidence = Objects.requireNonNull(confidence, "confidence must not be null");
        this.reason = reason == null ? "" : reason;
        this.schemaHint = schemaHint;
    }

    public static ClassificationResult of(SemanticType type, Confidence confidence, String reason) {
        return new ClassificationResult(type, confidence, reason, null);
    }

    public static ClassificationResult of(SemanticType type, Confidence confidence, String reason, SchemaHint hint) {
        return new ClassificationResult(type, confidence, reason, hint);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassificationResult)) return false;
        ClassificationResult that = (ClassificationResult) o;
        return semanticType == that.semanticType &&
                confidence == that.confidence &&
                Objects.equals(reason, that.reason) &&
                schemaHint == that.schemaHint;
    }

    @Override public int hashCode() {
        return Objects.hash(semanticType, confidence, reason, schemaHint);
    }

    @Override public String toString() {
        return "ClassificationResult{" + semanticType + "/" + confidence +
                (schemaHint == null ? "" : " hint=" + schemaHint.tag) +
                " reason='" + reason + "'}";
    }
}
