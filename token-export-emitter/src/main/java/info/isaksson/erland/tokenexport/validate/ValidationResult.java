package info.isaksson.erland.tokenexport.validate;

import java.util.ArrayList;
import java.util.List;

/**
 * Errors and warnings of one validation run. Valid iff there are no errors.
 */
public final class ValidationResult {
    public final boolean valid;
    public final List<ValidationError> errors;
    public final List<ValidationWarning> warnings;

    public ValidationResult(List<ValidationError> errors, List<ValidationWarning> warnings) {
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.valid = this.errors.isEmpty();
    }

    public static ValidationResult ok() {
        return new ValidationResult(List.of(), List.of());
    }

    /** Concatenates both lists, keeping order. */
    public ValidationResult merge(ValidationResult other) {
        if (other == null) return this;
        List<ValidationError> e = new ArrayList<>(errors);
        e.addAll(other.errors);
        List<ValidationWarning> w = new ArrayList<>(warnings);
        w.addAll(other.warnings);
        return new ValidationResult(e, w);
    }

    @Override public String toString() {
        return "ValidationResult{valid=" + valid + ", errors=" + errors.size() + ", warnings=" + warnings.size() + "}";
    }
}
