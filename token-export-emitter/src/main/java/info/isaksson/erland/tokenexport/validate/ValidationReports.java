package info.isaksson.erland.tokenexport.validate;

/**
 * Plain-text rendering of a {@link ValidationResult}.
 */
public final class ValidationReports {

    private ValidationReports() {}

    public static String format(ValidationResult result) {
        if (result == null) return "";
        StringBuilder sb = new StringBuilder();
        if (result.valid && result.warnings.isEmpty()) {
            return "Validation passed with no issues";
        }

        if (!result.errors.isEmpty()) {
            sb.append("Validation failed with ").append(result.errors.size()).append(" error(s):\n\n");
            for (ValidationError e : result.errors) {
                sb.append("  [").append(e.code).append("] ").append(e.message).append("\n");
                if (e.path != null) sb.append("    Path: ").append(e.path).append("\n");
                if (e.value != null) sb.append("    Value: ").append(e.value).append("\n");
            }
        }

        if (!result.warnings.isEmpty()) {
            if (!result.errors.isEmpty()) sb.append("\n");
            sb.append(result.warnings.size()).append(" warning(s):\n\n");
            for (ValidationWarning w : result.warnings) {
                sb.append("  [").append(w.code).append("] ").append(w.message).append("\n");
                if (w.path != null) sb.append("    Path: ").append(w.path).append("\n");
                if (w.suggestion != null) sb.append("    Suggestion: ").append(w.suggestion).append("\n");
            }
        }
        return sb.toString().stripTrailing();
    }
}
