package info.isaksson.erland.tokenexport.validate;

import com.fasterxml.jackson.databind.JsonNode;
import info.isaksson.erland.tokenexport.classify.SchemaHint;
import info.isaksson.erland.tokenexport.token.CanonicalToken;
import info.isaksson.erland.tokenexport.token.DesignToken;
import info.isaksson.erland.tokenexport.token.ExtendedSchemas;
import info.isaksson.erland.tokenexport.token.ExtendedToken;
import info.isaksson.erland.tokenexport.token.SchemaKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Checks constructed tokens against the structural rules of their output schema.
 *
 * <p>Never throws. Every problem ends up in the returned {@link ValidationResult}.</p>
 */
public final class TokenStructureValidator {

    public static final int MAX_DESCRIPTION_LENGTH = 500;

    /** Canonical {@code $type} tags this exporter knows about. */
    public static final Set<String> KNOWN_TYPES = Set.of(
            "color", "dimension", "fontFamily", "fontWeight", "duration", "cubicBezier",
            "number", "string", "strokeStyle", "border", "transition", "shadow", "gradient", "typography");

    private static final Pattern UUID = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private final boolean requireStableId;

    public TokenStructureValidator() {
        this(true);
    }

    /**
     * @param requireStableId when false an extended token without {@code uuid} is accepted
     */
    public TokenStructureValidator(boolean requireStableId) {
        this.requireStableId = requireStableId;
    }

    public ValidationResult validateToken(String name, DesignToken token, SchemaKind schemaKind) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        try {
            if (token == null) {
                errors.add(new ValidationError("MISSING_VALUE", "Token is missing", name));
            } else if (schemaKind == SchemaKind.CANONICAL && token instanceof CanonicalToken) {
                validateCanonical(name, (CanonicalToken) token, errors, warnings);
            } else if (schemaKind == SchemaKind.EXTENDED && token instanceof ExtendedToken) {
                validateExtended(name, (ExtendedToken) token, errors, warnings);
            } else {
                errors.add(new ValidationError("SCHEMA_MISMATCH",
                        "Token of kind " + token.schemaKind() + " validated as " + schemaKind, name));
            }
        } catch (RuntimeException e) {
            errors.add(new ValidationError("VALIDATION_FAILED",
                    "Validation failed: " + e.getMessage(), name));
        }
        return new ValidationResult(errors, warnings);
    }

    /** Validates every entry; one bad token never hides the others. */
    public ValidationResult validateTokens(Map<String, ? extends DesignToken> tokens, SchemaKind schemaKind) {
        ValidationResult all = ValidationResult.ok();
        if (tokens == null) return all;
        for (Map.Entry<String, ? extends DesignToken> e : tokens.entrySet()) {
            all = all.merge(validateToken(e.getKey(), e.getValue(), schemaKind));
        }
        return all;
    }

    private void validateCanonical(String name, CanonicalToken token,
                                   List<ValidationError> errors, List<ValidationWarning> warnings) {
        JsonNode value = token.value;
        if (value == null || value.isNull() || value.isMissingNode()) {
            errors.add(new ValidationError("MISSING_VALUE", "Token is missing $value", name));
            return;
        }

        String type = token.type;
        if (type != null) {
            if (!KNOWN_TYPES.contains(type)) {
                warnings.add(new ValidationWarning("UNKNOWN_TYPE", "Unknown token type: " + type, name,
                        "Use one of " + String.join(", ", new TreeSet<>(KNOWN_TYPES))));
            } else if (!ValuePredicates.isReference(value)) {
                if (token.schemaHint == SchemaHint.OPACITY) {
                    if (!ValuePredicates.isValidOpacity(value)) {
                        errors.add(new ValidationError("INVALID_OPACITY", "Opacity must be a number between 0 and 1",
                                name, value.toString()));
                    }
                } else {
                    checkTypedValue(name, type, value, errors);
                }
            }
        }

        if (token.description != null && token.description.length() > MAX_DESCRIPTION_LENGTH) {
            warnings.add(new ValidationWarning("LONG_DESCRIPTION",
                    "Description exceeds " + MAX_DESCRIPTION_LENGTH + " characters", name,
                    "Shorten the description"));
        }
    }

    private static void checkTypedValue(String name, String type, JsonNode value, List<ValidationError> errors) {
        switch (type) {
            case "color":
                if (!ValuePredicates.isValidColor(value)) {
                    errors.add(new ValidationError("INVALID_COLOR", "Invalid color value", name, value.toString()));
                }
                break;
            case "dimension":
                if (!ValuePredicates.isValidDimension(value)) {
                    errors.add(new ValidationError("INVALID_DIMENSION", "Invalid dimension value", name, value.toString()));
                }
                break;
            case "fontWeight":
                if (!ValuePredicates.isValidFontWeight(value)) {
                    errors.add(new ValidationError("INVALID_FONT_WEIGHT", "Invalid font weight value", name, value.toString()));
                }
                break;
            case "duration":
                if (!ValuePredicates.isValidDuration(value)) {
                    errors.add(new ValidationError("INVALID_DURATION", "Invalid duration value", name, value.toString()));
                }
                break;
            case "number":
                if (!value.isNumber() || !Double.isFinite(value.asDouble())) {
                    errors.add(new ValidationError("INVALID_NUMBER", "Invalid number value", name, value.toString()));
                }
                break;
            case "fontFamily":
            case "string":
                if (!value.isTextual() && !(type.equals("fontFamily") && value.isArray())) {
                    errors.add(new ValidationError("INVALID_STRING", "Invalid string value", name, value.toString()));
                }
                break;
            default:
                break;
        }
    }

    private void validateExtended(String name, ExtendedToken token,
                                  List<ValidationError> errors, List<ValidationWarning> warnings) {
        if (token.schemaUrl == null || token.schemaUrl.isBlank()) {
            errors.add(new ValidationError("MISSING_SCHEMA", "Token is missing $schema", name));
        } else if (!ExtendedSchemas.isStandardUrl(token.schemaUrl)) {
            warnings.add(new ValidationWarning("INVALID_SCHEMA_URL",
                    "Schema URL is not a standard token schema: " + token.schemaUrl, name,
                    "Use a schema under " + ExtendedSchemas.BASE_URL));
        }

        if (token.value == null || token.value.isNull() || token.value.isMissingNode()) {
            errors.add(new ValidationError("MISSING_VALUE", "Token is missing value", name));
        }

        if (token.stableId == null || token.stableId.isBlank()) {
            if (requireStableId) {
                errors.add(new ValidationError("MISSING_UUID", "Token is missing uuid", name));
            }
        } else if (!UUID.matcher(token.stableId).matches()) {
            errors.add(new ValidationError("INVALID_UUID", "Invalid uuid", name, token.stableId));
        }
    }
}
