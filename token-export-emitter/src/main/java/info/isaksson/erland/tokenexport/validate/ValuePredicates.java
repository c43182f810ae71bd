package info.isaksson.erland.tokenexport.validate;

import com.fasterxml.jackson.databind.JsonNode;
import info.isaksson.erland.tokenexport.model.ColorComponents;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Range and pattern checks for token values. Every method is total: invalid or null input
 * yields {@code false}, never an exception.
 */
public final class ValuePredicates {

    private ValuePredicates() {}

    private static final Pattern HEX_COLOR = Pattern.compile("^#([0-9A-Fa-f]{3}|[0-9A-Fa-f]{4}|[0-9A-Fa-f]{6}|[0-9A-Fa-f]{8})$");
    private static final Pattern DIMENSION = Pattern.compile("^\\d+(\\.\\d+)?(px|rem|em|%)$");
    private static final Pattern ALIAS = Pattern.compile("^\\{[^\\s{}]+\\}$");
    private static final Pattern REFERENCE = Pattern.compile("^\\{[^\\s{}](?:[^{}]*[^\\s{}])?\\}$");

    public static final Set<String> DIMENSION_UNITS = Set.of("px", "rem", "em", "%");
    public static final Set<String> DURATION_UNITS = Set.of("ms", "s");

    private static final Set<String> FONT_WEIGHT_KEYWORDS = Set.of(
            "normal", "bold", "bolder", "lighter",
            "100", "200", "300", "400", "500", "600", "700", "800", "900");

    public static boolean isUnitInterval(double v) {
        return Double.isFinite(v) && v >= 0 && v <= 1;
    }

    public static boolean isValidColorComponents(double r, double g, double b) {
        return isUnitInterval(r) && isUnitInterval(g) && isUnitInterval(b);
    }

    public static boolean isValidColorComponents(ColorComponents c) {
        if (c == null) return false;
        return isValidColorComponents(c.r, c.g, c.b) && (c.a == null || isUnitInterval(c.a));
    }

    public static boolean isValidHexColor(String value) {
        return value != null && HEX_COLOR.matcher(value).matches();
    }

    /**
     * Accepts hex strings, alias strings, {@code {components:[r,g,b], alpha?}} objects and
     * {@code {r,g,b,a?}} objects with channels in 0..1.
     */
    public static boolean isValidColor(JsonNode value) {
        if (value == null || value.isNull()) return false;
        if (value.isTextual()) return isValidHexColor(value.asText()) || isReference(value.asText());
        if (!value.isObject()) return false;

        JsonNode components = value.get("components");
        if (components != null) {
            if (!components.isArray() || components.size() != 3) return false;
            for (JsonNode c : components) {
                if (!c.isNumber() || !isUnitInterval(c.asDouble())) return false;
            }
            return isOptionalUnitInterval(value.get("alpha"));
        }
        JsonNode r = value.get("r");
        JsonNode g = value.get("g");
        JsonNode b = value.get("b");
        if (r == null || g == null || b == null) return false;
        if (!r.isNumber() || !g.isNumber() || !b.isNumber()) return false;
        return isValidColorComponents(r.asDouble(), g.asDouble(), b.asDouble())
                && isOptionalUnitInterval(value.get("a"));
    }

    public static boolean isValidDimension(double value) {
        return Double.isFinite(value) && value >= 0;
    }

    public static boolean isValidDimension(String value) {
        return value != null && DIMENSION.matcher(value).matches();
    }

    /** Numbers, {@code <number><unit>} strings and {@code {value, unit}} objects. */
    public static boolean isValidDimension(JsonNode value) {
        if (value == null || value.isNull()) return false;
        if (value.isNumber()) return isValidDimension(value.asDouble());
        if (value.isTextual()) return isValidDimension(value.asText());
        if (value.isObject()) {
            JsonNode v = value.get("value");
            JsonNode unit = value.get("unit");
            return v != null && v.isNumber() && isValidDimension(v.asDouble())
                    && unit != null && unit.isTextual() && DIMENSION_UNITS.contains(unit.asText());
        }
        return false;
    }

    public static boolean isValidOpacity(double value) {
        return isUnitInterval(value);
    }

    public static boolean isValidOpacity(JsonNode value) {
        return value != null && value.isNumber() && isValidOpacity(value.asDouble());
    }

    public static boolean isValidFontWeight(double value) {
        return Double.isFinite(value) && value >= 100 && value <= 900 && value % 100 == 0;
    }

    public static boolean isValidFontWeight(String value) {
        return value != null && FONT_WEIGHT_KEYWORDS.contains(value);
    }

    public static boolean isValidFontWeight(JsonNode value) {
        if (value == null || value.isNull()) return false;
        if (value.isNumber()) return isValidFontWeight(value.asDouble());
        if (value.isTextual()) return isValidFontWeight(value.asText());
        return false;
    }

    public static boolean isValidMultiplier(double value) {
        return Double.isFinite(value) && value >= 0;
    }

    public static boolean isValidMultiplier(JsonNode value) {
        return value != null && value.isNumber() && isValidMultiplier(value.asDouble());
    }

    /** Non-negative numbers or {@code {value, unit: ms|s}} objects. */
    public static boolean isValidDuration(JsonNode value) {
        if (value == null || value.isNull()) return false;
        if (value.isNumber()) return isValidMultiplier(value.asDouble());
        if (value.isObject()) {
            JsonNode v = value.get("value");
            JsonNode unit = value.get("unit");
            return v != null && v.isNumber() && isValidMultiplier(v.asDouble())
                    && unit != null && DURATION_UNITS.contains(unit.asText());
        }
        return false;
    }

    /** {@code {path}} with a non-empty path free of whitespace and braces. */
    public static boolean isValidAlias(String value) {
        return value != null && ALIAS.matcher(value).matches();
    }

    public static boolean isValidAlias(JsonNode value) {
        return value != null && value.isTextual() && isValidAlias(value.asText());
    }

    /**
     * Any single brace-wrapped token path, including paths with inner spaces as written under the
     * {@code original} naming convention. {@link #isValidAlias(String)} is the stricter portable form.
     */
    public static boolean isReference(String value) {
        return value != null && REFERENCE.matcher(value).matches();
    }

    public static boolean isReference(JsonNode value) {
        return value != null && value.isTextual() && isReference(value.asText());
    }

    private static boolean isOptionalUnitInterval(JsonNode n) {
        if (n == null || n.isNull()) return true;
        return n.isNumber() && isUnitInterval(n.asDouble());
    }
}
