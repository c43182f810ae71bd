package info.isaksson.erland.tokenexport.classify;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword lists and value shape checks used by the classification rules.
 *
 * <p>Keywords match as lower-case substrings of the variable name or description.</p>
 */
public final class KeywordPatterns {

    private KeywordPatterns() {}

    public static final List<String> BORDER_RADIUS = List.of("radius", "corner-radius", "border-radius", "rounded", "corner");

    public static final List<String> DIMENSION = List.of(
            "size", "width", "height", "spacing", "padding", "margin", "gap",
            "border", "stroke", "offset", "indent", "distance");

    public static final List<String> OPACITY = List.of("opacity", "alpha", "transparency", "transparent");

    public static final List<String> MULTIPLIER = List.of("scale", "ratio", "multiplier", "factor", "coefficient");

    public static final List<String> FONT_FAMILY = List.of("font-family", "typeface", "font");

    public static final List<String> FONT_SIZE = List.of("font-size", "text-size");

    public static final List<String> FONT_WEIGHT = List.of("font-weight", "weight");

    public static final List<String> DURATION = List.of("duration", "time", "delay", "transition", "animation");

    public static final List<String> LINE_HEIGHT = List.of("line-height", "leading");

    /** Common spacing/sizing scale steps. */
    public static final Set<Integer> COMMON_SPACING_VALUES = Set.of(4, 8, 12, 16, 20, 24, 32, 40, 48, 64, 80, 96, 128);

    private static final List<String> FONT_NAME_INDICATORS = List.of(
            "sans", "serif", "mono", "arial", "helvetica", "roboto", "open sans", "lato",
            "montserrat", "source", "noto", "inter", "poppins", "system-ui");

    private static final Pattern FONT_NAME = Pattern.compile(
            "\\b(?:" + FONT_NAME_INDICATORS.stream().map(Pattern::quote).collect(Collectors.joining("|")) + ")\\b");

    private static final Set<String> WEIGHT_KEYWORDS = Set.of(
            "thin", "light", "regular", "normal", "medium", "semibold", "bold", "extrabold", "black");

    private static final Pattern DIMENSION_WITH_UNIT = Pattern.compile("^(\\d+(?:\\.\\d+)?)(px|rem|em|%|pt|dp)$");

    public static boolean hasKeywords(List<String> texts, List<String> keywords) {
        for (String text : texts) {
            if (text == null || text.isEmpty()) continue;
            for (String k : keywords) {
                if (text.contains(k)) return true;
            }
        }
        return false;
    }

    public static boolean isCommonSpacingValue(double value) {
        if (!Double.isFinite(value) || value != Math.rint(value)) return false;
        return COMMON_SPACING_VALUES.contains((int) value);
    }

    /** True when the value contains a known font name as a whole word, e.g. {@code "Inter, sans-serif"}. */
    public static boolean isFontFamilyValue(String value) {
        return value != null && FONT_NAME.matcher(value.toLowerCase(Locale.ROOT)).find();
    }

    public static boolean isFontWeightValue(String value) {
        return value != null && WEIGHT_KEYWORDS.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    public static boolean hasDimensionUnit(String value) {
        return value != null && DIMENSION_WITH_UNIT.matcher(value.trim()).matches();
    }

    /** Unit of a dimension string ({@code "16px"} gives {@code "px"}), or null. */
    public static String extractUnit(String value) {
        if (value == null) return null;
        Matcher m = DIMENSION_WITH_UNIT.matcher(value.trim());
        return m.matches() ? m.group(2) : null;
    }

    /** Numeric part of a dimension string ({@code "1.5rem"} gives 1.5), or null. */
    public static Double extractNumber(String value) {
        if (value == null) return null;
        Matcher m = DIMENSION_WITH_UNIT.matcher(value.trim());
        return m.matches() ? Double.valueOf(m.group(1)) : null;
    }
}
