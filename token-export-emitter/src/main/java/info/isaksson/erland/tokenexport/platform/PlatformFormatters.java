package info.isaksson.erland.tokenexport.platform;

import com.fasterxml.jackson.databind.JsonNode;
import info.isaksson.erland.tokenexport.classify.SchemaHint;
import info.isaksson.erland.tokenexport.emitter.NumberText;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Lookup table of {@code (platform, $type)} to formatter. A missing entry keeps the canonical value.
 */
public final class PlatformFormatters {
    private PlatformFormatters() {}

    private static final Map<Platform, Map<String, ValueFormatter>> TABLE = new EnumMap<>(Platform.class);

    private static final Map<Integer, String> SWIFT_WEIGHTS = Map.of(
            100, ".ultralight",
            200, ".thin",
            300, ".light",
            400, ".regular",
            500, ".medium",
            600, ".semibold",
            700, ".bold",
            800, ".heavy",
            900, ".black");

    static {
        Map<String, ValueFormatter> ios = new HashMap<>();
        ios.put("color", (v, hint) -> swiftColor(ColorParser.parse(v)));
        ios.put("dimension", (v, hint) -> "CGFloat(" + NumberText.format(number(v)) + ")");
        ios.put("number", (v, hint) -> "CGFloat(" + NumberText.format(number(v)) + ")");
        ios.put("typography", (v, hint) -> swiftTypography(v));

        Map<String, ValueFormatter> android = new HashMap<>();
        android.put("color", (v, hint) -> "Color(0x" + ColorParser.parse(v).argbHex() + ")");
        android.put("dimension", (v, hint) -> NumberText.format(number(v)) + (isFontSize(hint) ? "sp" : "dp"));

        Map<String, ValueFormatter> compose = new HashMap<>();
        compose.put("color", (v, hint) -> "Color(0x" + ColorParser.parse(v).argbHex() + ")");
        compose.put("dimension", (v, hint) -> NumberText.format(number(v)) + (isFontSize(hint) ? ".sp" : ".dp"));
        compose.put("typography", (v, hint) -> composeTypography(v));

        TABLE.put(Platform.IOS, ios);
        TABLE.put(Platform.ANDROID, android);
        TABLE.put(Platform.COMPOSE, compose);
        TABLE.put(Platform.WEB, Map.of());
    }

    /** Formatter for a token type on a platform, or null when values pass through unchanged. */
    public static ValueFormatter lookup(Platform platform, String type) {
        if (platform == null || type == null) return null;
        return TABLE.getOrDefault(platform, Map.of()).get(type);
    }

    /** {@code Color(red: r, green: g, blue: b, opacity: a)} with channels rounded to three decimals. */
    static String swiftColor(Rgba c) {
        return "Color(red: " + swiftComponent(c.red)
                + ", green: " + swiftComponent(c.green)
                + ", blue: " + swiftComponent(c.blue)
                + ", opacity: " + swiftComponent(c.alpha) + ")";
    }

    static String swiftComponent(double v) {
        String fixed = BigDecimal.valueOf(Rgba.clamp01(v)).setScale(3, RoundingMode.HALF_UP).toPlainString();
        String stripped = fixed.replaceAll("\\.?0+$", "");
        return stripped.isEmpty() ? "0" : stripped;
    }

    static String swiftTypography(JsonNode v) {
        if (v == null || !v.isObject()) return "";
        int weight = (int) number(v.get("fontWeight"), 400);
        String swiftWeight = SWIFT_WEIGHTS.getOrDefault(weight, ".regular");
        return "Font.system(size: " + NumberText.format(number(v.get("fontSize"))) + ", weight: " + swiftWeight + ")";
    }

    static String composeTypography(JsonNode v) {
        if (v == null || !v.isObject()) return "";
        String family = text(v.get("fontFamily")).toLowerCase(Locale.ROOT).replace(' ', '_');
        int weight = (int) number(v.get("fontWeight"), 400);
        return "TextStyle(fontFamily = FontFamily(Font(R.font." + family + ")), fontSize = "
                + NumberText.format(number(v.get("fontSize"))) + ".sp, fontWeight = FontWeight(" + weight + "))";
    }

    private static boolean isFontSize(String hint) {
        return SchemaHint.FONT_SIZE.tag.equals(hint);
    }

    /** Numeric part of a number, a {@code {value, unit}} object or a string such as {@code 16px}. */
    static double number(JsonNode v) {
        return number(v, 0);
    }

    private static double number(JsonNode v, double fallback) {
        if (v == null || v.isNull()) return fallback;
        if (v.isNumber()) return v.asDouble();
        if (v.isObject() && v.has("value")) return number(v.get("value"), fallback);
        if (v.isTextual()) {
            String cleaned = v.asText().replaceAll("[^0-9.\\-]", "");
            try {
                return Double.parseDouble(cleaned);
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    private static String text(JsonNode v) {
        if (v == null || v.isNull()) return "";
        if (v.isObject() && v.has("value")) return text(v.get("value"));
        if (v.isArray()) return v.size() == 0 ? "" : text(v.get(0));
        return v.asText();
    }
}
