package info.isaksson.erland.tokenexport.emitter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.tokenexport.classify.KeywordPatterns;
import info.isaksson.erland.tokenexport.classify.SemanticType;
import info.isaksson.erland.tokenexport.model.BooleanValue;
import info.isaksson.erland.tokenexport.model.ColorComponents;
import info.isaksson.erland.tokenexport.model.NumberValue;
import info.isaksson.erland.tokenexport.model.ResolvedValue;
import info.isaksson.erland.tokenexport.model.TextValue;

import java.util.Locale;
import java.util.Map;

/**
 * Rewrites resolved (non-alias) variable values into canonical and extended token values.
 */
public final class ValueTransformer {
    private ValueTransformer() {}

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final Map<String, Integer> FONT_WEIGHT_NUMBERS = Map.of(
            "thin", 100,
            "light", 300,
            "regular", 400,
            "normal", 400,
            "medium", 500,
            "semibold", 600,
            "bold", 700,
            "extrabold", 800,
            "black", 900);

    // ---- canonical ----

    public static JsonNode canonical(ResolvedValue value, SemanticType type, DimensionUnit unit) {
        if (value instanceof ColorComponents) {
            return canonicalColor((ColorComponents) value);
        }
        if (value instanceof BooleanValue) {
            return NODES.numberNode(((BooleanValue) value).value ? 1 : 0);
        }
        if (value instanceof NumberValue) {
            double n = ((NumberValue) value).value;
            switch (type) {
                case DIMENSION:
                    return dimension(safeDimension(n), unit.tag);
                case DURATION:
                    return dimension(n, "ms");
                default:
                    return number(Double.isFinite(n) ? n : 0);
            }
        }
        if (value instanceof TextValue) {
            String s = ((TextValue) value).value;
            if (type == SemanticType.DIMENSION) {
                String u = KeywordPatterns.extractUnit(s);
                Double n = KeywordPatterns.extractNumber(s);
                if (u != null && n != null) return dimension(n, u);
            }
            if (type == SemanticType.FONT_WEIGHT) {
                return NODES.numberNode(fontWeightNumber(s));
            }
            return NODES.textNode(s);
        }
        return NODES.nullNode();
    }

    /** {@code {colorSpace: "srgb", components, alpha?, hex}}; alpha is written only when below 1. */
    public static ObjectNode canonicalColor(ColorComponents c) {
        double r = clampUnit(c.r);
        double g = clampUnit(c.g);
        double b = clampUnit(c.b);
        ObjectNode o = NODES.objectNode();
        o.put("colorSpace", "srgb");
        ArrayNode components = o.putArray("components");
        components.add(r);
        components.add(g);
        components.add(b);
        if (c.hasAlpha()) {
            double a = clampUnit(c.a);
            if (a < 1) o.put("alpha", a);
        }
        o.put("hex", toHex(r, g, b));
        return o;
    }

    // ---- extended ----

    public static JsonNode extended(ResolvedValue value, SemanticType type, DimensionUnit unit) {
        if (value instanceof ColorComponents) {
            return NODES.textNode(rgbString((ColorComponents) value));
        }
        if (value instanceof BooleanValue) {
            return NODES.numberNode(((BooleanValue) value).value ? 1 : 0);
        }
        if (value instanceof NumberValue) {
            double n = ((NumberValue) value).value;
            switch (type) {
                case DIMENSION:
                    return NODES.textNode(NumberText.format(safeDimension(n)) + unit.tag);
                case FONT_WEIGHT:
                    return NODES.textNode(fontWeightKeyword(n));
                case DURATION:
                    return NODES.textNode(NumberText.format(n) + "ms");
                default:
                    return NODES.textNode(NumberText.format(n));
            }
        }
        if (value instanceof TextValue) {
            return NODES.textNode(((TextValue) value).value);
        }
        return NODES.nullNode();
    }

    /** {@code rgb(r, g, b)} with 0..255 channels, or {@code rgba(r, g, b, a)} when alpha is below 1. */
    public static String rgbString(ColorComponents c) {
        int r = (int) Math.round(clampUnit(c.r) * 255);
        int g = (int) Math.round(clampUnit(c.g) * 255);
        int b = (int) Math.round(clampUnit(c.b) * 255);
        if (c.hasAlpha()) {
            double a = clampUnit(c.a);
            if (a < 1) {
                return "rgba(" + r + ", " + g + ", " + b + ", " + NumberText.format(a) + ")";
            }
        }
        return "rgb(" + r + ", " + g + ", " + b + ")";
    }

    // ---- helpers ----

    /** Upper-case {@code #RRGGBB} of 0..1 channels. */
    public static String toHex(double r, double g, double b) {
        return String.format(Locale.ROOT, "#%02X%02X%02X", channel(r), channel(g), channel(b));
    }

    /** Parses {@code #RRGGBB} (or {@code #RGB}) into 0..1 channels. */
    public static ColorComponents fromHex(String hex) {
        if (hex == null) throw new IllegalArgumentException("hex is null");
        String h = hex.startsWith("#") ? hex.substring(1) : hex;
        if (h.length() == 3) {
            h = "" + h.charAt(0) + h.charAt(0) + h.charAt(1) + h.charAt(1) + h.charAt(2) + h.charAt(2);
        }
        if (h.length() != 6) throw new IllegalArgumentException("Not a #RRGGBB color: " + hex);
        return new ColorComponents(
                Integer.parseInt(h.substring(0, 2), 16) / 255.0,
                Integer.parseInt(h.substring(2, 4), 16) / 255.0,
                Integer.parseInt(h.substring(4, 6), 16) / 255.0,
                null);
    }

    public static String fontWeightKeyword(double weight) {
        if (weight <= 200) return "light";
        if (weight <= 400) return "regular";
        if (weight <= 500) return "medium";
        if (weight <= 700) return "bold";
        if (weight <= 900) return "extra-bold";
        return "black";
    }

    public static int fontWeightNumber(String keyword) {
        if (keyword == null) return 400;
        String k = keyword.trim().toLowerCase(Locale.ROOT);
        Integer mapped = FONT_WEIGHT_NUMBERS.get(k);
        if (mapped != null) return mapped;
        try {
            return Integer.parseInt(k);
        } catch (NumberFormatException e) {
            return 400;
        }
    }

    private static ObjectNode dimension(double value, String unit) {
        ObjectNode o = NODES.objectNode();
        o.set("value", number(value));
        o.put("unit", unit);
        return o;
    }

    /** Integral values as integer nodes so they print without a decimal point. */
    private static JsonNode number(double v) {
        if (v == Math.rint(v) && Math.abs(v) < 1e15) {
            return NODES.numberNode((long) v);
        }
        return NODES.numberNode(v);
    }

    private static double safeDimension(double v) {
        if (!Double.isFinite(v)) return 0;
        return Math.abs(v);
    }

    private static double clampUnit(double v) {
        if (!Double.isFinite(v)) return 0;
        return Math.max(0, Math.min(1, v));
    }

    private static int channel(double v) {
        return (int) Math.round(clampUnit(v) * 255);
    }
}
