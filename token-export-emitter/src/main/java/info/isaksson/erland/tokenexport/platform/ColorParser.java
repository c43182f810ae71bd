package info.isaksson.erland.tokenexport.platform;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * Reads canonical color values into {@link Rgba}.
 *
 * <p>Accepted: hex strings with 3, 6 or 8 digits (8 digits read as {@code AARRGGBB}), objects with
 * {@code components} in 0..1 or 0..255 plus optional {@code alpha}, and objects with {@code hex} plus
 * optional {@code alpha}. Anything else reads as opaque black.</p>
 */
public final class ColorParser {
    private ColorParser() {}

    public static Rgba parse(JsonNode value) {
        if (value == null || value.isNull()) return Rgba.BLACK;
        if (value.isTextual()) return fromHex(value.asText());
        if (!value.isObject()) return Rgba.BLACK;

        JsonNode alphaNode = value.get("alpha");
        JsonNode components = value.get("components");
        if (components != null && components.isArray() && components.size() >= 3) {
            double alpha = alphaNode != null && alphaNode.isNumber()
                    ? alphaNode.asDouble()
                    : components.size() > 3 ? components.get(3).asDouble(1) : 1;
            return new Rgba(
                    normalizeComponent(components.get(0).asDouble()),
                    normalizeComponent(components.get(1).asDouble()),
                    normalizeComponent(components.get(2).asDouble()),
                    alpha);
        }
        JsonNode hex = value.get("hex");
        if (hex != null && hex.isTextual()) {
            Rgba fromHex = fromHex(hex.asText());
            double alpha = alphaNode != null && alphaNode.isNumber() ? alphaNode.asDouble() : fromHex.alpha;
            return new Rgba(fromHex.red, fromHex.green, fromHex.blue, alpha);
        }
        return new Rgba(0, 0, 0, alphaNode != null && alphaNode.isNumber() ? alphaNode.asDouble() : 1);
    }

    public static Rgba fromHex(String hex) {
        String h = normalizeHex(hex);
        boolean hasAlpha = h.length() == 8;
        int offset = hasAlpha ? 2 : 0;
        double r = Integer.parseInt(h.substring(offset, offset + 2), 16) / 255.0;
        double g = Integer.parseInt(h.substring(offset + 2, offset + 4), 16) / 255.0;
        double b = Integer.parseInt(h.substring(offset + 4, offset + 6), 16) / 255.0;
        double a = hasAlpha ? Integer.parseInt(h.substring(0, 2), 16) / 255.0 : 1;
        return new Rgba(r, g, b, a);
    }

    /** Upper-case 6 or 8 hex digits without {@code #}; {@code 000000} when malformed. */
    static String normalizeHex(String hex) {
        if (hex == null) return "000000";
        String h = hex.replace("#", "").trim();
        if (h.length() == 3) {
            h = "" + h.charAt(0) + h.charAt(0) + h.charAt(1) + h.charAt(1) + h.charAt(2) + h.charAt(2);
        }
        if ((h.length() == 6 || h.length() == 8) && h.matches("[0-9A-Fa-f]+")) {
            return h.toUpperCase(Locale.ROOT);
        }
        return "000000";
    }

    /** Channels above 1 are read as 0..255. */
    static double normalizeComponent(double v) {
        if (Double.isNaN(v)) return 0;
        return v > 1 ? Rgba.clamp01(v / 255) : Rgba.clamp01(v);
    }
}
