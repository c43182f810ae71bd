package info.isaksson.erland.tokenexport.emitter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.tokenexport.classify.SemanticType;
import info.isaksson.erland.tokenexport.model.ColorComponents;
import info.isaksson.erland.tokenexport.model.ResolvedValue;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class ValueTransformerTest {

    @Test
    void hexRoundTrip() {
        assertEquals("#1473E6", ValueTransformer.toHex(0.078, 0.451, 0.902));
        ColorComponents c = ValueTransformer.fromHex("#1473E6");
        assertEquals("#1473E6", ValueTransformer.toHex(c.r, c.g, c.b));
        assertEquals(1.0, ValueTransformer.fromHex("#fff").g, 1e-9);
        assertThrows(IllegalArgumentException.class, () -> ValueTransformer.fromHex("#12345"));
    }

    @Test
    void hexRoundTripHoldsForChannelEdgesInEveryPosition() {
        int[] edges = {0x00, 0x01, 0x7F, 0x80, 0xFE, 0xFF};
        for (int r : edges) {
            for (int g : edges) {
                for (int b : edges) {
                    assertRoundTrip(String.format(Locale.ROOT, "#%02X%02X%02X", r, g, b));
                }
            }
        }
    }

    @Test
    void hexRoundTripHoldsForEveryChannelByte() {
        for (int v = 0; v <= 0xFF; v++) {
            assertRoundTrip(String.format(Locale.ROOT, "#%02X3C81", v));
            assertRoundTrip(String.format(Locale.ROOT, "#A5%02X81", v));
            assertRoundTrip(String.format(Locale.ROOT, "#A53C%02X", v));
        }
        ColorComponents lower = ValueTransformer.fromHex("#1473e6");
        assertEquals("#1473E6", ValueTransformer.toHex(lower.r, lower.g, lower.b));
    }

    private static void assertRoundTrip(String hex) {
        ColorComponents c = ValueTransformer.fromHex(hex);
        assertEquals(hex, ValueTransformer.toHex(c.r, c.g, c.b));
    }

    @Test
    void canonicalColorWritesAlphaOnlyBelowOne() {
        ObjectNode opaque = ValueTransformer.canonicalColor(new ColorComponents(1, 0, 0, 1.0));
        assertEquals("srgb", opaque.get("colorSpace").asText());
        assertEquals(3, opaque.get("components").size());
        assertFalse(opaque.has("alpha"));
        assertEquals("#FF0000", opaque.get("hex").asText());

        ObjectNode translucent = ValueTransformer.canonicalColor(new ColorComponents(1, 0, 0, 0.5));
        assertEquals(0.5, translucent.get("alpha").asDouble(), 1e-9);
    }

    @Test
    void canonicalNumbers() {
        JsonNode dim = ValueTransformer.canonical(ResolvedValue.number(-4), SemanticType.DIMENSION, DimensionUnit.REM);
        assertEquals(4, dim.get("value").asInt());
        assertTrue(dim.get("value").isIntegralNumber());
        assertEquals("rem", dim.get("unit").asText());

        JsonNode duration = ValueTransformer.canonical(ResolvedValue.number(150), SemanticType.DURATION, DimensionUnit.PX);
        assertEquals("ms", duration.get("unit").asText());

        assertEquals(0.4, ValueTransformer.canonical(ResolvedValue.number(0.4), SemanticType.OPACITY, DimensionUnit.PX).asDouble(), 1e-9);
        assertEquals(1, ValueTransformer.canonical(ResolvedValue.bool(true), SemanticType.NUMBER, DimensionUnit.PX).asInt());
    }

    @Test
    void canonicalStrings() {
        JsonNode dim = ValueTransformer.canonical(ResolvedValue.text("1.5rem"), SemanticType.DIMENSION, DimensionUnit.PX);
        assertEquals(1.5, dim.get("value").asDouble(), 1e-9);
        assertEquals("rem", dim.get("unit").asText());

        assertEquals(600, ValueTransformer.canonical(ResolvedValue.text("Semibold"), SemanticType.FONT_WEIGHT, DimensionUnit.PX).asInt());
        assertEquals("Adobe Clean", ValueTransformer.canonical(ResolvedValue.text("Adobe Clean"), SemanticType.FONT_FAMILY, DimensionUnit.PX).asText());
    }

    @Test
    void extendedValues() {
        assertEquals("rgb(255, 0, 0)", ValueTransformer.extended(ResolvedValue.color(1, 0, 0), SemanticType.COLOR, DimensionUnit.PX).asText());
        assertEquals("rgba(255, 0, 0, 0.5)", ValueTransformer.extended(ResolvedValue.color(1, 0, 0, 0.5), SemanticType.COLOR, DimensionUnit.PX).asText());
        assertEquals("1.5rem", ValueTransformer.extended(ResolvedValue.number(1.5), SemanticType.DIMENSION, DimensionUnit.REM).asText());
        assertEquals("bold", ValueTransformer.extended(ResolvedValue.number(700), SemanticType.FONT_WEIGHT, DimensionUnit.PX).asText());
        assertEquals("150ms", ValueTransformer.extended(ResolvedValue.number(150), SemanticType.DURATION, DimensionUnit.PX).asText());
        assertEquals("1.25", ValueTransformer.extended(ResolvedValue.number(1.25), SemanticType.MULTIPLIER, DimensionUnit.PX).asText());
        assertEquals(0, ValueTransformer.extended(ResolvedValue.bool(false), SemanticType.NUMBER, DimensionUnit.PX).asInt());
    }

    @Test
    void fontWeightMapping() {
        assertEquals("light", ValueTransformer.fontWeightKeyword(100));
        assertEquals("regular", ValueTransformer.fontWeightKeyword(400));
        assertEquals("extra-bold", ValueTransformer.fontWeightKeyword(800));
        assertEquals("black", ValueTransformer.fontWeightKeyword(950));
        assertEquals(900, ValueTransformer.fontWeightNumber("black"));
        assertEquals(300, ValueTransformer.fontWeightNumber("300"));
        assertEquals(400, ValueTransformer.fontWeightNumber("heavy"));
    }

    @Test
    void numberText() {
        assertEquals("16", NumberText.format(16.0));
        assertEquals("0.5", NumberText.format(0.5));
        assertEquals("0.0000001", NumberText.format(1e-7));
        assertEquals("0", NumberText.format(Double.NaN));
    }
}
