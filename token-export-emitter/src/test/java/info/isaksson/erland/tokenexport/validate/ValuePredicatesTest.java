package info.isaksson.erland.tokenexport.validate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ValuePredicatesTest {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Test
    void hexColors() {
        assertTrue(ValuePredicates.isValidHexColor("#fff"));
        assertTrue(ValuePredicates.isValidHexColor("#FFFA"));
        assertTrue(ValuePredicates.isValidHexColor("#1473E6"));
        assertTrue(ValuePredicates.isValidHexColor("#1473E6CC"));
        assertFalse(ValuePredicates.isValidHexColor("1473E6"));
        assertFalse(ValuePredicates.isValidHexColor("#12345"));
        assertFalse(ValuePredicates.isValidHexColor("#GGGGGG"));
        assertFalse(ValuePredicates.isValidHexColor(null));
    }

    @Test
    void colorComponents() {
        assertTrue(ValuePredicates.isValidColorComponents(0, 0.5, 1));
        assertFalse(ValuePredicates.isValidColorComponents(1.01, 0, 0));
        assertFalse(ValuePredicates.isValidColorComponents(Double.NaN, 0, 0));
    }

    @Test
    void colorValues() throws Exception {
        assertTrue(ValuePredicates.isValidColor(JSON.readTree("{\"colorSpace\":\"srgb\",\"components\":[0,0.5,1],\"alpha\":0.5}")));
        assertTrue(ValuePredicates.isValidColor(JSON.readTree("{\"r\":0,\"g\":0,\"b\":1}")));
        assertTrue(ValuePredicates.isValidColor(NODES.textNode("{color.blue.500}")));
        assertFalse(ValuePredicates.isValidColor(JSON.readTree("{\"components\":[0,2,1]}")));
        assertFalse(ValuePredicates.isValidColor(NODES.numberNode(3)));
    }

    @Test
    void dimensions() throws Exception {
        assertTrue(ValuePredicates.isValidDimension(0));
        assertFalse(ValuePredicates.isValidDimension(-1));
        assertFalse(ValuePredicates.isValidDimension(Double.POSITIVE_INFINITY));
        assertTrue(ValuePredicates.isValidDimension("1.5rem"));
        assertTrue(ValuePredicates.isValidDimension("100%"));
        assertFalse(ValuePredicates.isValidDimension("16 px"));
        assertFalse(ValuePredicates.isValidDimension("16pt"));
        assertTrue(ValuePredicates.isValidDimension(JSON.readTree("{\"value\":16,\"unit\":\"px\"}")));
        assertFalse(ValuePredicates.isValidDimension(JSON.readTree("{\"value\":16,\"unit\":\"dp\"}")));
    }

    @Test
    void opacityWeightMultiplierDuration() throws Exception {
        assertTrue(ValuePredicates.isValidOpacity(0));
        assertTrue(ValuePredicates.isValidOpacity(1));
        assertFalse(ValuePredicates.isValidOpacity(1.2));

        assertTrue(ValuePredicates.isValidFontWeight(400));
        assertFalse(ValuePredicates.isValidFontWeight(450));
        assertFalse(ValuePredicates.isValidFontWeight(1000));
        assertTrue(ValuePredicates.isValidFontWeight("bolder"));
        assertTrue(ValuePredicates.isValidFontWeight("700"));
        assertFalse(ValuePredicates.isValidFontWeight("heavy"));

        assertTrue(ValuePredicates.isValidMultiplier(0));
        assertFalse(ValuePredicates.isValidMultiplier(-0.5));

        assertTrue(ValuePredicates.isValidDuration(NODES.numberNode(200)));
        assertTrue(ValuePredicates.isValidDuration(JSON.readTree("{\"value\":0.2,\"unit\":\"s\"}")));
        assertFalse(ValuePredicates.isValidDuration(JSON.readTree("{\"value\":2,\"unit\":\"min\"}")));
    }

    @Test
    void aliases() {
        assertTrue(ValuePredicates.isValidAlias("{color.blue.500}"));
        assertTrue(ValuePredicates.isValidAlias("{colors/primary}"));
        assertFalse(ValuePredicates.isValidAlias("{}"));
        assertFalse(ValuePredicates.isValidAlias("{a b}"));
        assertFalse(ValuePredicates.isValidAlias("{a}{b}"));
        assertFalse(ValuePredicates.isValidAlias("{{a}}"));
        assertFalse(ValuePredicates.isValidAlias("a"));
    }

    @Test
    void predicatesNeverThrowOnNull() {
        assertFalse(ValuePredicates.isValidColor(null));
        assertFalse(ValuePredicates.isValidDimension((String) null));
        assertFalse(ValuePredicates.isValidFontWeight((String) null));
        assertFalse(ValuePredicates.isValidDuration(null));
        assertFalse(ValuePredicates.isValidAlias((String) null));
        assertFalse(ValuePredicates.isValidColorComponents(null));
    }

    @Test
    void referencesAllowInnerSpaces() {
        assertTrue(ValuePredicates.isReference("{Brand Blue}"));
        assertTrue(ValuePredicates.isReference("{color.blue.500}"));
        assertTrue(ValuePredicates.isReference("{x}"));
        assertTrue(ValuePredicates.isReference(NODES.textNode("{Colors.Brand Blue}")));
        assertFalse(ValuePredicates.isReference("{}"));
        assertFalse(ValuePredicates.isReference("{ }"));
        assertFalse(ValuePredicates.isReference("{ Brand}"));
        assertFalse(ValuePredicates.isReference("{Brand }"));
        assertFalse(ValuePredicates.isReference("{a}{b}"));
        assertFalse(ValuePredicates.isReference("Brand Blue"));
        assertFalse(ValuePredicates.isReference((String) null));
        assertFalse(ValuePredicates.isReference(NODES.numberNode(1)));
        assertTrue(ValuePredicates.isValidColor(NODES.textNode("{Brand Blue}")));
    }
}
