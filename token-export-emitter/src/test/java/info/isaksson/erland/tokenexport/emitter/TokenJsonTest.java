package info.isaksson.erland.tokenexport.emitter;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.tokenexport.classify.SchemaHint;
import info.isaksson.erland.tokenexport.token.CanonicalToken;
import info.isaksson.erland.tokenexport.token.ExtendedSetEntry;
import info.isaksson.erland.tokenexport.token.ExtendedToken;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TokenJsonTest {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static CanonicalToken number(int n) {
        return CanonicalToken.of(NODES.numberNode(n), "number");
    }

    @Test
    void nestedDocumentGroupsByDots() {
        Map<String, CanonicalToken> tokens = new LinkedHashMap<>();
        tokens.put("color.blue.500", number(1));
        tokens.put("color.blue.600", number(2));
        tokens.put("spacing", number(3));

        Diagnostics d = new Diagnostics();
        ObjectNode doc = TokenJson.canonicalDocument(tokens, TokenStructure.NESTED, d);
        assertEquals(2, doc.get("color").get("blue").get("600").get("$value").asInt());
        assertEquals(3, doc.get("spacing").get("$value").asInt());
        assertTrue(d.all().isEmpty());

        List<String> top = new ArrayList<>();
        doc.fieldNames().forEachRemaining(top::add);
        assertEquals(List.of("color", "spacing"), top);
    }

    @Test
    void flatDocumentKeepsKeys() {
        Map<String, CanonicalToken> tokens = new LinkedHashMap<>();
        tokens.put("color.blue", number(1));
        ObjectNode doc = TokenJson.canonicalDocument(tokens, TokenStructure.FLAT, null);
        assertTrue(doc.has("color.blue"));
    }

    @Test
    void pathConflictsMergeAndWarn() {
        Map<String, CanonicalToken> tokens = new LinkedHashMap<>();
        tokens.put("size", number(1));
        tokens.put("size.large", number(2));
        Diagnostics d = new Diagnostics();
        ObjectNode doc = TokenJson.canonicalDocument(tokens, TokenStructure.NESTED, d);
        assertEquals(1, doc.get("size").get("$value").asInt());
        assertEquals(2, doc.get("size").get("large").get("$value").asInt());
        assertEquals("TOKEN_PATH_CONFLICT", d.warnings().get(0).code);

        Map<String, CanonicalToken> reversed = new LinkedHashMap<>();
        reversed.put("size.large", number(2));
        reversed.put("size", number(1));
        Diagnostics d2 = new Diagnostics();
        ObjectNode doc2 = TokenJson.canonicalDocument(reversed, TokenStructure.NESTED, d2);
        assertEquals(1, doc2.get("size").get("$value").asInt());
        assertEquals(2, doc2.get("size").get("large").get("$value").asInt());
        assertEquals(1, d2.warnings().size());
    }

    @Test
    void canonicalNodeFields() {
        ObjectNode meta = NODES.objectNode().put("variableId", "VariableID:8");
        CanonicalToken t = new CanonicalToken(NODES.numberNode(12), "dimension", "Deprecated: use spacing/200",
                SchemaHint.DIMENSION, true, "use spacing/200", meta);
        ObjectNode n = TokenJson.canonicalNode(t);
        assertEquals("use spacing/200", n.get("$deprecated").asText());
        assertEquals("Deprecated: use spacing/200", n.get("$description").asText());
        ObjectNode ext = (ObjectNode) n.get("$extensions").get(TokenConverter.EXTENSION_KEY);
        assertEquals("dimension", ext.get("schemaHint").asText());
        assertEquals("VariableID:8", ext.get("variableId").asText());

        ObjectNode bare = TokenJson.canonicalNode(new CanonicalToken(NODES.numberNode(1), null, null, null, true, null, null));
        assertTrue(bare.get("$deprecated").asBoolean());
        assertFalse(bare.has("$type"));
        assertFalse(bare.has("$extensions"));
    }

    @Test
    void extendedNodeFieldOrder() {
        Map<String, ExtendedSetEntry> sets = new LinkedHashMap<>();
        sets.put("Light", new ExtendedSetEntry("s", NODES.textNode("4px"), "id-light"));
        sets.put("Dark", new ExtendedSetEntry("s", NODES.textNode("8px"), null));
        ExtendedToken t = new ExtendedToken("s", NODES.textNode("4px"), "id", "button", true, true, "gone", sets);

        List<String> keys = new ArrayList<>();
        TokenJson.extendedNode(t).fieldNames().forEachRemaining(keys::add);
        assertEquals(List.of("$schema", "value", "uuid", "component", "private", "deprecated", "deprecated_comment", "sets"), keys);
        assertFalse(TokenJson.extendedNode(t).get("sets").get("Dark").has("uuid"));
    }

    @Test
    void writeIsPrettyAndNewlineTerminated() {
        Map<String, CanonicalToken> tokens = new LinkedHashMap<>();
        tokens.put("spacing", number(4));
        String json = TokenJson.write(TokenJson.canonicalDocument(tokens, TokenStructure.NESTED, null));
        assertTrue(json.endsWith("}\n"));
        assertTrue(json.contains("\n  \"spacing\""));
        assertTrue(json.contains("\n    \"$value\""));
        assertEquals(json, TokenJson.write(TokenJson.canonicalDocument(tokens, TokenStructure.NESTED, null)));
    }

    @Test
    void documentsDoNotShareNodesWithTokens() {
        ObjectNode value = NODES.objectNode().put("value", 4).put("unit", "px");
        ObjectNode metadata = NODES.objectNode().put("variableId", "VariableID:2");
        CanonicalToken token = new CanonicalToken(value, "dimension", null, SchemaHint.DIMENSION, false, null, metadata);
        Map<String, CanonicalToken> tokens = new LinkedHashMap<>();
        tokens.put("corner-radius-100", token);

        ObjectNode doc = TokenJson.canonicalDocument(tokens, TokenStructure.FLAT, null);
        ObjectNode leaf = (ObjectNode) doc.get("corner-radius-100");
        ((ObjectNode) leaf.get("$value")).put("value", 99);
        ((ObjectNode) leaf.get("$extensions").get(TokenConverter.EXTENSION_KEY)).put("variableId", "changed");

        assertEquals(4, token.value.get("value").asInt());
        assertEquals("VariableID:2", token.metadata.get("variableId").asText());
    }
}
