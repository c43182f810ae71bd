package info.isaksson.erland.tokenexport.model;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class VariableJsonTest {

    private static String fixture() throws IOException {
        try (InputStream in = VariableJsonTest.class.getResourceAsStream("/variables/sample-variables.json")) {
            assertNotNull(in, "fixture must exist in test resources");
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void readsCollectionsAndVariablesInInputOrder() throws IOException {
        VariableSet set = VariableJson.readFromString(fixture());

        assertEquals(1, set.collections.size());
        VariableCollection c = set.collections.get(0);
        assertEquals("Primitives", c.name);
        assertEquals("1:0", c.defaultModeId);
        assertEquals("Dark", c.modeName("1:1"));
        assertEquals(8, c.variableIds.size());

        assertEquals(8, set.variables.size());
        assertEquals("color/blue/500", set.variables.get(0).name);
        assertEquals("legacy/gap", set.variables.get(7).name);
    }

    @Test
    void readsEveryValueShape() throws IOException {
        VariableSet set = VariableJson.readFromString(fixture());

        Variable blue = set.variables.get(0);
        assertEquals(ResolvedPrimitive.COLOR, blue.resolvedType);
        ColorComponents light = (ColorComponents) blue.valuesByMode.get("1:0");
        assertEquals(0.078, light.r, 1e-9);
        assertTrue(light.hasAlpha());

        Variable radius = set.variables.get(1);
        assertEquals(new NumberValue(4), radius.valuesByMode.get("1:0"));
        assertTrue(radius.hasScope(Variable.SCOPE_CORNER_RADIUS));

        assertEquals(new TextValue("16px"), set.variables.get(4).valuesByMode.get("1:0"));

        ResolvedValue alias = set.variables.get(5).valuesByMode.get("1:0");
        assertTrue(alias.isAlias());
        assertEquals("VariableID:1", ((AliasReference) alias).targetVariableId);
    }

    @Test
    void acceptsHostFieldNamesAndIgnoresUnknownOnes() throws IOException {
        VariableSet set = VariableJson.readFromString(fixture());
        assertTrue(set.variables.get(6).hidden, "hiddenFromPublishing is an alias of hidden");
        assertFalse(set.variables.get(5).hidden);
    }

    @Test
    void missingFieldsMeanNoSignal() throws IOException {
        VariableSet set = VariableJson.readFromString("{\"variables\":[{\"id\":\"a\",\"name\":\"x\",\"resolvedType\":\"BOOLEAN\"}]}");
        assertTrue(set.collections.isEmpty());
        Variable v = set.variables.get(0);
        assertEquals("", v.description);
        assertTrue(v.scopes.isEmpty());
        assertTrue(v.valuesByMode.isEmpty());
    }

    @Test
    void rejectsUnsupportedValue() {
        String json = "{\"variables\":[{\"id\":\"a\",\"name\":\"x\",\"resolvedType\":\"FLOAT\",\"valuesByMode\":{\"m\":[1,2]}}]}";
        assertThrows(IOException.class, () -> VariableJson.readFromString(json));
    }

    @Test
    void writesDeterministicallyWithTrailingNewline() throws IOException {
        VariableSet set = VariableJson.readFromString(fixture());
        String a = VariableJson.toJsonString(set);
        String b = VariableJson.toJsonString(VariableJson.readFromString(a));
        assertEquals(a, b);
        assertTrue(a.endsWith("}\n"));
        assertTrue(a.contains("\"type\" : \"VARIABLE_ALIAS\""));
    }
}
