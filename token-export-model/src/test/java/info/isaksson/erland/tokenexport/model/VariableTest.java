package info.isaksson.erland.tokenexport.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class VariableTest {

    private static Variable gap(String description) {
        return Variable.of("v", "legacy/gap", ResolvedPrimitive.FLOAT, Map.of("m", ResolvedValue.number(12)))
                .withDescription(description);
    }

    @Test
    void deprecationMarkerWithComment() {
        Variable v = gap("Deprecated: use spacing/200");
        assertTrue(v.isDeprecated());
        assertEquals("use spacing/200", v.deprecationComment());
    }

    @Test
    void bracketedMarkerWithoutComment() {
        Variable v = gap("[deprecated]");
        assertTrue(v.isDeprecated());
        assertEquals("", v.deprecationComment());
    }

    @Test
    void descriptionMentioningDeprecationLaterIsNotAMarker() {
        assertFalse(gap("Spacing between cards, not deprecated").isDeprecated());
        assertFalse(gap("").isDeprecated());
    }

    @Test
    void withersKeepOtherFields() {
        Variable v = gap("d").withScopes(Variable.SCOPE_CORNER_RADIUS).withHidden(true);
        assertEquals("d", v.description);
        assertTrue(v.hidden);
        assertTrue(v.hasScope(Variable.SCOPE_CORNER_RADIUS));
        assertEquals(ResolvedValue.number(12), v.valuesByMode.get("m"));
    }

    @Test
    void collectionDefaultModeFallsBackToFirstMode() {
        VariableCollection c = new VariableCollection("c", "Theme",
                List.of(new VariableMode("m1", "Light"), new VariableMode("m2", null)), null, null);
        assertEquals("m1", c.defaultModeId);
        assertEquals("m2", c.modeName("m2"));
        assertTrue(c.variableIds.isEmpty());
    }
}
