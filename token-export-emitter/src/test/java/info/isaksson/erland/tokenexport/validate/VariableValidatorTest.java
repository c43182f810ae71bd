package info.isaksson.erland.tokenexport.validate;

import info.isaksson.erland.tokenexport.model.ResolvedPrimitive;
import info.isaksson.erland.tokenexport.model.ResolvedValue;
import info.isaksson.erland.tokenexport.model.Variable;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class VariableValidatorTest {

    private final VariableValidator validator = new VariableValidator();

    @Test
    void completeVariableIsValid() {
        Variable v = Variable.of("VariableID:1", "color/blue/500", ResolvedPrimitive.COLOR,
                Map.of("1:0", ResolvedValue.color(0.1, 0.2, 0.3)));
        ValidationResult r = validator.validateVariable(v);
        assertTrue(r.valid);
        assertTrue(r.warnings.isEmpty());
    }

    @Test
    void missingRequiredFields() {
        Variable v = new Variable("", null, null, Map.of(), null, null, false);
        ValidationResult r = validator.validateVariable(v);
        assertEquals(3, r.errors.size());
        assertEquals("MISSING_ID", r.errors.get(0).code);
        assertEquals("MISSING_NAME", r.errors.get(1).code);
        assertEquals("MISSING_TYPE", r.errors.get(2).code);
        assertEquals("NO_VALUES", r.warnings.get(0).code);
    }

    @Test
    void fileSystemUnsafeNameIsAWarning() {
        Variable v = Variable.of("1", "color:primary?", ResolvedPrimitive.FLOAT, Map.of("m", ResolvedValue.number(1)));
        ValidationResult r = validator.validateVariable(v);
        assertTrue(r.valid);
        assertEquals("INVALID_NAME_CHARACTERS", r.warnings.get(0).code);
    }

    @Test
    void valuesAreCheckedAgainstDeclaredType() {
        Variable color = Variable.of("1", "c", ResolvedPrimitive.COLOR, Map.of());
        assertEquals("INVALID_COLOR_VALUE",
                validator.validateVariableValue(color, "m", ResolvedValue.color(1.5, 0, 0)).errors.get(0).code);
        assertEquals("INVALID_COLOR_VALUE",
                validator.validateVariableValue(color, "m", ResolvedValue.number(1)).errors.get(0).code);

        Variable number = Variable.of("2", "n", ResolvedPrimitive.FLOAT, Map.of());
        assertEquals("INVALID_FLOAT_VALUE",
                validator.validateVariableValue(number, "m", ResolvedValue.number(Double.NaN)).errors.get(0).code);
        assertTrue(validator.validateVariableValue(number, "m", ResolvedValue.number(3)).valid);

        Variable text = Variable.of("3", "s", ResolvedPrimitive.STRING, Map.of());
        assertEquals("INVALID_STRING_VALUE",
                validator.validateVariableValue(text, "m", ResolvedValue.bool(true)).errors.get(0).code);

        Variable flag = Variable.of("4", "b", ResolvedPrimitive.BOOLEAN, Map.of());
        assertEquals("INVALID_BOOLEAN_VALUE",
                validator.validateVariableValue(flag, "m", ResolvedValue.text("yes")).errors.get(0).code);
    }

    @Test
    void aliasAlwaysAcceptedAndMissingValueWarns() {
        Variable color = Variable.of("1", "c", ResolvedPrimitive.COLOR, Map.of());
        assertTrue(validator.validateVariableValue(color, "m", ResolvedValue.alias("VariableID:9")).valid);

        ValidationResult missing = validator.validateVariableValue(color, "m", null);
        assertTrue(missing.valid);
        assertEquals("MISSING_MODE_VALUE", missing.warnings.get(0).code);
    }

    @Test
    void floatVariableWithTextValueIsInvalid() {
        Variable number = Variable.of("5", "spacing/100", ResolvedPrimitive.FLOAT, Map.of());
        ValidationResult r = validator.validateVariableValue(number, "m", ResolvedValue.text("abc"));
        assertFalse(r.valid);
        assertEquals("INVALID_FLOAT_VALUE", r.errors.get(0).code);
        assertEquals("INVALID_FLOAT_VALUE",
                validator.validateVariableValue(number, "m", ResolvedValue.bool(true)).errors.get(0).code);
    }
}
