package info.isaksson.erland.tokenexport.validate;

import info.isaksson.erland.tokenexport.model.BooleanValue;
import info.isaksson.erland.tokenexport.model.ColorComponents;
import info.isaksson.erland.tokenexport.model.NumberValue;
import info.isaksson.erland.tokenexport.model.ResolvedValue;
import info.isaksson.erland.tokenexport.model.TextValue;
import info.isaksson.erland.tokenexport.model.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks input variables before conversion.
 */
public final class VariableValidator {

    private static final Pattern FILE_SYSTEM_UNSAFE = Pattern.compile("[<>:\"|?*]");

    public ValidationResult validateVariable(Variable variable) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        if (variable == null) {
            errors.add(new ValidationError("MISSING_ID", "Variable is missing", null));
            return new ValidationResult(errors, warnings);
        }

        if (isBlank(variable.id)) {
            errors.add(new ValidationError("MISSING_ID", "Variable is missing required id", variable.name));
        }
        if (isBlank(variable.name)) {
            errors.add(new ValidationError("MISSING_NAME", "Variable is missing required name", variable.id));
        }
        if (variable.resolvedType == null) {
            errors.add(new ValidationError("MISSING_TYPE",
                    "Variable \"" + variable.name + "\" is missing required type", variable.name));
        }
        if (variable.valuesByMode.isEmpty()) {
            warnings.add(new ValidationWarning("NO_VALUES",
                    "Variable \"" + variable.name + "\" has no values defined", variable.name,
                    "Variable will be skipped during export"));
        }
        if (variable.name != null && FILE_SYSTEM_UNSAFE.matcher(variable.name).find()) {
            warnings.add(new ValidationWarning("INVALID_NAME_CHARACTERS",
                    "Variable \"" + variable.name + "\" contains characters that may cause issues in file systems",
                    variable.name, "Consider renaming to avoid special characters"));
        }
        return new ValidationResult(errors, warnings);
    }

    /**
     * Checks one mode value against the variable's declared primitive. A missing value is a warning;
     * alias references are always accepted.
     */
    public ValidationResult validateVariableValue(Variable variable, String modeId, ResolvedValue value) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        String name = variable == null ? null : variable.name;

        if (value == null) {
            warnings.add(new ValidationWarning("MISSING_MODE_VALUE",
                    "Variable \"" + name + "\" has no value for mode \"" + modeId + "\"", name, null));
            return new ValidationResult(errors, warnings);
        }
        if (value.isAlias() || variable == null || variable.resolvedType == null) {
            return new ValidationResult(errors, warnings);
        }

        switch (variable.resolvedType) {
            case COLOR:
                if (!(value instanceof ColorComponents) || !ValuePredicates.isValidColorComponents((ColorComponents) value)) {
                    errors.add(new ValidationError("INVALID_COLOR_VALUE",
                            "Variable \"" + name + "\" has invalid color value", name, value.toString()));
                }
                break;
            case FLOAT:
                if (!(value instanceof NumberValue)) {
                    errors.add(new ValidationError("INVALID_FLOAT_VALUE",
                            "Variable \"" + name + "\" has a non-numeric float value", name, value.toString()));
                } else if (!Double.isFinite(((NumberValue) value).value)) {
                    errors.add(new ValidationError("INVALID_FLOAT_VALUE",
                            "Variable \"" + name + "\" has invalid float value (NaN or Infinity)", name, value.toString()));
                }
                break;
            case STRING:
                if (!(value instanceof TextValue)) {
                    errors.add(new ValidationError("INVALID_STRING_VALUE",
                            "Variable \"" + name + "\" has invalid string value", name, value.toString()));
                }
                break;
            case BOOLEAN:
                if (!(value instanceof BooleanValue)) {
                    errors.add(new ValidationError("INVALID_BOOLEAN_VALUE",
                            "Variable \"" + name + "\" has invalid boolean value", name, value.toString()));
                }
                break;
            default:
                break;
        }
        return new ValidationResult(errors, warnings);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
