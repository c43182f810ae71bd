package info.isaksson.erland.tokenexport.model;

/**
 * Value of a variable in one mode.
 *
 * <p>Implementations are {@link ColorComponents}, {@link NumberValue}, {@link TextValue},
 * {@link BooleanValue} and {@link AliasReference}. An alias is a pointer to another variable,
 * not data: consumers must test {@link #isAlias()} before anything else.</p>
 */
public interface ResolvedValue {

    default boolean isAlias() {
        return false;
    }

    static ResolvedValue color(double r, double g, double b) {
        return new ColorComponents(r, g, b, null);
    }

    static ResolvedValue color(double r, double g, double b, double a) {
        return new ColorComponents(r, g, b, a);
    }

    static ResolvedValue number(double value) {
        return new NumberValue(value);
    }

    static ResolvedValue text(String value) {
        return new TextValue(value);
    }

    static ResolvedValue bool(boolean value) {
        return new BooleanValue(value);
    }

    static ResolvedValue alias(String targetVariableId) {
        return new AliasReference(targetVariableId);
    }
}
