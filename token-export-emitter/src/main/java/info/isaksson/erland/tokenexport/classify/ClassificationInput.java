package info.isaksson.erland.tokenexport.classify;

import info.isaksson.erland.tokenexport.model.NumberValue;
import info.isaksson.erland.tokenexport.model.ResolvedValue;
import info.isaksson.erland.tokenexport.model.TextValue;
import info.isaksson.erland.tokenexport.model.Variable;

import java.util.List;
import java.util.Locale;

/**
 * Pre-computed view of a (variable, value) pair that classification rules test against.
 */
public final class ClassificationInput {
    public final Variable variable;
    public final ResolvedValue value;

    public final String nameLower;
    public final String descriptionLower;

    /** NaN unless the value is a {@link NumberValue}. */
    public final double number;

    /** Null unless the value is a {@link TextValue}. */
    public final String text;

    public ClassificationInput(Variable variable, ResolvedValue value) {
        this.variable = variable;
        this.value = value;
        this.nameLower = variable == null || variable.name == null ? "" : variable.name.toLowerCase(Locale.ROOT);
        this.descriptionLower = variable == null ? "" : variable.description.toLowerCase(Locale.ROOT);
        this.number = value instanceof NumberValue n ? n.value : Double.NaN;
        this.text = value instanceof TextValue t ? t.value : null;
    }

    public boolean hasScope(String scope) {
        return variable != null && variable.hasScope(scope);
    }

    /** Keyword match against name or description. */
    public boolean mentions(List<String> keywords) {
        return KeywordPatterns.hasKeywords(List.of(nameLower, descriptionLower), keywords);
    }

    public boolean nameMentions(List<String> keywords) {
        return KeywordPatterns.hasKeywords(List.of(nameLower), keywords);
    }

    public boolean numberBetween(double min, double max) {
        return number >= min && number <= max;
    }
}
