package info.isaksson.erland.tokenexport.classify;

import info.isaksson.erland.tokenexport.model.ResolvedPrimitive;
import info.isaksson.erland.tokenexport.model.ResolvedValue;
import info.isaksson.erland.tokenexport.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static info.isaksson.erland.tokenexport.classify.ClassificationResult.of;
import static info.isaksson.erland.tokenexport.classify.Confidence.HIGH;
import static info.isaksson.erland.tokenexport.classify.Confidence.LOW;
import static info.isaksson.erland.tokenexport.classify.Confidence.MEDIUM;

/**
 * Infers a semantic token type from a variable's primitive kind, its value and weak textual signals.
 *
 * <p>Numeric and string values run through ordered rule lists; the first matching rule wins.
 * Rule order encodes priority (scope beats keyword beats default) and must not be changed
 * without revisiting the tests. The classifier is stateless and never throws.</p>
 */
public final class TypeClassifier {

    private static final Logger log = LoggerFactory.getLogger(TypeClassifier.class);

    static final ClassificationResult ALIAS =
            of(SemanticType.ALIAS, HIGH, "Variable is an alias reference", SchemaHint.ALIAS);
    static final ClassificationResult COLOR =
            of(SemanticType.COLOR, HIGH, "COLOR variable", SchemaHint.COLOR);
    static final ClassificationResult BOOLEAN =
            of(SemanticType.NUMBER, HIGH, "boolean coerced to 0/1");
    static final ClassificationResult FALLBACK =
            of(SemanticType.STRING, LOW, "Unsupported variable type or value");

    private static final ClassificationResult BORDER_RADIUS_SCOPE =
            of(SemanticType.DIMENSION, HIGH, "CORNER_RADIUS scope detected", SchemaHint.BORDER_RADIUS);

    private static final List<ClassificationRule> FLOAT_RULES = List.of(
            new ClassificationRule("corner-radius-scope",
                    in -> in.hasScope(Variable.SCOPE_CORNER_RADIUS),
                    BORDER_RADIUS_SCOPE),
            new ClassificationRule("border-radius-keyword",
                    in -> in.mentions(KeywordPatterns.BORDER_RADIUS),
                    of(SemanticType.DIMENSION, HIGH, "Border radius keywords detected", SchemaHint.BORDER_RADIUS)),
            new ClassificationRule("unit-interval-opacity",
                    in -> in.numberBetween(0, 1) && in.mentions(KeywordPatterns.OPACITY),
                    of(SemanticType.OPACITY, HIGH, "Value in [0,1] range with opacity keywords", SchemaHint.OPACITY)),
            new ClassificationRule("unit-interval-multiplier",
                    in -> in.numberBetween(0, 1) && in.mentions(KeywordPatterns.MULTIPLIER),
                    of(SemanticType.MULTIPLIER, HIGH, "Value in [0,1] range with multiplier keywords", SchemaHint.MULTIPLIER)),
            new ClassificationRule("unit-interval-default",
                    in -> in.numberBetween(0, 1),
                    of(SemanticType.OPACITY, MEDIUM, "Value in [0,1] range, likely opacity", SchemaHint.OPACITY)),
            new ClassificationRule("font-weight",
                    in -> in.numberBetween(100, 1000) && in.mentions(KeywordPatterns.FONT_WEIGHT),
                    of(SemanticType.FONT_WEIGHT, HIGH, "Value in [100,1000] range with weight keywords", SchemaHint.FONT_WEIGHT)),
            new ClassificationRule("duration-keyword",
                    in -> in.mentions(KeywordPatterns.DURATION),
                    of(SemanticType.DURATION, HIGH, "Duration keywords detected")),
            new ClassificationRule("multiplier-keyword",
                    in -> in.mentions(KeywordPatterns.MULTIPLIER),
                    of(SemanticType.MULTIPLIER, HIGH, "Multiplier keywords detected", SchemaHint.MULTIPLIER)),
            new ClassificationRule("line-height",
                    in -> in.numberBetween(1, 3) && in.mentions(KeywordPatterns.LINE_HEIGHT),
                    of(SemanticType.NUMBER, HIGH, "Line height keywords detected")),
            new ClassificationRule("font-size-keyword",
                    in -> in.mentions(KeywordPatterns.FONT_SIZE),
                    of(SemanticType.DIMENSION, HIGH, "Font size keywords detected", SchemaHint.FONT_SIZE)),
            new ClassificationRule("dimension-keyword",
                    in -> in.mentions(KeywordPatterns.DIMENSION),
                    of(SemanticType.DIMENSION, HIGH, "Dimension keywords detected", SchemaHint.DIMENSION)),
            new ClassificationRule("common-spacing-value",
                    in -> KeywordPatterns.isCommonSpacingValue(in.number),
                    of(SemanticType.DIMENSION, MEDIUM, "Value matches common pixel dimensions", SchemaHint.DIMENSION)),
            new ClassificationRule("dimension-fallback",
                    in -> true,
                    of(SemanticType.DIMENSION, LOW, "No specific pattern detected, defaulting to dimension", SchemaHint.DIMENSION))
    );

    private static final List<ClassificationRule> STRING_RULES = List.of(
            new ClassificationRule("font-family",
                    in -> (in.nameMentions(KeywordPatterns.FONT_FAMILY)
                            && !in.nameMentions(KeywordPatterns.FONT_WEIGHT)
                            && !in.nameMentions(KeywordPatterns.FONT_SIZE))
                            || KeywordPatterns.isFontFamilyValue(in.text),
                    of(SemanticType.FONT_FAMILY, HIGH, "Font family keywords or font name detected", SchemaHint.FONT_FAMILY)),
            new ClassificationRule("font-weight",
                    in -> in.nameMentions(KeywordPatterns.FONT_WEIGHT) || KeywordPatterns.isFontWeightValue(in.text),
                    of(SemanticType.FONT_WEIGHT, HIGH, "Font weight keywords or weight name detected", SchemaHint.FONT_WEIGHT)),
            new ClassificationRule("unit-suffix",
                    in -> KeywordPatterns.hasDimensionUnit(in.text),
                    of(SemanticType.DIMENSION, HIGH, "Value contains dimension unit", SchemaHint.DIMENSION)),
            new ClassificationRule("generic-string",
                    in -> true,
                    of(SemanticType.STRING, MEDIUM, "Generic string value"))
    );

    /** Ordered rules for FLOAT variables. */
    public static List<ClassificationRule> floatRules() {
        return FLOAT_RULES;
    }

    /** Ordered rules for STRING variables. */
    public static List<ClassificationRule> stringRules() {
        return STRING_RULES;
    }

    public ClassificationResult classify(Variable variable, ResolvedValue value) {
        if (value != null && value.isAlias()) return ALIAS;
        if (variable == null || variable.resolvedType == null) return FALLBACK;

        try {
            switch (variable.resolvedType) {
                case COLOR:
                    return COLOR;
                case BOOLEAN:
                    return BOOLEAN;
                case STRING: {
                    ClassificationInput in = new ClassificationInput(variable, value);
                    if (in.text == null) return FALLBACK;
                    return firstMatch(STRING_RULES, in);
                }
                case FLOAT: {
                    ClassificationInput in = new ClassificationInput(variable, value);
                    if (Double.isNaN(in.number)) return FALLBACK;
                    return firstMatch(FLOAT_RULES, in);
                }
                default:
                    return FALLBACK;
            }
        } catch (RuntimeException ex) {
            log.debug("Classification of {} failed, using fallback", variable.name, ex);
            return FALLBACK;
        }
    }

    /** Name of the rule that decides a FLOAT or STRING pair; empty for short-circuit cases. */
    public String decidingRule(Variable variable, ResolvedValue value) {
        if (value == null || value.isAlias() || variable == null || variable.resolvedType == null) return "";
        ClassificationInput in = new ClassificationInput(variable, value);
        if (variable.resolvedType == ResolvedPrimitive.FLOAT && Double.isNaN(in.number)) return "";
        if (variable.resolvedType == ResolvedPrimitive.STRING && in.text == null) return "";
        List<ClassificationRule> rules = switch (variable.resolvedType) {
            case FLOAT -> FLOAT_RULES;
            case STRING -> STRING_RULES;
            default -> List.of();
        };
        for (ClassificationRule r : rules) {
            if (r.matches(in)) return r.name;
        }
        return "";
    }

    private static ClassificationResult firstMatch(List<ClassificationRule> rules, ClassificationInput in) {
        for (ClassificationRule r : rules) {
            if (r.matches(in)) return r.result;
        }
        return FALLBACK;
    }
}
