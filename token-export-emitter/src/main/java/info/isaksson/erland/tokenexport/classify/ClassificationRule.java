package info.isaksson.erland.tokenexport.classify;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One guard of the classification cascade: when {@link #test} matches, {@link #result} is returned
 * and later rules are not consulted.
 */
public final class ClassificationRule {
    public final String name;
    public final Predicate<ClassificationInput> test;
    public final ClassificationResult result;

    public ClassificationRule(String name, Predicate<ClassificationInput> test, ClassificationResult result) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.test = Objects.requireNonNull(test, "test must not be null");
        this.result = Objects.requireNonNull(result, "result must not be null");
    }

    public boolean matches(ClassificationInput input) {
        return test.test(input);
    }

    @Override public String toString() {
        return "ClassificationRule{" + name + " -> " + result.semanticType + "/" + result.confidence + "}";
    }
}
