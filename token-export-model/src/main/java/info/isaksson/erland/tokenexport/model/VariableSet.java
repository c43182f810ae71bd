package info.isaksson.erland.tokenexport.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Input document handed over by the host adapter: collections plus their variables.
 */
@JsonPropertyOrder({"collections","variables"})
public final class VariableSet {
    public final List<VariableCollection> collections;
    public final List<Variable> variables;

    @JsonCreator
    public VariableSet(
            @JsonProperty("collections") List<VariableCollection> collections,
            @JsonProperty("variables") List<Variable> variables
    ) {
        this.collections = collections == null ? List.of() : List.copyOf(collections);
        this.variables = variables == null ? List.of() : List.copyOf(variables);
    }

    public static VariableSet empty() {
        return new VariableSet(List.of(), List.of());
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableSet)) return false;
        VariableSet that = (VariableSet) o;
        return Objects.equals(collections, that.collections) && Objects.equals(variables, that.variables);
    }

    @Override public int hashCode() {
        return Objects.hash(collections, variables);
    }
}
