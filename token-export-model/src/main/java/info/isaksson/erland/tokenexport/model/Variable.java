package info.isaksson.erland.tokenexport.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A design variable as produced by the host adapter.
 *
 * <p>Instances are immutable. Missing input fields become "no signal": an empty description,
 * no scopes and no values.</p>
 */
@JsonPropertyOrder({"id","name","resolvedType","valuesByMode","description","scopes","hidden"})
public final class Variable {

    /** Scope hint the host tool attaches to radius variables. */
    public static final String SCOPE_CORNER_RADIUS = "CORNER_RADIUS";

    private static final Pattern DEPRECATED = Pattern.compile("^\\s*\\[?deprecated\\]?(?:[:\\s]+(.*))?$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public final String id;
    public final String name;

    /** May be null when the adapter omitted it; validation reports that. */
    public final ResolvedPrimitive resolvedType;

    /** Insertion ordered. */
    public final Map<String, ResolvedValue> valuesByMode;

    public final String description;
    public final Set<String> scopes;
    public final boolean hidden;

    @JsonCreator
    public Variable(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("resolvedType") ResolvedPrimitive resolvedType,
            @JsonProperty("valuesByMode") Map<String, ResolvedValue> valuesByMode,
            @JsonProperty("description") String description,
            @JsonProperty("scopes") List<String> scopes,
            @JsonProperty("hidden") @JsonAlias("hiddenFromPublishing") boolean hidden
    ) {
        this.id = id;
        this.name = name;
        this.resolvedType = resolvedType;
        this.valuesByMode = valuesByMode == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(valuesByMode));
        this.description = description == null ? "" : description;
        this.scopes = scopes == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
        this.hidden = hidden;
    }

    public static Variable of(String id, String name, ResolvedPrimitive type, Map<String, ResolvedValue> values) {
        return new Variable(id, name, type, values, null, null, false);
    }

    public Variable withDescription(String newDescription) {
        return new Variable(id, name, resolvedType, valuesByMode, newDescription, List.copyOf(scopes), hidden);
    }

    public Variable withScopes(String... newScopes) {
        return new Variable(id, name, resolvedType, valuesByMode, description, List.of(newScopes), hidden);
    }

    public Variable withHidden(boolean newHidden) {
        return new Variable(id, name, resolvedType, valuesByMode, description, List.copyOf(scopes), newHidden);
    }

    @JsonIgnore
    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }

    /** True when the description starts with a {@code deprecated} marker. */
    @JsonIgnore
    public boolean isDeprecated() {
        return DEPRECATED.matcher(description).matches();
    }

    /** Text following the deprecation marker, or an empty string. */
    @JsonIgnore
    public String deprecationComment() {
        Matcher m = DEPRECATED.matcher(description);
        if (!m.matches() || m.group(1) == null) return "";
        return m.group(1).trim();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        Variable that = (Variable) o;
        return hidden == that.hidden &&
                Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                resolvedType == that.resolvedType &&
                Objects.equals(valuesByMode, that.valuesByMode) &&
                Objects.equals(description, that.description) &&
                Objects.equals(scopes, that.scopes);
    }

    @Override public int hashCode() {
        return Objects.hash(id, name, resolvedType, valuesByMode, description, scopes, hidden);
    }

    @Override public String toString() {
        return "Variable{" + id + " '" + name + "' " + resolvedType + "}";
    }
}
