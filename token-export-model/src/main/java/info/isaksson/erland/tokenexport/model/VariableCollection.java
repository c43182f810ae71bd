package info.isaksson.erland.tokenexport.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Group of variables sharing a set of modes.
 */
@JsonPropertyOrder({"id","name","modes","defaultModeId","variableIds"})
public final class VariableCollection {
    public final String id;
    public final String name;
    public final List<VariableMode> modes;

    /** Falls back to the first mode when the input does not name one. */
    public final String defaultModeId;

    public final List<String> variableIds;

    @JsonCreator
    public VariableCollection(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("modes") List<VariableMode> modes,
            @JsonProperty("defaultModeId") String defaultModeId,
            @JsonProperty("variableIds") List<String> variableIds
    ) {
        this.id = id;
        this.name = name == null ? "" : name;
        this.modes = modes == null ? List.of() : List.copyOf(modes);
        this.defaultModeId = (defaultModeId == null || defaultModeId.isBlank()) && !this.modes.isEmpty()
                ? this.modes.get(0).modeId
                : defaultModeId;
        this.variableIds = variableIds == null ? List.of() : List.copyOf(variableIds);
    }

    @JsonIgnore
    public Optional<VariableMode> mode(String modeId) {
        if (modeId == null) return Optional.empty();
        for (VariableMode m : modes) {
            if (modeId.equals(m.modeId)) return Optional.of(m);
        }
        return Optional.empty();
    }

    /** Display name of a mode, or the id itself when the collection does not know it. */
    public String modeName(String modeId) {
        return mode(modeId).map(m -> m.name).orElse(modeId);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableCollection)) return false;
        VariableCollection that = (VariableCollection) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                Objects.equals(modes, that.modes) &&
                Objects.equals(defaultModeId, that.defaultModeId) &&
                Objects.equals(variableIds, that.variableIds);
    }

    @Override public int hashCode() {
        return Objects.hash(id, name, modes, defaultModeId, variableIds);
    }
}
