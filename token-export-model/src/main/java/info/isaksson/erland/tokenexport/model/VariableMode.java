package info.isaksson.erland.tokenexport.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"modeId","name"})
public final class VariableMode {
    public final String modeId;
    public final String name;

    @JsonCreator
    public VariableMode(
            @JsonProperty("modeId") String modeId,
            @JsonProperty("name") String name
    ) {
        this.modeId = modeId;
        this.name = name == null ? modeId : name;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableMode)) return false;
        VariableMode that = (VariableMode) o;
        return Objects.equals(modeId, that.modeId) && Objects.equals(name, that.name);
    }

    @Override public int hashCode() {
        return Objects.hash(modeId, name);
    }

    @Override public String toString() {
        return "VariableMode{" + modeId + "=" + name + "}";
    }
}
