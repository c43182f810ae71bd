package info.isaksson.erland.tokenexport.token;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/** Per-mode value of an extended token whose modes disagree. */
public final class ExtendedSetEntry {
    public final String schemaUrl;
    public final JsonNode value;
    public final String stableId;

    public ExtendedSetEntry(String schemaUrl, JsonNode value, String stableId) {
        this.schemaUrl = schemaUrl;
        this.value = value;
        this.stableId = stableId;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtendedSetEntry)) return false;
        ExtendedSetEntry that = (ExtendedSetEntry) o;
        return Objects.equals(schemaUrl, that.schemaUrl) &&
                Objects.equals(value, that.value) &&
                Objects.equals(stableId, that.stableId);
    }

    @Override public int hashCode() {
        return Objects.hash(schemaUrl, value, stableId);
    }
}
