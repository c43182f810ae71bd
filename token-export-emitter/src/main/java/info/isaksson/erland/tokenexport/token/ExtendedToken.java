package info.isaksson.erland.tokenexport.token;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Token of the extended schema, serialized as
 * {@code {"$schema", "value", "uuid", "component"?, "private"?, "deprecated"?, "deprecated_comment"?, "sets"?}}.
 */
public final class ExtendedToken implements DesignToken {
    public final String schemaUrl;
    public final JsonNode value;

    /** UUID string; null when identifiers are disabled. */
    public final String stableId;

    /** Component the token belongs to (first path segment); optional. */
    public final String component;

    public final boolean isPrivate;
    public final boolean deprecated;
    public final String deprecatedComment;

    /** Mode name to entry; empty unless the selected modes carry different values. */
    public final Map<String, ExtendedSetEntry> sets;

    public ExtendedToken(String schemaUrl,
                         JsonNode value,
                         String stableId,
                         String component,
                         boolean isPrivate,
                         boolean deprecated,
                         String deprecatedComment,
                         Map<String, ExtendedSetEntry> sets) {
        this.schemaUrl = schemaUrl;
        this.value = value;
        this.stableId = stableId;
        this.component = component;
        this.isPrivate = isPrivate;
        this.deprecated = deprecated;
        this.deprecatedComment = deprecatedComment == null || deprecatedComment.isEmpty() ? null : deprecatedComment;
        this.sets = sets == null || sets.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(sets));
    }

    public static ExtendedToken of(String schemaUrl, JsonNode value, String stableId) {
        return new ExtendedToken(schemaUrl, value, stableId, null, false, false, null, null);
    }

    @Override
    public SchemaKind schemaKind() {
        return SchemaKind.EXTENDED;
    }

    @Override
    public JsonNode value() {
        return value;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtendedToken)) return false;
        ExtendedToken that = (ExtendedToken) o;
        return isPrivate == that.isPrivate &&
                deprecated == that.deprecated &&
                Objects.equals(schemaUrl, that.schemaUrl) &&
                Objects.equals(value, that.value) &&
                Objects.equals(stableId, that.stableId) &&
                Objects.equals(component, that.component) &&
                Objects.equals(deprecatedComment, that.deprecatedComment) &&
                Objects.equals(sets, that.sets);
    }

    @Override public int hashCode() {
        return Objects.hash(schemaUrl, value, stableId, component, isPrivate, deprecated, deprecatedComment, sets);
    }

    @Override public String toString() {
        return "ExtendedToken{" + schemaUrl + " " + value + " " + stableId + "}";
    }
}
