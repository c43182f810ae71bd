package info.isaksson.erland.tokenexport.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.tokenexport.classify.SchemaHint;

import java.util.Objects;

/**
 * Vendor-neutral token, serialized as {@code {"$value", "$type"?, "$description"?, "$deprecated"?, "$extensions"?}}.
 */
public final class CanonicalToken implements DesignToken {
    public final JsonNode value;

    /** Canonical {@code $type} tag; optional. */
    public final String type;

    /** Optional; never empty when present. */
    public final String description;

    public final SchemaHint schemaHint;

    public final boolean deprecated;
    public final String deprecatedComment;

    /** Extra variable metadata written under the exporter's extension key; optional. */
    public final ObjectNode metadata;

    public CanonicalToken(JsonNode value,
                          String type,
                          String description,
                          SchemaHint schemaHint,
                          boolean deprecated,
                          String deprecatedComment,
                          ObjectNode metadata) {
        this.value = value;
        this.type = type;
        this.description = description == null || description.isEmpty() ? null : description;
        this.schemaHint = schemaHint;
        this.deprecated = deprecated;
        this.deprecatedComment = deprecatedComment == null || deprecatedComment.isEmpty() ? null : deprecatedComment;
        this.metadata = metadata;
    }

    public static CanonicalToken of(JsonNode value, String type) {
        return new CanonicalToken(value, type, null, null, false, null, null);
    }

    @Override
    public SchemaKind schemaKind() {
        return SchemaKind.CANONICAL;
    }

    @Override
    public JsonNode value() {
        return value;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanonicalToken)) return false;
        CanonicalToken that = (CanonicalToken) o;
        return deprecated == that.deprecated &&
                Objects.equals(value, that.value) &&
                Objects.equals(type, that.type) &&
                Objects.equals(description, that.description) &&
                schemaHint == that.schemaHint &&
                Objects.equals(deprecatedComment, that.deprecatedComment) &&
                Objects.equals(metadata, that.metadata);
    }

    @Override public int hashCode() {
        return Objects.hash(value, type, description, schemaHint, deprecated, deprecatedComment, metadata);
    }

    @Override public String toString() {
        return "CanonicalToken{" + type + "=" + value + "}";
    }
}
