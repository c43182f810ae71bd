package info.isaksson.erland.tokenexport.token;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Common view of a constructed token in either output schema.
 */
public interface DesignToken {

    SchemaKind schemaKind();

    /** Token value as JSON; null when missing. */
    JsonNode value();
}
