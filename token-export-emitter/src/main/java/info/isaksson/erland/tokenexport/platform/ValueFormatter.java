package info.isaksson.erland.tokenexport.platform;

import com.fasterxml.jackson.databind.JsonNode;

/** Rewrites one canonical value into a platform literal. */
@FunctionalInterface
public interface ValueFormatter {

    /**
     * @param value      canonical {@code $value}
     * @param schemaHint hint tag from the token's extensions; may be null
     */
    String format(JsonNode value, String schemaHint);
}
