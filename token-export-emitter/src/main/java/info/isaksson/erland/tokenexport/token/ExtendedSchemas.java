package info.isaksson.erland.tokenexport.token;

import info.isaksson.erland.tokenexport.classify.SchemaHint;
import info.isaksson.erland.tokenexport.classify.SemanticType;

/**
 * Schema URLs of the extended token format.
 */
public final class ExtendedSchemas {

    private ExtendedSchemas() {}

    /** Every URL written by this exporter starts with this prefix. */
    public static final String SCHEMA_ROOT = "https://opensource.adobe.com/spectrum-tokens/schemas/";

    public static final String BASE_URL = SCHEMA_ROOT + "token-types";

    /**
     * Schema URL for a classified value. The hint wins; without one the semantic type decides.
     */
    public static String urlFor(SemanticType type, SchemaHint hint) {
        if (hint != null) return url(hint);
        if (type == null) return url(SchemaHint.ALIAS);
        switch (type) {
            case COLOR:
                return url(SchemaHint.COLOR);
            case DIMENSION:
                return url(SchemaHint.DIMENSION);
            case OPACITY:
                return url(SchemaHint.OPACITY);
            case FONT_FAMILY:
                return url(SchemaHint.FONT_FAMILY);
            case FONT_WEIGHT:
                return url(SchemaHint.FONT_WEIGHT);
            case NUMBER:
            case MULTIPLIER:
            case DURATION:
                return url(SchemaHint.MULTIPLIER);
            case STRING:
            case ALIAS:
            default:
                return url(SchemaHint.ALIAS);
        }
    }

    public static String url(SchemaHint hint) {
        return BASE_URL + "/" + hint.schemaFile;
    }

    public static boolean isStandardUrl(String url) {
        return url != null && url.startsWith(SCHEMA_ROOT);
    }
}
