package info.isaksson.erland.tokenexport.classify;

/**
 * Finer-grained hint attached to a classification, used to pick the extended schema URL
 * and some platform formats (font sizes use scaled units on Android/Compose).
 */
public enum SchemaHint {
    COLOR("color", "color.json"),
    DIMENSION("dimension", "dimension.json"),
    BORDER_RADIUS("borderRadius", "dimension.json"),
    FONT_SIZE("fontSize", "font-size.json"),
    OPACITY("opacity", "opacity.json"),
    MULTIPLIER("multiplier", "multiplier.json"),
    FONT_WEIGHT("fontWeight", "font-weight.json"),
    FONT_FAMILY("fontFamily", "font-family.json"),
    ALIAS("alias", "alias.json");

    public final String tag;
    public final String schemaFile;

    SchemaHint(String tag, String schemaFile) {
        this.tag = tag;
        this.schemaFile = schemaFile;
    }

    public static SchemaHint fromTag(String tag) {
        if (tag == null) return null;
        for (SchemaHint h : values()) {
            if (h.tag.equals(tag)) return h;
        }
        return null;
    }
}
