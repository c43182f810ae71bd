package info.isaksson.erland.tokenexport.emitter;

/** Shape of the canonical token document. */
public enum TokenStructure {
    /** One top-level key per token; path segments joined with {@code -}. */
    FLAT("flat"),
    /** Nested groups; path segments joined with {@code .} and split into objects. */
    NESTED("nested");

    public final String tag;

    TokenStructure(String tag) {
        this.tag = tag;
    }

    public static boolean isTag(String v) {
        if (v == null) return false;
        for (TokenStructure x : values()) {
            if (x.tag.equals(v.trim())) return true;
        }
        return false;
    }

    /** Accepted tags joined with {@code |}. */
    public static String expected() {
        StringBuilder sb = new StringBuilder();
        for (TokenStructure x : values()) {
            if (sb.length() > 0) sb.append('|');
            sb.append(x.tag);
        }
        return sb.toString();
    }

    public static TokenStructure fromTag(String v) {
        if (v == null) return FLAT;
        String s = v.trim();
        for (TokenStructure x : values()) {
            if (x.tag.equals(s)) return x;
        }
        throw new IllegalArgumentException("Invalid value for structure: " + v + " (expected one of: " + expected() + ")");
    }
}
