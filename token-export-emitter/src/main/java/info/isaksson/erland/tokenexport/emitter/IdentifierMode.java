package info.isaksson.erland.tokenexport.emitter;

/** How stable identifiers of extended tokens are produced. */
public enum IdentifierMode {
    /** Name-based UUID v5 over the variable id. */
    DETERMINISTIC("deterministic"),
    /** A fresh random UUID per token. */
    RANDOM("random"),
    /** No identifier is written. */
    NONE("none");

    public final String tag;

    IdentifierMode(String tag) {
        this.tag = tag;
    }

    public static boolean isTag(String v) {
        if (v == null) return false;
        for (IdentifierMode x : values()) {
            if (x.tag.equals(v.trim())) return true;
        }
        return false;
    }

    /** Accepted tags joined with {@code |}. */
    public static String expected() {
        StringBuilder sb = new StringBuilder();
        for (IdentifierMode x : values()) {
            if (sb.length() > 0) sb.append('|');
            sb.append(x.tag);
        }
        return sb.toString();
    }

    public static IdentifierMode fromTag(String v) {
        if (v == null) return DETERMINISTIC;
        String s = v.trim();
        for (IdentifierMode x : values()) {
            if (x.tag.equals(s)) return x;
        }
        throw new IllegalArgumentException("Invalid value for identifierMode: " + v + " (expected one of: " + expected() + ")");
    }
}
