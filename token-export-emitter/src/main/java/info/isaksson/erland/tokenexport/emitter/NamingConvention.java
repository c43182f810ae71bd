package info.isaksson.erland.tokenexport.emitter;

/** Case convention applied to token names. */
public enum NamingConvention {
    /** Lower-case, whitespace becomes {@code -}. */
    KEBAB("kebab"),
    /** Separators followed by a character become that character upper-cased. */
    CAMEL("camel"),
    /** Lower-case, hyphens and whitespace become {@code _}. */
    SNAKE("snake"),
    /** Names are kept as they are. */
    ORIGINAL("original");

    public final String tag;

    NamingConvention(String tag) {
        this.tag = tag;
    }

    public static boolean isTag(String v) {
        if (v == null) return false;
        for (NamingConvention x : values()) {
            if (x.tag.equals(v.trim())) return true;
        }
        return false;
    }

    /** Accepted tags joined with {@code |}. */
    public static String expected() {
        StringBuilder sb = new StringBuilder();
        for (NamingConvention x : values()) {
            if (sb.length() > 0) sb.append('|');
            sb.append(x.tag);
        }
        return sb.toString();
    }

    public static NamingConvention fromTag(String v) {
        if (v == null) return KEBAB;
        String s = v.trim();
        for (NamingConvention x : values()) {
            if (x.tag.equals(s)) return x;
        }
        throw new IllegalArgumentException("Invalid value for namingConvention: " + v + " (expected one of: " + expected() + ")");
    }
}
