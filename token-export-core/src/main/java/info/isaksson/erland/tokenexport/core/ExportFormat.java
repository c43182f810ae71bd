package info.isaksson.erland.tokenexport.core;

/** Which token documents an export produces. */
public enum ExportFormat {
    CANONICAL("canonical"),
    EXTENDED("extended"),
    BOTH("both"),
    /** Canonical tokens rewritten into platform literals. */
    PLATFORM_CODE("platform-code");

    public final String tag;

    ExportFormat(String tag) {
        this.tag = tag;
    }

    public boolean buildsCanonical() {
        return this != EXTENDED;
    }

    public boolean buildsExtended() {
        return this == EXTENDED || this == BOTH;
    }

    /** Returns null for unknown tags. */
    public static ExportFormat fromTag(String v) {
        if (v == null) return null;
        for (ExportFormat f : values()) {
            if (f.tag.equals(v.trim())) return f;
        }
        return null;
    }

    public static String expected() {
        return "canonical, extended, both, platform-code";
    }
}
