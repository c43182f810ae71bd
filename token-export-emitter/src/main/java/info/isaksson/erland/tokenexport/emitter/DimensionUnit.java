package info.isaksson.erland.tokenexport.emitter;

/** Unit attached to unit-less numeric dimensions. */
public enum DimensionUnit {
    PX("px"),
    REM("rem");

    public final String tag;

    DimensionUnit(String tag) {
        this.tag = tag;
    }

    public static boolean isTag(String v) {
        if (v == null) return false;
        for (DimensionUnit x : values()) {
            if (x.tag.equals(v.trim())) return true;
        }
        return false;
    }

    /** Accepted tags joined with {@code |}. */
    public static String expected() {
        StringBuilder sb = new StringBuilder();
        for (DimensionUnit x : values()) {
            if (sb.length() > 0) sb.append('|');
            sb.append(x.tag);
        }
        return sb.toString();
    }

    public static DimensionUnit fromTag(String v) {
        if (v == null) return PX;
        String s = v.trim();
        for (DimensionUnit x : values()) {
            if (x.tag.equals(s)) return x;
        }
        throw new IllegalArgumentException("Invalid value for defaultUnit: " + v + " (expected one of: " + expected() + ")");
    }
}
