package info.isaksson.erland.tokenexport.platform;

/** Target of the platform code document. */
public enum Platform {
    /** Canonical values are kept. */
    WEB("web"),
    /** SwiftUI literals. */
    IOS("ios"),
    /** Android XML resources. */
    ANDROID("android"),
    /** Jetpack Compose literals. */
    COMPOSE("compose");

    public final String tag;

    Platform(String tag) {
        this.tag = tag;
    }

    public static boolean isTag(String v) {
        if (v == null) return false;
        for (Platform p : values()) {
            if (p.tag.equals(v.trim())) return true;
        }
        return false;
    }

    public static Platform fromTag(String v) {
        if (v == null) return WEB;
        String s = v.trim().toLowerCase();
        for (Platform p : values()) {
            if (p.tag.equals(s)) return p;
        }
        throw new IllegalArgumentException("Invalid value for platform: " + v + " (expected one of: web|ios|android|compose)");
    }
}
