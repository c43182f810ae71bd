package info.isaksson.erland.tokenexport.platform;

import java.util.Locale;
import java.util.Objects;

/** Color with 0..1 channels. */
public final class Rgba {
    public final double red;
    public final double green;
    public final double blue;
    public final double alpha;

    public Rgba(double red, double green, double blue, double alpha) {
        this.red = clamp01(red);
        this.green = clamp01(green);
        this.blue = clamp01(blue);
        this.alpha = clamp01(alpha);
    }

    public static final Rgba BLACK = new Rgba(0, 0, 0, 1);

    /** {@code AARRGGBB}, upper-case. */
    public String argbHex() {
        return byteHex(alpha) + byteHex(red) + byteHex(green) + byteHex(blue);
    }

    /** {@code RRGGBB}, upper-case. */
    public String rgbHex() {
        return byteHex(red) + byteHex(green) + byteHex(blue);
    }

    static double clamp01(double v) {
        if (Double.isNaN(v)) return 0;
        return Math.min(1, Math.max(0, v));
    }

    static String byteHex(double v) {
        return String.format(Locale.ROOT, "%02X", Math.round(clamp01(v) * 255));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rgba)) return false;
        Rgba that = (Rgba) o;
        return Double.compare(red, that.red) == 0 &&
                Double.compare(green, that.green) == 0 &&
                Double.compare(blue, that.blue) == 0 &&
                Double.compare(alpha, that.alpha) == 0;
    }

    @Override public int hashCode() {
        return Objects.hash(red, green, blue, alpha);
    }

    @Override public String toString() {
        return "Rgba{#" + argbHex() + "}";
    }
}
