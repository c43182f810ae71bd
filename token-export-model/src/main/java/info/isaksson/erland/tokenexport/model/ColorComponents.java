package info.isaksson.erland.tokenexport.model;

import java.util.Objects;

/** RGB(A) color with components in the 0..1 range. Alpha is optional. */
public final class ColorComponents implements ResolvedValue {
    public final double r;
    public final double g;
    public final double b;

    /** Null when the source color carried no alpha channel. */
    public final Double a;

    public ColorComponents(double r, double g, double b, Double a) {
        this.r = r;
        this.g = g;
        this.b = b;
        this.a = a;
    }

    public boolean hasAlpha() {
        return a != null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColorComponents)) return false;
        ColorComponents that = (ColorComponents) o;
        return Double.compare(r, that.r) == 0 &&
                Double.compare(g, that.g) == 0 &&
                Double.compare(b, that.b) == 0 &&
                Objects.equals(a, that.a);
    }

    @Override public int hashCode() {
        return Objects.hash(r, g, b, a);
    }

    @Override public String toString() {
        return "ColorComponents{r=" + r + ", g=" + g + ", b=" + b + (a == null ? "" : ", a=" + a) + "}";
    }
}
