package info.isaksson.erland.tokenexport.emitter;

import java.math.BigDecimal;

/** Shortest plain rendering of a double: {@code 16}, {@code 0.5}, never an exponent. */
public final class NumberText {
    private NumberText() {}

    public static String format(double v) {
        if (!Double.isFinite(v)) return "0";
        if (v == Math.rint(v) && Math.abs(v) < 1e15) {
            return Long.toString((long) v);
        }
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }
}
