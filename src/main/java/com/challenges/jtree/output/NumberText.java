package com.challenges.jtree.output;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Renders numbers the way C's {@code printf} family would, choosing between
 * integer, whole, exponential and fixed notation.
 * <p>
 * Digits are computed from the exact binary value with {@link BigDecimal},
 * rounding half-even, so the output matches glibc for every finite double.
 */
public final class NumberText {
    /** C's {@code DBL_EPSILON}. */
    static final double DBL_EPSILON = Math.ulp(1.0);

    private static final int FRACTION_DIGITS = 6;

    private NumberText() {
    }

    /**
     * @param value     the number
     * @param truncated {@code value} truncated to an int
     */
    public static String format(double value, int truncated) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (Math.abs(truncated - value) <= DBL_EPSILON
            && value <= Integer.MAX_VALUE && value >= Integer.MIN_VALUE) {
            return Integer.toString(truncated);
        }
        if (Math.abs(Math.floor(value) - value) <= DBL_EPSILON && Math.abs(value) < 1.0e60) {
            return fixed(value, 0);
        }
        if (Math.abs(value) < 1.0e-6 || Math.abs(value) > 1.0e9) {
            return exponential(value);
        }
        return fixed(value, FRACTION_DIGITS);
    }

    /** {@code %.Nf} */
    static String fixed(double value, int fractionDigits) {
        return new BigDecimal(value).setScale(fractionDigits, RoundingMode.HALF_EVEN).toPlainString();
    }

    /** {@code %e} */
    static String exponential(double value) {
        BigDecimal exact = new BigDecimal(value);
        int exponent = 0;
        BigDecimal mantissa = exact;
        if (exact.signum() != 0) {
            BigDecimal rounded = exact.round(new MathContext(FRACTION_DIGITS + 1, RoundingMode.HALF_EVEN));
            exponent = rounded.precision() - rounded.scale() - 1;
            mantissa = rounded.movePointLeft(exponent);
        }
        StringBuilder sb = new StringBuilder(16);
        sb.append(mantissa.setScale(FRACTION_DIGITS, RoundingMode.UNNECESSARY).toPlainString());
        sb.append('e').append(exponent < 0 ? '-' : '+');
        int magnitude = Math.abs(exponent);
        if (magnitude < 10) {
            sb.append('0');
        }
        return sb.append(magnitude).toString();
    }
}
