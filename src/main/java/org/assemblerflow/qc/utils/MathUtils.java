package org.assemblerflow.qc.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * MathUtils is a static class (no instantiation allowed!) with some useful math methods.
 */
public final class MathUtils {

    private MathUtils() { }

    /**
     * Rounds the double to the given number of decimal places.
     * For example, rounding 3.1415926 to 3 places would give 3.142.
     * Ties are resolved on the decimal representation of {@code in}, half to even.
     */
    public static double roundToNDecimalPlaces(final double in, final int n) {
        Utils.validateArg(n > 0, "must round to at least one decimal place");
        Utils.validateArg(wellFormedDouble(in), () -> "cannot round " + in);
        return BigDecimal.valueOf(in).setScale(n, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static boolean wellFormedDouble(final double val) {
        return !Double.isInfinite(val) && !Double.isNaN(val);
    }

    public static long sum(final int[] values) {
        long total = 0;
        for (final int v : values) {
            total += v;
        }
        return total;
    }

    /**
     * Arithmetic mean of a non-empty slice {@code [from, to)} of {@code values}.
     */
    public static double mean(final List<Integer> values, final int from, final int to) {
        Utils.nonNull(values);
        Utils.validateArg(from >= 0 && from < to && to <= values.size(), () -> "invalid slice [" + from + ", " + to + ") of " + values.size() + " values");
        long total = 0;
        for (int i = from; i < to; i++) {
            total += values.get(i);
        }
        return total / (double) (to - from);
    }

    /**
     * Renders a number the way the pipeline's plain-text channels expect it: integral values without a
     * fractional part, everything else with {@link Double#toString(double)}.
     */
    public static String formatNumber(final double value) {
        if (wellFormedDouble(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * Renders a double in the repr form used by the downstream report tables: positional notation with at
     * least one fractional digit ({@code 6.0}, {@code 0.0001}, {@code 25000000.0}) for magnitudes in
     * {@code [1e-4, 1e16)}, and {@code 1.5e-05} / {@code 1e+16} style exponent notation outside it.
     */
    public static String formatDecimal(final double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return (1.0 / value) < 0 ? "-0.0" : "0.0";
        }
        final BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        final double magnitude = Math.abs(value);
        if (magnitude >= 1e-4 && magnitude < 1e16) {
            final String plain = decimal.toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }
        final String digits = decimal.unscaledValue().abs().toString();
        final int exponent = digits.length() - 1 - decimal.scale();
        final StringBuilder builder = new StringBuilder();
        if (value < 0) {
            builder.append('-');
        }
        builder.append(digits.charAt(0));
        if (digits.length() > 1) {
            builder.append('.').append(digits, 1, digits.length());
        }
        builder.append('e').append(exponent < 0 ? '-' : '+');
        final int absExponent = Math.abs(exponent);
        if (absExponent < 10) {
            builder.append('0');
        }
        return builder.append(absExponent).toString();
    }
}
