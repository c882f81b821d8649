package org.assemblerflow.qc.assembly.filter;

import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.Utils;

/**
 * The minimum per-contig coverage of a coverage filter: either a fixed value or {@code auto}, derived from the
 * assembly's own mean coverage. Decided once, by {@link #parse(String)}, from the user's argument.
 */
public abstract class MinimumCoverage {

    public static final String AUTO_KEYWORD = "auto";

    private MinimumCoverage() { }

    /**
     * @param totalCoverage sum of the per-contig coverage values
     * @param totalLength sum of the contig lengths
     * @param autoFactor fraction of the mean coverage used by {@link Auto}
     * @param autoFloor lowest value {@link Auto} resolves to
     */
    public abstract double resolve(double totalCoverage, long totalLength, double autoFactor, double autoFloor);

    public boolean isAuto() {
        return this instanceof Auto;
    }

    public static MinimumCoverage parse(final String value) {
        Utils.nonNull(value);
        final String trimmed = value.trim();
        if (AUTO_KEYWORD.equalsIgnoreCase(trimmed)) {
            return new Auto();
        }
        final double fixed;
        try {
            fixed = Double.parseDouble(trimmed);
        } catch (final NumberFormatException e) {
            throw new UserException.BadInput("minimum coverage must be '" + AUTO_KEYWORD + "' or a number but was '" + value + "'", e);
        }
        if (fixed < 0 || Double.isNaN(fixed) || Double.isInfinite(fixed)) {
            throw new UserException.BadInput("minimum coverage must be a non-negative number but was '" + value + "'");
        }
        return new Fixed(fixed);
    }

    public static final class Auto extends MinimumCoverage {

        /**
         * {@code max(autoFloor, totalCoverage / totalLength * autoFactor)}
         */
        @Override
        public double resolve(final double totalCoverage, final long totalLength, final double autoFactor, final double autoFloor) {
            Utils.validateArg(totalLength > 0, () -> "cannot derive a minimum coverage from total length " + totalLength);
            final double raw = (totalCoverage / totalLength) * autoFactor;
            return raw < autoFloor ? autoFloor : raw;
        }

        @Override
        public String toString() {
            return AUTO_KEYWORD;
        }
    }

    public static final class Fixed extends MinimumCoverage {
        private final double value;

        public Fixed(final double value) {
            Utils.validateArg(value >= 0, () -> "minimum coverage must not be negative but was " + value);
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public double resolve(final double totalCoverage, final long totalLength, final double autoFactor, final double autoFloor) {
            return value;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }
}
