package org.assemblerflow.qc.assembly.filter;

import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.Utils;

/**
 * Comparison applied by a {@link FilterRule} between an observed contig attribute (left) and the rule threshold (right).
 */
public enum ComparisonOperator {
    GREATER_THAN(">") {
        @Override
        public boolean test(final double observed, final double threshold) {
            return observed > threshold;
        }
    },
    LESS_THAN("<") {
        @Override
        public boolean test(final double observed, final double threshold) {
            return observed < threshold;
        }
    },
    GREATER_OR_EQUAL(">=") {
        @Override
        public boolean test(final double observed, final double threshold) {
            return observed >= threshold;
        }
    },
    LESS_OR_EQUAL("<=") {
        @Override
        public boolean test(final double observed, final double threshold) {
            return observed <= threshold;
        }
    },
    EQUAL("==") {
        @Override
        public boolean test(final double observed, final double threshold) {
            return Double.compare(observed, threshold) == 0;
        }
    },
    NOT_EQUAL("!=") {
        @Override
        public boolean test(final double observed, final double threshold) {
            return Double.compare(observed, threshold) != 0;
        }
    };

    private final String symbol;

    ComparisonOperator(final String symbol) {
        this.symbol = symbol;
    }

    public abstract boolean test(final double observed, final double threshold);

    public String getSymbol() {
        return symbol;
    }

    public static ComparisonOperator fromSymbol(final String symbol) {
        Utils.nonNull(symbol);
        for (final ComparisonOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new UserException.BadInput("unknown comparison operator '" + symbol + "'");
    }
}
