package org.assemblerflow.qc.assembly.filter;

import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.MathUtils;
import org.assemblerflow.qc.utils.Utils;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single test of a contig attribute against a threshold, e.g. {@code length>=200}.
 */
public final class FilterRule {

    private static final Pattern RULE_PATTERN = Pattern.compile("^(\\w+)\\s*(>=|<=|==|!=|>|<)\\s*(\\S+)$");

    private final ContigAttribute attribute;
    private final ComparisonOperator operator;
    private final double threshold;

    public FilterRule(final ContigAttribute attribute, final ComparisonOperator operator, final double threshold) {
        this.attribute = Utils.nonNull(attribute, "attribute");
        this.operator = Utils.nonNull(operator, "operator");
        Utils.validateArg(!Double.isNaN(threshold), "threshold must be a number");
        this.threshold = threshold;
    }

    /**
     * Parses {@code <key><op><threshold>}, with optional whitespace around the operator.
     */
    public static FilterRule parse(final String rule) {
        Utils.nonNull(rule);
        final Matcher m = RULE_PATTERN.matcher(rule.trim());
        if (!m.matches()) {
            throw new UserException.BadInput("filter rule '" + rule + "' is not of the form <attribute><operator><threshold>");
        }
        final double threshold;
        try {
            threshold = Double.parseDouble(m.group(3));
        } catch (final NumberFormatException e) {
            throw new UserException.BadInput("filter rule '" + rule + "' has a non-numeric threshold", e);
        }
        return new FilterRule(ContigAttribute.fromKey(m.group(1)), ComparisonOperator.fromSymbol(m.group(2)), threshold);
    }

    public boolean test(final ContigCoverageEntry entry) {
        return operator.test(attribute.valueOf(entry), threshold);
    }

    public ContigAttribute getAttribute() {
        return attribute;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final FilterRule that = (FilterRule) o;
        return Double.compare(that.threshold, threshold) == 0 && attribute == that.attribute && operator == that.operator;
    }

    @Override
    public int hashCode() {
        return Objects.hash(attribute, operator, threshold);
    }

    @Override
    public String toString() {
        return attribute.getKey() + operator.getSymbol() + MathUtils.formatNumber(threshold);
    }
}
