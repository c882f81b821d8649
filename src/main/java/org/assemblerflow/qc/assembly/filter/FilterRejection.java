package org.assemblerflow.qc.assembly.filter;

import org.assemblerflow.qc.utils.MathUtils;
import org.assemblerflow.qc.utils.Utils;

/**
 * Why a contig was excluded: the rule it failed and the value it was tested with.
 */
public final class FilterRejection {

    private final FilterRule rule;
    private final double observed;

    public FilterRejection(final FilterRule rule, final double observed) {
        this.rule = Utils.nonNull(rule);
        this.observed = observed;
    }

    public FilterRule getRule() {
        return rule;
    }

    public double getObserved() {
        return observed;
    }

    /**
     * {@code <key>/<observed>/<threshold>}, e.g. {@code length/150/200}
     */
    @Override
    public String toString() {
        return rule.getAttribute().getKey() + "/" + rule.getAttribute().format(observed) + "/" + MathUtils.formatNumber(rule.getThreshold());
    }
}
