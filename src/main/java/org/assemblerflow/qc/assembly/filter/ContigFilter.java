package org.assemblerflow.qc.assembly.filter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.assemblerflow.qc.utils.Utils;

import java.util.*;

/**
 * Applies filter rules to contigs. The GC bounds {@code gc_prop >= b} and {@code gc_prop <= 1 - b} are evaluated for
 * every contig after the caller's rules, whatever the {@link FilterMode}; a contig must pass both to be kept.
 *
 * Filtering never modifies its inputs and holds no state between calls, so the same instance can re-filter the same
 * entries with a different rule set.
 */
public final class ContigFilter {

    public static final double DEFAULT_GC_BOUND = 0.05;

    private final double gcBound;
    private final Logger logger;

    public ContigFilter() {
        this(DEFAULT_GC_BOUND);
    }

    public ContigFilter(final double gcBound) {
        this(gcBound, LogManager.getLogger(ContigFilter.class));
    }

    public ContigFilter(final double gcBound, final Logger logger) {
        Utils.validateArg(gcBound >= 0 && gcBound <= 0.5, () -> "GC bound must be in [0, 0.5] but was " + gcBound);
        this.gcBound = gcBound;
        this.logger = Utils.nonNull(logger, "logger");
    }

    public double getGcBound() {
        return gcBound;
    }

    /**
     * The two mandatory GC rules.
     */
    public List<FilterRule> gcBoundRules() {
        return Arrays.asList(
                new FilterRule(ContigAttribute.GC_PROP, ComparisonOperator.GREATER_OR_EQUAL, gcBound),
                new FilterRule(ContigAttribute.GC_PROP, ComparisonOperator.LESS_OR_EQUAL, 1 - gcBound));
    }

    public ContigFilterResult filter(final List<ContigCoverageEntry> entries, final List<FilterRule> rules) {
        return filter(entries, rules, FilterMode.ALL);
    }

    public ContigFilterResult filter(final List<ContigCoverageEntry> entries, final List<FilterRule> rules, final FilterMode mode) {
        Utils.nonNull(entries, "entries");
        Utils.nonNull(rules, "rules");
        Utils.containsNoNull(rules, "rules must not contain null");
        Utils.nonNull(mode, "mode");

        final List<FilterRule> gcRules = gcBoundRules();
        final List<FilterRule> applied = new ArrayList<>(rules);
        applied.addAll(gcRules);
        logger.debug("Filtering " + entries.size() + " contigs (" + mode + ") with " + applied);

        final List<String> ids = new ArrayList<>(entries.size());
        final List<String> kept = new ArrayList<>();
        final Map<String, FilterRejection> rejections = new LinkedHashMap<>();
        long keptLength = 0;

        for (final ContigCoverageEntry entry : entries) {
            ids.add(entry.getContigId());
            FilterRejection rejection = evaluate(entry, rules, mode);
            if (rejection == null) {
                rejection = evaluate(entry, gcRules, FilterMode.ALL);
            }
            if (rejection == null) {
                kept.add(entry.getContigId());
                keptLength += entry.getLength();
            } else {
                logger.debug("Excluding " + entry.getContigId() + ": " + rejection);
                rejections.put(entry.getContigId(), rejection);
            }
        }

        logger.info(String.format("Kept %d of %d contigs (%d bp)", kept.size(), entries.size(), keptLength));
        return new ContigFilterResult(ids, kept, rejections, keptLength, applied);
    }

    /**
     * @return the rejection for {@code entry}, or null if the rules let it through
     */
    private static FilterRejection evaluate(final ContigCoverageEntry entry, final List<FilterRule> rules, final FilterMode mode) {
        if (rules.isEmpty()) {
            return null;
        }
        FilterRejection firstFailure = null;
        for (final FilterRule rule : rules) {
            if (rule.test(entry)) {
                if (mode == FilterMode.ANY) {
                    return null;
                }
            } else {
                final FilterRejection rejection = new FilterRejection(rule, rule.getAttribute().valueOf(entry));
                if (mode == FilterMode.ALL) {
                    return rejection;
                }
                if (firstFailure == null) {
                    firstFailure = rejection;
                }
            }
        }
        return firstFailure;
    }
}
