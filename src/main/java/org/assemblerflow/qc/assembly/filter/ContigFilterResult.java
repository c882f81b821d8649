package org.assemblerflow.qc.assembly.filter;

import org.assemblerflow.qc.utils.Utils;

import java.util.*;

/**
 * Outcome of one {@link ContigFilter#filter} call: the kept contig ids and the rejection reason of every excluded
 * contig, both in input order.
 */
public final class ContigFilterResult {

    public static final String PASS = "pass";

    private final List<String> contigIds;
    private final List<String> keptIds;
    private final Map<String, FilterRejection> rejections;
    private final long keptLength;
    private final List<FilterRule> appliedRules;

    ContigFilterResult(final List<String> contigIds, final List<String> keptIds, final Map<String, FilterRejection> rejections,
                       final long keptLength, final List<FilterRule> appliedRules) {
        this.contigIds = Collections.unmodifiableList(new ArrayList<>(contigIds));
        this.keptIds = Collections.unmodifiableList(new ArrayList<>(keptIds));
        this.rejections = Collections.unmodifiableMap(new LinkedHashMap<>(rejections));
        this.keptLength = keptLength;
        this.appliedRules = Collections.unmodifiableList(new ArrayList<>(appliedRules));
    }

    public List<String> getKeptIds() {
        return keptIds;
    }

    public Map<String, FilterRejection> getRejections() {
        return rejections;
    }

    public boolean isKept(final String contigId) {
        Utils.nonNull(contigId);
        return contigIds.contains(contigId) && !rejections.containsKey(contigId);
    }

    public Optional<FilterRejection> getRejection(final String contigId) {
        return Optional.ofNullable(rejections.get(contigId));
    }

    /**
     * Total length of the kept contigs.
     */
    public long getKeptLength() {
        return keptLength;
    }

    public int getKeptCount() {
        return keptIds.size();
    }

    /**
     * Caller rules followed by the GC bounds, in evaluation order.
     */
    public List<FilterRule> getAppliedRules() {
        return appliedRules;
    }

    /**
     * One {@code <contig>, pass} or {@code <contig>, <key>/<value>/<threshold>} line per input contig.
     */
    public List<String> getReportLines() {
        final List<String> lines = new ArrayList<>(contigIds.size());
        for (final String id : contigIds) {
            final FilterRejection rejection = rejections.get(id);
            lines.add(id + ", " + (rejection == null ? PASS : rejection.toString()));
        }
        return lines;
    }
}
