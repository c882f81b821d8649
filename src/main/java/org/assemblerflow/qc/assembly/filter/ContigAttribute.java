package org.assemblerflow.qc.assembly.filter;

import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.Utils;

/**
 * Contig attributes a {@link FilterRule} can test. The key is the name used in rule strings and rejection reasons.
 *
 * {@link #KMER_COV} and {@link #COVERAGE} both read {@link ContigCoverageEntry#getCoverage()}; they differ only in
 * the name reported, matching the source of the coverage value (assembler k-mer coverage or alignment depth).
 */
public enum ContigAttribute {
    LENGTH("length"),
    KMER_COV("kmer_cov"),
    COVERAGE("cov"),
    GC_PROP("gc_prop"),
    AT_PROP("at_prop"),
    N_PROP("n_prop");

    private final String key;

    ContigAttribute(final String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public double valueOf(final ContigCoverageEntry entry) {
        Utils.nonNull(entry);
        switch (this) {
            case LENGTH:
                return entry.getLength();
            case KMER_COV:
            case COVERAGE:
                return entry.getCoverage();
            case GC_PROP:
                return entry.getGcProportion();
            case AT_PROP:
                return entry.getAtProportion();
            case N_PROP:
                return entry.getNProportion();
            default:
                throw new IllegalStateException("unhandled attribute " + this);
        }
    }

    /**
     * Renders an observed value the way it appears in rejection reasons: lengths as integers, everything else as a double.
     */
    public String format(final double value) {
        return this == LENGTH ? Long.toString((long) value) : Double.toString(value);
    }

    public static ContigAttribute fromKey(final String key) {
        Utils.nonNull(key);
        for (final ContigAttribute attribute : values()) {
            if (attribute.key.equals(key)) {
                return attribute;
            }
        }
        throw new UserException.BadInput("unknown contig attribute '" + key + "'");
    }
}
