package org.assemblerflow.qc.assembly.filter;

import org.assemblerflow.qc.assembly.ContigHeaderParser;
import org.assemblerflow.qc.utils.Utils;
import org.assemblerflow.qc.utils.fasta.SequenceRecord;

/**
 * The per-contig values filter rules are evaluated against. GC and AT proportions count upper case bases only; the
 * N proportion is everything that is neither, so the three sum to 1 for a non-empty sequence.
 */
public final class ContigCoverageEntry {

    private final String contigId;
    private final double coverage;
    private final int length;
    private final double gcProportion;
    private final double atProportion;
    private final double nProportion;

    public ContigCoverageEntry(final String contigId, final double coverage, final int length,
                               final double gcProportion, final double atProportion, final double nProportion) {
        this.contigId = Utils.nonNull(contigId, "contigId");
        Utils.validateArg(length >= 0, () -> "negative length for " + contigId);
        this.coverage = coverage;
        this.length = length;
        this.gcProportion = gcProportion;
        this.atProportion = atProportion;
        this.nProportion = nProportion;
    }

    /**
     * Entry for a SPAdes contig: coverage is the k-mer coverage at the end of the header, length and composition come
     * from the sequence.
     */
    public static ContigCoverageEntry fromSpadesRecord(final SequenceRecord record) {
        Utils.nonNull(record);
        return fromCoverage(record, ContigHeaderParser.kmerCoverage(record.getId()));
    }

    /**
     * Entry for a contig whose coverage was measured externally.
     */
    public static ContigCoverageEntry fromCoverage(final SequenceRecord record, final double coverage) {
        Utils.nonNull(record);
        final String sequence = record.getSequence();
        final int length = sequence.length();
        long gc = 0;
        long at = 0;
        for (int i = 0; i < length; i++) {
            switch (sequence.charAt(i)) {
                case 'G':
                case 'C':
                    gc++;
                    break;
                case 'A':
                case 'T':
                    at++;
                    break;
                default:
                    break;
            }
        }
        if (length == 0) {
            return new ContigCoverageEntry(record.getId(), coverage, 0, 0.0, 0.0, 0.0);
        }
        final long n = length - gc - at;
        return new ContigCoverageEntry(record.getId(), coverage, length,
                gc / (double) length, at / (double) length, n / (double) length);
    }

    public String getContigId() {
        return contigId;
    }

    public double getCoverage() {
        return coverage;
    }

    public int getLength() {
        return length;
    }

    public double getGcProportion() {
        return gcProportion;
    }

    public double getAtProportion() {
        return atProportion;
    }

    public double getNProportion() {
        return nProportion;
    }

    @Override
    public String toString() {
        return String.format("%s(cov=%s, length=%d, gc=%s)", contigId, coverage, length, gcProportion);
    }
}
