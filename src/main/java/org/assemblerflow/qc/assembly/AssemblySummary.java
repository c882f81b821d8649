package org.assemblerflow.qc.assembly;

import htsjdk.samtools.metrics.MetricBase;

/**
 * Aggregate statistics of one assembly. Produced by {@link AssemblyStatisticsCalculator#summarize}; a summary
 * describes exactly the record set it was computed from and is recomputed, never updated, after filtering.
 */
public final class AssemblySummary extends MetricBase {

    /** Number of contigs. */
    public long NCONTIGS;

    /** TOTAL_LEN / NCONTIGS. */
    public double AVG_CONTIG_SIZE;

    /** Length of the contig at which the cumulative length of contigs, longest first, reaches half of TOTAL_LEN. */
    public long N50;

    /** Sum of all contig lengths. */
    public long TOTAL_LEN;

    /** Mean of the per-contig GC proportions, counting only upper case G and C. */
    public double AVG_GC;

    /** Number of upper case 'N' characters over all contigs. */
    public long MISSING_DATA;

    // required by htsjdk for reading metrics files
    public AssemblySummary() { }

    public AssemblySummary(final long ncontigs, final double avgContigSize, final long n50, final long totalLen,
                           final double avgGc, final long missingData) {
        this.NCONTIGS = ncontigs;
        this.AVG_CONTIG_SIZE = avgContigSize;
        this.N50 = n50;
        this.TOTAL_LEN = totalLen;
        this.AVG_GC = avgGc;
        this.MISSING_DATA = missingData;
    }
}
