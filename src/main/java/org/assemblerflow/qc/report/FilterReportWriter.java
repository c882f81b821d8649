package org.assemblerflow.qc.report;

import org.assemblerflow.qc.assembly.filter.ContigFilterResult;
import org.assemblerflow.qc.utils.Utils;
import org.assemblerflow.qc.utils.fasta.FastaWriter;
import org.assemblerflow.qc.utils.fasta.SequenceStore;
import org.assemblerflow.qc.utils.io.IOUtils;

import java.nio.file.Path;

/**
 * Writes the outputs of a contig filter: the per-contig pass/rejection report and the kept contigs as FASTA.
 */
public final class FilterReportWriter {

    private FilterReportWriter(){}

    public static void writeReport(final Path output, final ContigFilterResult result) {
        Utils.nonNull(result);
        IOUtils.writeLines(output, result.getReportLines());
    }

    /**
     * Writes the kept contigs of {@code records}, in their original order, with {@code <sample>_} prepended to each header.
     */
    public static void writeFilteredAssembly(final Path output, final SequenceStore records, final ContigFilterResult result,
                                             final String sampleId) {
        Utils.nonNull(records);
        Utils.nonNull(result);
        Utils.nonNull(sampleId);
        FastaWriter.write(output, records.subset(result.getKeptIds()), sampleId + "_");
    }
}
