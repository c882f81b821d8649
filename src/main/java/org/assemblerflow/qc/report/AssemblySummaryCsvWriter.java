package org.assemblerflow.qc.report;

import org.assemblerflow.qc.assembly.AssemblySummary;
import org.assemblerflow.qc.utils.MathUtils;
import org.assemblerflow.qc.utils.Utils;
import org.assemblerflow.qc.utils.io.IOUtils;

import java.nio.file.Path;
import java.util.Collections;

/**
 * Writes the one-row assembly summary CSV:
 * {@code <sample>, <ncontigs>,<avg_contig_size>,<n50>,<total_len>,<avg_gc>,<missing_data>}.
 */
public final class AssemblySummaryCsvWriter {

    private AssemblySummaryCsvWriter(){}

    public static String formatRow(final String sampleId, final AssemblySummary summary) {
        Utils.nonNull(sampleId);
        Utils.nonNull(summary);
        return sampleId + ", " + String.join(",",
                String.valueOf(summary.NCONTIGS),
                MathUtils.formatDecimal(summary.AVG_CONTIG_SIZE),
                String.valueOf(summary.N50),
                String.valueOf(summary.TOTAL_LEN),
                MathUtils.formatDecimal(summary.AVG_GC),
                String.valueOf(summary.MISSING_DATA));
    }

    public static void write(final Path output, final String sampleId, final AssemblySummary summary) {
        IOUtils.writeLines(output, Collections.singletonList(formatRow(sampleId, summary)));
    }
}
