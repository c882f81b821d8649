package org.assemblerflow.qc.tools;

import htsjdk.samtools.metrics.MetricsFile;
import org.assemblerflow.qc.assembly.*;
import org.assemblerflow.qc.cmdline.SampleQCProgram;
import org.assemblerflow.qc.cmdline.StandardArgumentDefinitions;
import org.assemblerflow.qc.cmdline.programgroups.AssemblyQCProgramGroup;
import org.assemblerflow.qc.metrics.MetricsUtils;
import org.assemblerflow.qc.report.AssemblyReportJson;
import org.assemblerflow.qc.report.AssemblySummaryCsvWriter;
import org.assemblerflow.qc.report.JsonReportWriter;
import org.assemblerflow.qc.report.QCStatus;
import org.assemblerflow.qc.utils.fasta.FastaRecordParser;
import org.assemblerflow.qc.utils.fasta.SequenceStore;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;

import java.io.File;

/**
 * Summarizes an assembly: contig count, average contig size, N50, total length, average GC and missing data, plus
 * the contig size distribution and GC (and optionally coverage) sliding window tracks for plotting.
 *
 * <h3>Input</h3>
 * <ul>
 *     <li>An assembly in FASTA format whose headers carry a {@code NODE_<n>_} token</li>
 *     <li>Optionally, a per-base depth table ({@code contig position depth}, e.g. from samtools depth)</li>
 * </ul>
 *
 * <h3>Output</h3>
 * <ul>
 *     <li>{@code <sample>_assembly_report.csv}: the one-row summary</li>
 *     <li>{@code <sample>_assembly_report.json}: headline counts and plot data</li>
 *     <li>Optionally, the summary as a metrics file</li>
 * </ul>
 *
 * <h3>Example Usage</h3>
 * <pre>
 *   assembly-qc AssemblyReport \
 *     -S sampleA \
 *     -I sampleA.assembly.fasta \
 *     --depth-table sampleA.depth.txt
 * </pre>
 */
@DocumentedFeature
@CommandLineProgramProperties(
        summary = "Computes summary statistics and sliding window GC/coverage tracks of an assembly.",
        oneLineSummary = "Summarize an assembly",
        programGroup = AssemblyQCProgramGroup.class
)
public final class AssemblyReport extends SampleQCProgram {

    public static final String CSV_SUFFIX = "_assembly_report.csv";
    public static final String JSON_SUFFIX = "_assembly_report.json";

    public static final String DEPTH_TABLE_LONG_NAME = "depth-table";
    public static final String WINDOW_SIZE_LONG_NAME = "window-size";

    @Argument(fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "Assembly FASTA file")
    public File assemblyFile;

    @Argument(fullName = DEPTH_TABLE_LONG_NAME,
            doc = "Per-base depth table of the reads aligned back to the assembly", optional = true)
    public File depthTable = null;

    @Argument(fullName = WINDOW_SIZE_LONG_NAME,
            doc = "Sliding window size in bases. Defaults to the configured sliding_window.size", optional = true, minValue = 1)
    public Integer windowSize = null;

    @Argument(fullName = StandardArgumentDefinitions.METRICS_FILE_LONG_NAME,
            doc = "Also write the summary as a metrics file", optional = true)
    public File metricsFile = null;

    @Override
    protected QCStatus runSampleQC() {
        final SequenceStore records = FastaRecordParser.parse(assemblyFile.toPath());
        logger.info(String.format("Parsed %d contigs (%d bp) from %s", records.size(), records.getTotalLength(), assemblyFile));

        final AssemblySummary summary = AssemblyStatisticsCalculator.summarize(records);
        AssemblySummaryCsvWriter.write(getSampleOutputPath(CSV_SUFFIX), sampleId, summary);

        if (metricsFile != null) {
            final MetricsFile<AssemblySummary, Integer> metrics = getMetricsFile();
            metrics.addMetric(summary);
            MetricsUtils.saveMetrics(metrics, metricsFile.toPath());
        }

        final SlidingWindowCalculator windows = new SlidingWindowCalculator(getWindowSize());
        final WindowTrack gcTrack = windows.gcTrack(records);
        WindowTrack coverageTrack = null;
        if (depthTable != null) {
            coverageTrack = windows.coverageTrack(records, PerBaseDepthTable.parse(depthTable.toPath()));
        }

        final AssemblyReportJson report = AssemblyReportJson.build(sampleId, summary,
                AssemblyStatisticsCalculator.contigLengths(records), gcTrack, coverageTrack, assemblyFile.getName());
        JsonReportWriter.write(getSampleOutputPath(JSON_SUFFIX), report);

        return QCStatus.PASS;
    }

    private int getWindowSize() {
        return windowSize != null ? windowSize : getQCConfig().sliding_window_size();
    }
}
