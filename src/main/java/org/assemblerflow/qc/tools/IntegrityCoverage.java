package org.assemblerflow.qc.tools;

import org.assemblerflow.qc.cmdline.SampleQCProgram;
import org.assemblerflow.qc.cmdline.StandardArgumentDefinitions;
import org.assemblerflow.qc.cmdline.programgroups.ReadQCProgramGroup;
import org.assemblerflow.qc.reads.IntegrityCoverageResult;
import org.assemblerflow.qc.reads.ReadIntegrityCoverageEstimator;
import org.assemblerflow.qc.report.QCStatus;
import org.assemblerflow.qc.utils.io.IOUtils;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Checks that the raw reads of a sample are intact, guesses their quality encoding and estimates their coverage of
 * the expected genome, all in a single pass over the (possibly compressed) FASTQ files.
 *
 * <h3>Input</h3>
 * <ul>
 *     <li>One or more FASTQ files, usually a read pair. Plain, gzip, bzip2 and zip files are detected automatically.</li>
 * </ul>
 *
 * <h3>Output</h3>
 * <ul>
 *     <li>{@code <sample>_encoding}: the candidate encodings, comma separated, or None</li>
 *     <li>{@code <sample>_phred}: the candidate phred offsets, comma separated, or None</li>
 *     <li>{@code <sample>_coverage}: the estimated coverage, or fail when below the minimum</li>
 *     <li>{@code <sample>_report}: {@code <sample>,<coverage>,PASS|FAIL}</li>
 *     <li>{@code <sample>_max_len}: the length of the longest read</li>
 *     <li>The status file: pass, fail, or corrupt when any read file is truncated (every other output then holds corrupt)</li>
 * </ul>
 *
 * <h3>Example Usage</h3>
 * <pre>
 *   assembly-qc IntegrityCoverage \
 *     -S sampleA \
 *     -I sampleA_1.fastq.gz \
 *     -I sampleA_2.fastq.gz \
 *     -G 2.1 \
 *     --min-coverage 15
 * </pre>
 */
@DocumentedFeature
@CommandLineProgramProperties(
        summary = "Checks the integrity of raw read files, guesses their quality encoding and estimates their coverage " +
                "of the expected genome size.",
        oneLineSummary = "Check raw read integrity, quality encoding and coverage",
        programGroup = ReadQCProgramGroup.class
)
public final class IntegrityCoverage extends SampleQCProgram {

    public static final String ENCODING_SUFFIX = "_encoding";
    public static final String PHRED_SUFFIX = "_phred";
    public static final String COVERAGE_SUFFIX = "_coverage";
    public static final String REPORT_SUFFIX = "_report";
    public static final String MAX_LENGTH_SUFFIX = "_max_len";

    public static final String SKIP_ENCODING_LONG_NAME = "skip-encoding";

    @Argument(fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "FASTQ file(s) of the sample", minElements = 1)
    public List<File> readFiles = new ArrayList<>();

    @Argument(fullName = StandardArgumentDefinitions.GENOME_SIZE_LONG_NAME,
            shortName = StandardArgumentDefinitions.GENOME_SIZE_SHORT_NAME,
            doc = "Expected genome size in megabases", minValue = 0.0)
    public Double genomeSizeMb;

    @Argument(fullName = StandardArgumentDefinitions.MIN_COVERAGE_LONG_NAME,
            doc = "Minimum estimated coverage for the sample to pass", minValue = 0.0, optional = true)
    public double minimumCoverage = 15;

    @Argument(fullName = SKIP_ENCODING_LONG_NAME,
            doc = "Do not inspect quality lines; the encoding and phred outputs are None", optional = true)
    public boolean skipEncoding = false;

    @Override
    protected String[] customCommandLineValidation() {
        if (genomeSizeMb <= 0) {
            return new String[]{"--" + StandardArgumentDefinitions.GENOME_SIZE_LONG_NAME + " must be positive"};
        }
        return null;
    }

    @Override
    protected QCStatus runSampleQC() {
        logger.info(String.format("Estimating integrity and coverage of %s for sample %s", readFiles, sampleId));
        final ReadIntegrityCoverageEstimator estimator = new ReadIntegrityCoverageEstimator(logger);
        final IntegrityCoverageResult result = estimator.estimate(
                readFiles.stream().map(File::toPath).collect(Collectors.toList()),
                genomeSizeMb, minimumCoverage, skipEncoding);

        writeChannels(result);

        if (result.isCorrupt()) {
            logger.warn(String.format("Reads of sample %s are corrupt: %s", sampleId, result.getCorruptionReason()));
            return QCStatus.CORRUPT;
        }
        return result.isCoveragePassed() ? QCStatus.PASS : QCStatus.FAIL;
    }

    private void writeChannels(final IntegrityCoverageResult result) {
        IOUtils.writeString(getSampleOutputPath(ENCODING_SUFFIX), result.getEncodingText());
        IOUtils.writeString(getSampleOutputPath(PHRED_SUFFIX), result.getPhredText());
        IOUtils.writeString(getSampleOutputPath(COVERAGE_SUFFIX), result.getCoverageText());
        if (result.isCorrupt()) {
            IOUtils.writeString(getSampleOutputPath(REPORT_SUFFIX), result.getReportText(sampleId));
        } else {
            IOUtils.writeLines(getSampleOutputPath(REPORT_SUFFIX), Collections.singletonList(result.getReportText(sampleId)));
        }
        IOUtils.writeString(getSampleOutputPath(MAX_LENGTH_SUFFIX), result.getMaxReadLengthText());
    }
}
