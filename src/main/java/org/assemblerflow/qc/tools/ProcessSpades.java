package org.assemblerflow.qc.tools;

import org.assemblerflow.qc.assembly.filter.*;
import org.assemblerflow.qc.assembly.health.AssemblyHealthClassifier;
import org.assemblerflow.qc.assembly.health.HealthVerdict;
import org.assemblerflow.qc.cmdline.SampleQCProgram;
import org.assemblerflow.qc.cmdline.StandardArgumentDefinitions;
import org.assemblerflow.qc.cmdline.programgroups.AssemblyQCProgramGroup;
import org.assemblerflow.qc.report.FilterReportWriter;
import org.assemblerflow.qc.report.JsonReportWriter;
import org.assemblerflow.qc.report.QCStatus;
import org.assemblerflow.qc.report.SpadesReportJson;
import org.assemblerflow.qc.utils.config.QCConfig;
import org.assemblerflow.qc.utils.fasta.FastaRecordParser;
import org.assemblerflow.qc.utils.fasta.SequenceStore;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Filters the contigs of a SPAdes assembly by length, k-mer coverage and GC content, then classifies the filtered
 * assembly against the expected genome size.
 *
 * <p>The k-mer coverage of each contig is read from the end of its header
 * ({@code NODE_3_length_5321_cov_24.65}). When the filtered assembly is smaller than the minimum fraction of the
 * genome size, the contigs are filtered again by length only before the assembly is classified.</p>
 *
 * <h3>Output</h3>
 * <ul>
 *     <li>{@code <sample>.assembly.fasta}: the kept contigs, with {@code <sample>_} prepended to each header</li>
 *     <li>{@code <sample>.report.csv}: {@code <contig>, pass} or {@code <contig>, <key>/<value>/<threshold>} per contig</li>
 *     <li>{@code <sample>.report.json}: health warnings and the failure reason, if any</li>
 *     <li>The status file: fail when the assembly is too small, pass otherwise</li>
 * </ul>
 *
 * <h3>Example Usage</h3>
 * <pre>
 *   assembly-qc ProcessSpades \
 *     -S sampleA \
 *     -I contigs.fasta \
 *     -G 2.1 \
 *     --min-contig-length 200 \
 *     --min-kmer-coverage 2
 * </pre>
 */
@DocumentedFeature
@CommandLineProgramProperties(
        summary = "Filters SPAdes contigs by length, k-mer coverage and GC content and checks the filtered assembly " +
                "size and contig count against the expected genome size.",
        oneLineSummary = "Filter and classify a SPAdes assembly",
        programGroup = AssemblyQCProgramGroup.class
)
public final class ProcessSpades extends SampleQCProgram {

    public static final String ASSEMBLY_SUFFIX = ".assembly.fasta";
    public static final String REPORT_SUFFIX = ".report.csv";
    public static final String JSON_SUFFIX = ".report.json";

    public static final String MIN_CONTIG_LENGTH_LONG_NAME = "min-contig-length";
    public static final String MIN_KMER_COVERAGE_LONG_NAME = "min-kmer-coverage";
    public static final String MAX_CONTIGS_LONG_NAME = "max-contigs";

    @Argument(fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "SPAdes contigs FASTA file")
    public File assemblyFile;

    @Argument(fullName = StandardArgumentDefinitions.GENOME_SIZE_LONG_NAME,
            shortName = StandardArgumentDefinitions.GENOME_SIZE_SHORT_NAME,
            doc = "Expected genome size in megabases", minValue = 0.0)
    public Double genomeSizeMb;

    @Argument(fullName = MIN_CONTIG_LENGTH_LONG_NAME, doc = "Minimum contig length", optional = true, minValue = 0)
    public int minContigLength = 200;

    @Argument(fullName = MIN_KMER_COVERAGE_LONG_NAME, doc = "Minimum contig k-mer coverage", optional = true, minValue = 0.0)
    public double minKmerCoverage = 2;

    @Argument(fullName = MAX_CONTIGS_LONG_NAME,
            doc = "Number of contigs per 1.5 Mb of expected genome above which a warning is raised. " +
                    "Defaults to the configured health.max_contigs_per_1_5mb", optional = true, minValue = 0)
    public Integer maxContigs = null;

    @Override
    protected String[] customCommandLineValidation() {
        if (genomeSizeMb <= 0) {
            return new String[]{"--" + StandardArgumentDefinitions.GENOME_SIZE_LONG_NAME + " must be positive"};
        }
        return null;
    }

    @Override
    protected QCStatus runSampleQC() {
        final QCConfig config = getQCConfig();
        final SequenceStore records = FastaRecordParser.parse(assemblyFile.toPath());
        logger.info(String.format("Parsed %d contigs (%d bp) from %s", records.size(), records.getTotalLength(), assemblyFile));

        final List<ContigCoverageEntry> entries = records.getRecords().stream()
                .map(ContigCoverageEntry::fromSpadesRecord)
                .collect(Collectors.toList());

        final FilterRule lengthRule = new FilterRule(ContigAttribute.LENGTH, ComparisonOperator.GREATER_OR_EQUAL, minContigLength);
        final FilterRule kmerRule = new FilterRule(ContigAttribute.KMER_COV, ComparisonOperator.GREATER_OR_EQUAL, minKmerCoverage);

        final ContigFilter filter = new ContigFilter(config.filter_gc_bound(), logger);
        final AssemblyHealthClassifier classifier = new AssemblyHealthClassifier(
                config.health_min_length_fraction(), config.health_max_length_fraction(), logger);

        ContigFilterResult result = filter.filter(entries, Arrays.asList(lengthRule, kmerRule));
        if (classifier.isTooSmall(result.getKeptLength(), genomeSizeMb)) {
            logger.warn(String.format("Filtered assembly length (%d) is below %.0f%% of the expected genome size. " +
                    "Filtering again without the k-mer coverage rule", result.getKeptLength(), config.health_min_length_fraction() * 100));
            result = filter.filter(entries, Collections.singletonList(lengthRule));
        }

        final int maxContigsPer1_5Mb = maxContigs != null ? maxContigs : config.health_max_contigs_per_1_5mb();
        final HealthVerdict verdict = classifier.classify(result.getKeptLength(), result.getKeptCount(), genomeSizeMb, maxContigsPer1_5Mb);

        FilterReportWriter.writeFilteredAssembly(getSampleOutputPath(ASSEMBLY_SUFFIX), records, result, sampleId);
        FilterReportWriter.writeReport(getSampleOutputPath(REPORT_SUFFIX), result);
        JsonReportWriter.write(getSampleOutputPath(JSON_SUFFIX), SpadesReportJson.fromVerdict(verdict));

        return verdict.isPassed() ? QCStatus.PASS : QCStatus.FAIL;
    }
}
