package org.assemblerflow.qc.tools;

import org.assemblerflow.qc.assembly.ContigCoverageTable;
import org.assemblerflow.qc.assembly.filter.*;
import org.assemblerflow.qc.assembly.health.AssemblyHealthClassifier;
import org.assemblerflow.qc.cmdline.SampleQCProgram;
import org.assemblerflow.qc.cmdline.StandardArgumentDefinitions;
import org.assemblerflow.qc.cmdline.programgroups.AssemblyQCProgramGroup;
import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.report.FilterReportWriter;
import org.assemblerflow.qc.report.QCStatus;
import org.assemblerflow.qc.utils.config.QCConfig;
import org.assemblerflow.qc.utils.fasta.FastaRecordParser;
import org.assemblerflow.qc.utils.fasta.FastaWriter;
import org.assemblerflow.qc.utils.fasta.SequenceRecord;
import org.assemblerflow.qc.utils.fasta.SequenceStore;
import org.assemblerflow.qc.utils.io.IOUtils;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Removes low coverage contigs from an assembly, using the alignment coverage of each contig, unless doing so
 * would shrink the assembly below the minimum fraction of the expected genome size.
 *
 * <p>The minimum coverage is either a number or {@code auto}, in which case it is the mean coverage of the assembly
 * (total coverage over total contig length) times the configured factor, raised to the configured floor. The
 * configured GC bounds are applied alongside the coverage rule, as for every contig-level filter.</p>
 *
 * <h3>Input</h3>
 * <ul>
 *     <li>An assembly in FASTA format</li>
 *     <li>A coverage table of {@code <contig> <coverage>} rows; contig names must carry a {@code length_<n>_} token,
 *     which is the length used both for the {@code auto} threshold and for the too-small check</li>
 * </ul>
 *
 * <h3>Output</h3>
 * <ul>
 *     <li>{@code <sample>_filtered.assembly.fasta}: the kept contigs, or the unchanged input when filtering would
 *     leave the assembly too small</li>
 *     <li>{@code <sample>_filtered.report.csv}: the filter outcome of every contig</li>
 *     <li>The status file: pass</li>
 * </ul>
 *
 * <h3>Example Usage</h3>
 * <pre>
 *   assembly-qc ProcessAssemblyMapping \
 *     -S sampleA \
 *     -I sampleA.assembly.fasta \
 *     --coverage-table sampleA.coverage.tsv \
 *     --min-coverage auto \
 *     -G 2.1
 * </pre>
 */
@DocumentedFeature
@CommandLineProgramProperties(
        summary = "Filters assembly contigs by their alignment coverage, keeping the original assembly when the " +
                "filtered one would be smaller than expected.",
        oneLineSummary = "Filter an assembly by contig alignment coverage",
        programGroup = AssemblyQCProgramGroup.class
)
public final class ProcessAssemblyMapping extends SampleQCProgram {

    public static final String ASSEMBLY_SUFFIX = "_filtered.assembly.fasta";
    public static final String REPORT_SUFFIX = "_filtered.report.csv";

    public static final String COVERAGE_TABLE_LONG_NAME = "coverage-table";

    @Argument(fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "Assembly FASTA file")
    public File assemblyFile;

    @Argument(fullName = COVERAGE_TABLE_LONG_NAME, doc = "Per-contig coverage table")
    public File coverageTable;

    @Argument(fullName = StandardArgumentDefinitions.MIN_COVERAGE_LONG_NAME,
            doc = "Minimum contig coverage: a number, or auto to derive it from the assembly's mean coverage", optional = true)
    public String minCoverage = MinimumCoverage.AUTO_KEYWORD;

    @Argument(fullName = StandardArgumentDefinitions.GENOME_SIZE_LONG_NAME,
            shortName = StandardArgumentDefinitions.GENOME_SIZE_SHORT_NAME,
            doc = "Expected genome size in megabases", minValue = 0.0)
    public Double genomeSizeMb;

    private MinimumCoverage minimumCoverage;

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>();
        if (genomeSizeMb <= 0) {
            errors.add("--" + StandardArgumentDefinitions.GENOME_SIZE_LONG_NAME + " must be positive");
        }
        try {
            minimumCoverage = MinimumCoverage.parse(minCoverage);
        } catch (final UserException.BadInput e) {
            errors.add(e.getMessage());
        }
        return errors.isEmpty() ? null : errors.toArray(new String[0]);
    }

    @Override
    protected QCStatus runSampleQC() {
        final QCConfig config = getQCConfig();
        final SequenceStore records = FastaRecordParser.parse(assemblyFile.toPath());
        final ContigCoverageTable coverage = ContigCoverageTable.parse(coverageTable.toPath());
        logger.info(String.format("Parsed %d contigs from %s and coverage of %d contigs from %s",
                records.size(), assemblyFile, coverage.size(), coverageTable));

        final double threshold = minimumCoverage.resolve(coverage.getTotalCoverage(), coverage.getTotalLength(),
                config.coverage_auto_factor(), config.coverage_auto_floor());
        logger.info(String.format("Minimum contig coverage (%s): %s", minimumCoverage, threshold));

        final List<ContigCoverageEntry> entries = new ArrayList<>(records.size());
        for (final SequenceRecord record : records) {
            entries.add(ContigCoverageEntry.fromCoverage(record, coverage.getCoverage(record.getId())));
        }

        final ContigFilter filter = new ContigFilter(config.filter_gc_bound(), logger);
        final ContigFilterResult result = filter.filter(entries, Collections.singletonList(
                new FilterRule(ContigAttribute.COVERAGE, ComparisonOperator.GREATER_OR_EQUAL, threshold)));
        FilterReportWriter.writeReport(getSampleOutputPath(REPORT_SUFFIX), result);

        final AssemblyHealthClassifier classifier = new AssemblyHealthClassifier(
                config.health_min_length_fraction(), config.health_max_length_fraction(), logger);
        final Path output = getSampleOutputPath(ASSEMBLY_SUFFIX);
        final long keptLength = keptLength(coverage, result.getKeptIds());
        if (classifier.isTooSmall(keptLength, genomeSizeMb)) {
            logger.warn(String.format("Filtering would leave %d bp, below %.0f%% of the expected genome size. Keeping the unfiltered assembly",
                    keptLength, config.health_min_length_fraction() * 100));
            IOUtils.copyFile(assemblyFile.toPath(), output);
        } else {
            FastaWriter.write(output, records.subset(result.getKeptIds()));
        }
        return QCStatus.PASS;
    }

    /**
     * Length of the kept contigs as declared by their {@code length_<n>_} header tokens, the same source the
     * {@code auto} threshold is derived from.
     */
    static long keptLength(final ContigCoverageTable coverage, final List<String> keptIds) {
        long total = 0;
        for (final String id : keptIds) {
            total += coverage.getLength(id);
        }
        return total;
    }
}
