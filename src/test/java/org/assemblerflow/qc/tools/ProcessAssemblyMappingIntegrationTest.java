package org.assemblerflow.qc.tools;

import org.assemblerflow.qc.CommandLineProgramTest;
import org.assemblerflow.qc.cmdline.StandardArgumentDefinitions;
import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.report.QCStatus;
import org.assemblerflow.qc.testutils.ArgumentsBuilder;
import org.assemblerflow.qc.utils.fasta.FastaRecordParser;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

public final class ProcessAssemblyMappingIntegrationTest extends CommandLineProgramTest {

    private static String read(final File directory, final String name) throws IOException {
        return new String(Files.readAllBytes(new File(directory, name).toPath()), StandardCharsets.UTF_8);
    }

    private ArgumentsBuilder baseArgs(final File output, final double genomeSizeMb, final String coverageTable) {
        return new ArgumentsBuilder()
                .addSampleId("sampleA")
                .addInput(getTestFile("assembly.fasta"))
                .add(ProcessAssemblyMapping.COVERAGE_TABLE_LONG_NAME, getTestFile(coverageTable))
                .addGenomeSize(genomeSizeMb)
                .addOutputDirectory(output);
    }

    @Test
    public void testAutoCoverageFilter() throws IOException {
        final File output = createTempDir("process_mapping");
        Assert.assertEquals(runCommandLine(baseArgs(output, 0.001, "coverage.tsv")), QCStatus.PASS);

        Assert.assertEquals(read(output, ".status"), "pass");
        // the mean coverage is far below the floor, so auto resolves to 10
        Assert.assertEquals(read(output, "sampleA" + ProcessAssemblyMapping.REPORT_SUFFIX),
                "sampleA_NODE_1_length_600_cov_20.5, pass\n" +
                "sampleA_NODE_2_length_400_cov_10.0, pass\n" +
                "sampleA_NODE_4_length_300_cov_1.2, cov/5.0/10\n");
        Assert.assertEquals(FastaRecordParser.parse(new File(output, "sampleA" + ProcessAssemblyMapping.ASSEMBLY_SUFFIX).toPath()).getIds(),
                Arrays.asList("sampleA_NODE_1_length_600_cov_20.5", "sampleA_NODE_2_length_400_cov_10.0"));
    }

    @Test
    public void testFixedCoverageKeepsEverything() throws IOException {
        final File output = createTempDir("process_mapping");
        final ArgumentsBuilder args = baseArgs(output, 0.001, "coverage.tsv")
                .add(StandardArgumentDefinitions.MIN_COVERAGE_LONG_NAME, "4");
        Assert.assertEquals(runCommandLine(args), QCStatus.PASS);
        Assert.assertEquals(FastaRecordParser.parse(new File(output, "sampleA" + ProcessAssemblyMapping.ASSEMBLY_SUFFIX).toPath()).size(), 3);
    }

    @Test
    public void testTooSmallResultKeepsOriginalAssembly() throws IOException {
        final File output = createTempDir("process_mapping");
        Assert.assertEquals(runCommandLine(baseArgs(output, 0.002, "coverage.tsv")), QCStatus.PASS);

        Assert.assertEquals(read(output, ".status"), "pass");
        Assert.assertEquals(Files.readAllBytes(new File(output, "sampleA" + ProcessAssemblyMapping.ASSEMBLY_SUFFIX).toPath()),
                Files.readAllBytes(getTestFile("assembly.fasta").toPath()));
        Assert.assertTrue(read(output, "sampleA" + ProcessAssemblyMapping.REPORT_SUFFIX).contains("cov/5.0/10"));
    }

    @Test
    public void testKeptLengthComesFromHeaderLengths() throws IOException {
        // 60 bp sequences under headers declaring 600, 400 and 300 bp
        final File output = createTempDir("process_mapping");
        final ArgumentsBuilder args = new ArgumentsBuilder()
                .addSampleId("sampleA")
                .addInput(getTestFile("assembly_short_sequences.fasta"))
                .add(ProcessAssemblyMapping.COVERAGE_TABLE_LONG_NAME, getTestFile("coverage.tsv"))
                .addGenomeSize(0.001)
                .addOutputDirectory(output);
        Assert.assertEquals(runCommandLine(args), QCStatus.PASS);
        Assert.assertEquals(FastaRecordParser.parse(new File(output, "sampleA" + ProcessAssemblyMapping.ASSEMBLY_SUFFIX).toPath()).getIds(),
                Arrays.asList("sampleA_NODE_1_length_600_cov_20.5", "sampleA_NODE_2_length_400_cov_10.0"));
    }

    @Test
    public void testContigMissingFromCoverageTable() throws IOException {
        final File output = createTempDir("process_mapping");
        try {
            runCommandLine(baseArgs(output, 0.001, "coverage_missing_contig.tsv"));
            Assert.fail("expected the missing contig to be reported");
        } catch (final UserException.MissingContigCoverage e) {
            Assert.assertTrue(e.getMessage().contains("sampleA_NODE_4_length_300_cov_1.2"), e.getMessage());
            Assert.assertEquals(read(output, ".status"), "error");
        }
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testBadMinimumCoverage() {
        runCommandLine(baseArgs(createTempDir("process_mapping"), 0.001, "coverage.tsv")
                .add(StandardArgumentDefinitions.MIN_COVERAGE_LONG_NAME, "plenty"));
    }
}
