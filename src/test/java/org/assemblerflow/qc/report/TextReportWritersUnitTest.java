package org.assemblerflow.qc.report;

import org.assemblerflow.qc.QCBaseTest;
import org.assemblerflow.qc.assembly.AssemblySummary;
import org.assemblerflow.qc.assembly.filter.ContigCoverageEntry;
import org.assemblerflow.qc.assembly.filter.ContigFilter;
import org.assemblerflow.qc.assembly.filter.ContigFilterResult;
import org.assemblerflow.qc.assembly.filter.FilterRule;
import org.assemblerflow.qc.utils.fasta.FastaRecordParser;
import org.assemblerflow.qc.utils.fasta.SequenceRecord;
import org.assemblerflow.qc.utils.fasta.SequenceStore;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Collectors;

public final class TextReportWritersUnitTest extends QCBaseTest {

    private static String read(final Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    @Test
    public void testAssemblySummaryRow() throws IOException {
        final AssemblySummary summary = new AssemblySummary(3, 2.5, 4, 10, 0.25, 1);
        Assert.assertEquals(AssemblySummaryCsvWriter.formatRow("sampleA", summary), "sampleA, 3,2.5,4,10,0.25,1");

        final Path output = createTempFile("summary", ".csv").toPath();
        AssemblySummaryCsvWriter.write(output, "sampleA", summary);
        Assert.assertEquals(read(output), "sampleA, 3,2.5,4,10,0.25,1\n");
    }

    @Test
    public void testAssemblySummaryRowKeepsPositionalNotation() {
        final AssemblySummary summary = new AssemblySummary(2, 12345678.5, 20000000, 24691357, 0.0001, 0);
        Assert.assertEquals(AssemblySummaryCsvWriter.formatRow("big", summary), "big, 2,12345678.5,20000000,24691357,0.0001,0");
    }

    @Test
    public void testFilterReports() throws IOException {
        final SequenceStore records = new SequenceStore(Arrays.asList(
                new SequenceRecord("NODE_1_length_4_cov_5.0", "ACGT"),
                new SequenceRecord("NODE_2_length_2_cov_1.0", "GC"),
                new SequenceRecord("NODE_3_length_4_cov_9.0", "GATC")));
        final ContigFilterResult result = new ContigFilter().filter(
                records.getRecords().stream().map(ContigCoverageEntry::fromSpadesRecord).collect(Collectors.toList()),
                Collections.singletonList(FilterRule.parse("kmer_cov>=2")));

        final Path report = createTempFile("filter", ".csv").toPath();
        FilterReportWriter.writeReport(report, result);
        Assert.assertEquals(read(report), "NODE_1_length_4_cov_5.0, pass\nNODE_2_length_2_cov_1.0, kmer_cov/1.0/2\nNODE_3_length_4_cov_9.0, pass\n");

        final Path fasta = createTempFile("filtered", ".fasta").toPath();
        FilterReportWriter.writeFilteredAssembly(fasta, records, result, "sampleA");
        Assert.assertEquals(FastaRecordParser.parse(fasta).getIds(),
                Arrays.asList("sampleA_NODE_1_length_4_cov_5.0", "sampleA_NODE_3_length_4_cov_9.0"));
    }

    @Test
    public void testStatusTokens() throws IOException {
        final Path status = createTempFile("status", "").toPath();
        for (final QCStatus s : QCStatus.values()) {
            s.write(status);
            Assert.assertEquals(read(status), s.getToken());
        }
        Assert.assertEquals(QCStatus.CORRUPT.toString(), "corrupt");
    }
}
