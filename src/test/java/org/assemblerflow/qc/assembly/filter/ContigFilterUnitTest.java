package org.assemblerflow.qc.assembly.filter;

import org.assemblerflow.qc.QCBaseTest;
import org.assemblerflow.qc.utils.fasta.SequenceRecord;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class ContigFilterUnitTest extends QCBaseTest {

    private static final FilterRule LENGTH_200 = FilterRule.parse("length>=200");
    private static final FilterRule KMER_COV_2 = FilterRule.parse("kmer_cov>=2");

    private static ContigCoverageEntry entry(final String id, final int length, final double coverage, final double gc) {
        return new ContigCoverageEntry(id, coverage, length, gc, 1 - gc, 0.0);
    }

    private static List<ContigCoverageEntry> entries() {
        return Arrays.asList(
                entry("long_good", 500, 10.0, 0.5),
                entry("short", 150, 10.0, 0.5),
                entry("low_cov", 800, 1.5, 0.5),
                entry("short_low_cov", 100, 1.0, 0.5),
                entry("gc_poor", 400, 10.0, 0.01),
                entry("gc_rich", 400, 10.0, 0.99));
    }

    @Test
    public void testAllMode() {
        final ContigFilterResult result = new ContigFilter().filter(entries(), Arrays.asList(LENGTH_200, KMER_COV_2));
        Assert.assertEquals(result.getKeptIds(), Collections.singletonList("long_good"));
        Assert.assertEquals(result.getKeptLength(), 500L);
        Assert.assertEquals(result.getKeptCount(), 1);
        Assert.assertEquals(result.getReportLines(), Arrays.asList(
                "long_good, pass",
                "short, length/150/200",
                "low_cov, kmer_cov/1.5/2",
                "short_low_cov, length/100/200",
                "gc_poor, gc_prop/0.01/0.05",
                "gc_rich, gc_prop/0.99/0.95"));
    }

    @Test
    public void testAnyMode() {
        final ContigFilterResult result = new ContigFilter().filter(entries(), Arrays.asList(LENGTH_200, KMER_COV_2), FilterMode.ANY);
        Assert.assertEquals(result.getKeptIds(), Arrays.asList("long_good", "short", "low_cov"));
        Assert.assertEquals(result.getKeptLength(), 1450L);
        Assert.assertEquals(result.getRejection("short_low_cov").get().toString(), "length/100/200");
        // GC bounds are mandatory whatever the mode
        Assert.assertFalse(result.isKept("gc_poor"));
        Assert.assertFalse(result.isKept("gc_rich"));
    }

    @Test
    public void testGcBoundsAlwaysApply() {
        final ContigFilterResult result = new ContigFilter().filter(entries(), Collections.emptyList());
        Assert.assertEquals(result.getKeptIds(), Arrays.asList("long_good", "short", "low_cov", "short_low_cov"));
        Assert.assertEquals(result.getAppliedRules(), new ContigFilter().gcBoundRules());
    }

    @Test
    public void testGcBoundsAreInclusive() {
        final List<ContigCoverageEntry> edges = Arrays.asList(entry("low_edge", 10, 1, 0.1), entry("high_edge", 10, 1, 0.9));
        final ContigFilterResult result = new ContigFilter(0.1).filter(edges, Collections.emptyList());
        Assert.assertEquals(result.getKeptIds(), Arrays.asList("low_edge", "high_edge"));
    }

    @Test
    public void testEmptyContigFailsGcBound() {
        final ContigCoverageEntry empty = ContigCoverageEntry.fromCoverage(new SequenceRecord("empty", ""), 100);
        final ContigFilterResult result = new ContigFilter().filter(Collections.singletonList(empty), Collections.emptyList());
        Assert.assertTrue(result.getKeptIds().isEmpty());
        Assert.assertEquals(result.getReportLines(), Collections.singletonList("empty, gc_prop/0.0/0.05"));
    }

    @Test
    public void testRefilteringLeavesInputsUntouched() {
        final List<ContigCoverageEntry> input = new ArrayList<>(entries());
        final List<ContigCoverageEntry> snapshot = new ArrayList<>(input);
        final ContigFilter filter = new ContigFilter();
        final ContigFilterResult strict = filter.filter(input, Arrays.asList(LENGTH_200, KMER_COV_2));
        final ContigFilterResult relaxed = filter.filter(input, Collections.singletonList(LENGTH_200));
        Assert.assertEquals(input, snapshot);
        Assert.assertEquals(strict.getKeptIds(), Collections.singletonList("long_good"));
        Assert.assertEquals(relaxed.getKeptIds(), Arrays.asList("long_good", "low_cov"));
    }

    @Test
    public void testKeptLengthMatchesKeptIds() {
        final List<ContigCoverageEntry> input = entries();
        final ContigFilterResult result = new ContigFilter().filter(input, Collections.singletonList(LENGTH_200), FilterMode.ANY);
        final long expected = input.stream().filter(e -> result.getKeptIds().contains(e.getContigId())).mapToLong(ContigCoverageEntry::getLength).sum();
        Assert.assertEquals(result.getKeptLength(), expected);
        Assert.assertEquals(result.getKeptCount() + result.getRejections().size(), input.size());
    }

    @Test
    public void testEntryFromSpadesRecord() {
        final ContigCoverageEntry e = ContigCoverageEntry.fromSpadesRecord(new SequenceRecord("NODE_4_length_8_cov_3.25", "GGCCAANn"));
        Assert.assertEquals(e.getContigId(), "NODE_4_length_8_cov_3.25");
        Assert.assertEquals(e.getCoverage(), 3.25);
        Assert.assertEquals(e.getLength(), 8);
        Assert.assertEquals(e.getGcProportion(), 0.5);
        Assert.assertEquals(e.getAtProportion(), 0.25);
        Assert.assertEquals(e.getNProportion(), 0.25);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testGcBoundOutOfRange() {
        new ContigFilter(0.6);
    }
}
