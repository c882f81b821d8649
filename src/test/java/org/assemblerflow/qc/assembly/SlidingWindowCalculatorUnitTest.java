package org.assemblerflow.qc.assembly;

import org.assemblerflow.qc.QCBaseTest;
import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.fasta.SequenceRecord;
import org.assemblerflow.qc.utils.fasta.SequenceStore;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;

public final class SlidingWindowCalculatorUnitTest extends QCBaseTest {

    private static final String CONTIG_1 = "NODE_1_length_6_cov_1.0";
    private static final String CONTIG_2 = "NODE_2_length_4_cov_2.0";

    private static SequenceStore records() {
        return new SequenceStore(Arrays.asList(
                new SequenceRecord(CONTIG_1, "GGGGAA"),
                new SequenceRecord(CONTIG_2, "ccAT")));
    }

    private static PerBaseDepthTable depths() throws IOException {
        final StringBuilder rows = new StringBuilder();
        final int[] first = {10, 10, 10, 10, 20, 20};
        for (int i = 0; i < first.length; i++) {
            rows.append(CONTIG_1).append('\t').append(i + 1).append('\t').append(first[i]).append('\n');
        }
        final int[] second = {30, 30, 30, 31};
        for (int i = 0; i < second.length; i++) {
            rows.append(CONTIG_2).append('\t').append(i + 1).append('\t').append(second[i]).append('\n');
        }
        return PerBaseDepthTable.parse(new BufferedReader(new StringReader(rows.toString())), "depths");
    }

    @Test
    public void testGcTrack() {
        final WindowTrack track = new SlidingWindowCalculator(4).gcTrack(records());
        Assert.assertEquals(track.getWindowSize(), 4);
        Assert.assertEquals(track.getValues(), Arrays.asList(1.0, 0.5, 0.0));
        Assert.assertEquals(track.getLabels(), Arrays.asList("1", "1", "2"));
        Assert.assertEquals(track.getPositions(), Arrays.asList(0L, 4L, 8L));
        Assert.assertEquals(track.getBoundaries().getTotalLength(), 10L);
    }

    @Test
    public void testGcTrackWindowLargerThanAssembly() {
        final WindowTrack track = new SlidingWindowCalculator(1000).gcTrack(records());
        Assert.assertEquals(track.size(), 1);
        Assert.assertEquals(track.getValues(), Collections.singletonList(0.6));
        Assert.assertEquals(track.getLabels(), Collections.singletonList("1"));
    }

    @Test
    public void testGcTrackRoundsToTwoDecimals() {
        final SequenceStore records = new SequenceStore(Collections.singletonList(new SequenceRecord(CONTIG_1, "GAA")));
        Assert.assertEquals(new SlidingWindowCalculator(3).gcTrack(records).getValues(), Collections.singletonList(0.33));
    }

    @Test
    public void testWindowCountCoversAssembly() {
        for (int windowSize = 1; windowSize <= 11; windowSize++) {
            final WindowTrack track = new SlidingWindowCalculator(windowSize).gcTrack(records());
            Assert.assertEquals(track.size(), (10 + windowSize - 1) / windowSize, "window size " + windowSize);
        }
    }

    @Test
    public void testCoverageTrack() throws IOException {
        final WindowTrack track = new SlidingWindowCalculator(4).coverageTrack(records(), depths());
        Assert.assertEquals(track.getValues(), Arrays.asList(10.0, 25.0, 30.5));
        Assert.assertEquals(track.getLabels(), Arrays.asList("1", "1", "2"));
    }

    @Test(expectedExceptions = UserException.MissingContigCoverage.class)
    public void testCoverageTrackMissingContig() throws IOException {
        final SequenceStore records = new SequenceStore(Arrays.asList(
                new SequenceRecord(CONTIG_1, "GGGGAA"),
                new SequenceRecord("NODE_3_length_2_cov_1.0", "AA")));
        new SlidingWindowCalculator(4).coverageTrack(records, depths());
    }

    @Test(expectedExceptions = UserException.MalformedContigHeader.class)
    public void testHeadersNeedNodeIds() {
        final SequenceStore records = new SequenceStore(Collections.singletonList(new SequenceRecord("contig1", "ACGT")));
        new SlidingWindowCalculator(2).gcTrack(records);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testZeroWindowSize() {
        new SlidingWindowCalculator(0);
    }
}
