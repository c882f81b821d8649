package org.assemblerflow.qc.reads;

import org.assemblerflow.qc.QCBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class EncodingObservationUnitTest extends QCBaseTest {

    @DataProvider(name = "qualityRanges")
    public Object[][] qualityRanges() {
        return new Object[][]{
                // '!' = 33, 'J' = 74
                {"!J", Arrays.asList(QualityEncoding.SANGER, QualityEncoding.ILLUMINA_1_8), "Sanger,Illumina-1.8", "33"},
                // '@' = 64, 'h' = 104
                {"@h", Arrays.asList(QualityEncoding.SOLEXA, QualityEncoding.ILLUMINA_1_3), "Solexa,Illumina-1.3", "64"},
                // 'B' = 66, 'i' = 105
                {"Bi", Collections.singletonList(QualityEncoding.ILLUMINA_1_5), "Illumina-1.5", "64"},
                // ';' = 59, 'F' = 70
                {";F", Arrays.asList(QualityEncoding.SANGER, QualityEncoding.ILLUMINA_1_8, QualityEncoding.SOLEXA), "Sanger,Illumina-1.8,Solexa", "33,64"},
                // '!' = 33, 'h' = 104
                {"!h", Collections.emptyList(), EncodingCall.UNKNOWN_TEXT, EncodingCall.UNKNOWN_TEXT},
        };
    }

    @Test(dataProvider = "qualityRanges")
    public void testCall(final String qualities, final List<QualityEncoding> expected, final String encodingText, final String phredText) {
        final EncodingObservation observation = new EncodingObservation();
        observation.observe(qualities);
        final EncodingCall call = observation.call();
        Assert.assertEquals(call.getCandidates(), expected);
        Assert.assertEquals(call.getEncodingText(), encodingText);
        Assert.assertEquals(call.getPhredText(), phredText);
        Assert.assertEquals(call.isUnknown(), expected.isEmpty());
        Assert.assertEquals(call.isAmbiguous(), expected.size() > 1);
    }

    @Test
    public void testNoObservations() {
        final EncodingObservation observation = new EncodingObservation();
        observation.observe("");
        Assert.assertFalse(observation.hasObservations());
        Assert.assertEquals(observation.call(), EncodingCall.UNKNOWN);
        Assert.assertEquals(observation.call().getEncodingText(), "None");
        Assert.assertThrows(IllegalStateException.class, observation::getMin);
    }

    @Test
    public void testBoundsOnlyWiden() {
        final EncodingObservation observation = new EncodingObservation();
        observation.observe("II");
        Assert.assertEquals(observation.getMin(), 'I');
        Assert.assertEquals(observation.getMax(), 'I');
        final int candidatesBefore = observation.call().getCandidates().size();

        observation.observe("5");
        observation.observe("F");
        Assert.assertEquals(observation.getMin(), '5');
        Assert.assertEquals(observation.getMax(), 'I');
        Assert.assertTrue(observation.call().getCandidates().size() <= candidatesBefore);
    }

    @Test
    public void testEncodingRanges() {
        Assert.assertTrue(QualityEncoding.SANGER.covers(33, 74));
        Assert.assertFalse(QualityEncoding.SANGER.covers(33, 75));
        Assert.assertTrue(QualityEncoding.SOLEXA.covers(59, 104));
        Assert.assertFalse(QualityEncoding.ILLUMINA_1_5.covers(65, 105));
        Assert.assertEquals(QualityEncoding.ILLUMINA_1_3.getPhredOffset(), 64);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvertedRange() {
        QualityEncoding.SANGER.covers(50, 40);
    }
}
