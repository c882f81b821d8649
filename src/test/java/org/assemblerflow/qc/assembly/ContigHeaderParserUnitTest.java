package org.assemblerflow.qc.assembly;

import org.assemblerflow.qc.QCBaseTest;
import org.assemblerflow.qc.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class ContigHeaderParserUnitTest extends QCBaseTest {

    @DataProvider(name = "nodeIds")
    public Object[][] nodeIds() {
        return new Object[][]{
                {"NODE_12_length_5321_cov_24.65", "12"},
                {"sampleA_NODE_3_length_10_cov_1.0", "3"},
                {"NODE_7_length_10_cov_1.0 extra words", "7"},
        };
    }

    @Test(dataProvider = "nodeIds")
    public void testNodeId(final String header, final String expected) {
        Assert.assertEquals(ContigHeaderParser.nodeId(header), expected);
    }

    @DataProvider(name = "headersWithoutNode")
    public Object[][] headersWithoutNode() {
        return new Object[][]{{"contig_1"}, {"XNODE_1_length_3_cov_2"}, {"NODE_x_length_3"}, {""}};
    }

    @Test(dataProvider = "headersWithoutNode", expectedExceptions = UserException.MalformedContigHeader.class)
    public void testNodeIdMissing(final String header) {
        ContigHeaderParser.nodeId(header);
    }

    @Test
    public void testLength() {
        Assert.assertEquals(ContigHeaderParser.length("NODE_12_length_5321_cov_24.65"), 5321);
        Assert.assertEquals(ContigHeaderParser.length("sample_NODE_1_length_7_cov_2"), 7);
    }

    @Test(expectedExceptions = UserException.MalformedContigHeader.class)
    public void testLengthMissing() {
        ContigHeaderParser.length("NODE_12_cov_24.65");
    }

    @Test
    public void testKmerCoverage() {
        Assert.assertEquals(ContigHeaderParser.kmerCoverage("NODE_12_length_5321_cov_24.65"), 24.65);
        Assert.assertEquals(ContigHeaderParser.kmerCoverage("NODE_1_length_5_cov_3"), 3.0);
    }

    @DataProvider(name = "badCoverage")
    public Object[][] badCoverage() {
        return new Object[][]{{"NODE_1_length_5_cov_"}, {"NODE_1_length_5_cov_high"}, {"nounderscore"}};
    }

    @Test(dataProvider = "badCoverage", expectedExceptions = UserException.MalformedContigHeader.class)
    public void testKmerCoverageMalformed(final String header) {
        ContigHeaderParser.kmerCoverage(header);
    }
}
