package org.assemblerflow.qc.assembly;

import org.assemblerflow.qc.QCBaseTest;
import org.assemblerflow.qc.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;

public final class PerBaseDepthTableUnitTest extends QCBaseTest {

    private static PerBaseDepthTable parse(final String text) throws IOException {
        return PerBaseDepthTable.parse(new BufferedReader(new StringReader(text)), "depths");
    }

    @Test
    public void testDepthsInFileOrder() throws IOException {
        final PerBaseDepthTable table = parse("c1\t1\t5\nc2\t1\t9\n\nc1\t3\t7\nc1 2 6\n");
        Assert.assertEquals(table.getDepths("c1"), Arrays.asList(5, 7, 6));
        Assert.assertEquals(table.getDepths("c2"), Arrays.asList(9));
        Assert.assertTrue(table.getContigs().containsAll(Arrays.asList("c1", "c2")));
    }

    @Test
    public void testLookupByFirstWordOfHeader() throws IOException {
        final PerBaseDepthTable table = parse("NODE_1_length_2_cov_3\t1\t4\n");
        Assert.assertTrue(table.contains("NODE_1_length_2_cov_3 description"));
        Assert.assertEquals(table.getDepths("NODE_1_length_2_cov_3 description"), Arrays.asList(4));
        Assert.assertFalse(table.contains("NODE_2_length_2_cov_3"));
    }

    @Test(expectedExceptions = UserException.MissingContigCoverage.class)
    public void testMissingContig() throws IOException {
        parse("c1\t1\t5\n").getDepths("c2");
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testTooFewFields() throws IOException {
        parse("c1\t5\n");
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testNonNumericDepth() throws IOException {
        parse("c1\t1\tdeep\n");
    }
}
