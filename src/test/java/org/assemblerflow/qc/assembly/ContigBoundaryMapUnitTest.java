package org.assemblerflow.qc.assembly;

import org.assemblerflow.qc.QCBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.LinkedHashMap;
import java.util.Optional;

public final class ContigBoundaryMapUnitTest extends QCBaseTest {

    private static ContigBoundaryMap map() {
        final LinkedHashMap<String, Integer> lengths = new LinkedHashMap<>();
        lengths.put("NODE_1_length_5_cov_2", 5);
        lengths.put("NODE_2_length_0_cov_2", 0);
        lengths.put("NODE_3_length_3_cov_2", 3);
        lengths.put("NODE_4_length_1_cov_2", 1);
        lengths.put("NODE_5_length_0_cov_2", 0);
        return ContigBoundaryMap.fromLengths(lengths);
    }

    @Test
    public void testBoundariesAreContiguous() {
        final ContigBoundaryMap boundaries = map();
        Assert.assertEquals(boundaries.getTotalLength(), 9L);
        Assert.assertEquals(boundaries.getBoundaries().get(1).getStart(), 5L);
        Assert.assertEquals(boundaries.getBoundaries().get(1).getEnd(), 5L);
        Assert.assertEquals(boundaries.getBoundaries().get(2).toString(), "3:[5,8)");
        Assert.assertEquals(boundaries.getBoundaries().get(4).getStart(), 9L);
    }

    @DataProvider(name = "positions")
    public Object[][] positions() {
        return new Object[][]{
                {0L, "1"},
                {4L, "1"},
                {5L, "3"},
                {7L, "3"},
                {8L, "4"},
                {9L, null},
                {100L, null},
                {-1L, null},
        };
    }

    @Test(dataProvider = "positions")
    public void testFindContaining(final long position, final String expectedId) {
        final Optional<ContigBoundaryMap.Boundary> found = map().findContaining(position);
        if (expectedId == null) {
            Assert.assertFalse(found.isPresent(), "position " + position);
        } else {
            Assert.assertEquals(found.get().getContigId(), expectedId);
        }
    }

    @Test
    public void testFindContainingAgreesWithContains() {
        final ContigBoundaryMap boundaries = map();
        for (long position = -2; position < 12; position++) {
            ContigBoundaryMap.Boundary expected = null;
            for (final ContigBoundaryMap.Boundary boundary : boundaries.getBoundaries()) {
                if (boundary.contains(position)) {
                    expected = boundary;
                    break;
                }
            }
            Assert.assertEquals(boundaries.findContaining(position).orElse(null), expected, "position " + position);
        }
    }

    @Test
    public void testEmptyMap() {
        final ContigBoundaryMap boundaries = ContigBoundaryMap.fromLengths(new LinkedHashMap<>());
        Assert.assertEquals(boundaries.getTotalLength(), 0L);
        Assert.assertFalse(boundaries.findContaining(0).isPresent());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeLength() {
        final LinkedHashMap<String, Integer> lengths = new LinkedHashMap<>();
        lengths.put("NODE_1_length_5_cov_2", -1);
        ContigBoundaryMap.fromLengths(lengths);
    }
}
