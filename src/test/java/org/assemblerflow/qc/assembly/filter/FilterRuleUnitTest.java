package org.assemblerflow.qc.assembly.filter;

import org.assemblerflow.qc.QCBaseTest;
import org.assemblerflow.qc.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class FilterRuleUnitTest extends QCBaseTest {

    private static final ContigCoverageEntry ENTRY = new ContigCoverageEntry("NODE_1_length_300_cov_5.5", 5.5, 300, 0.4, 0.5, 0.1);

    @DataProvider(name = "rules")
    public Object[][] rules() {
        return new Object[][]{
                {"length>=200", ContigAttribute.LENGTH, ComparisonOperator.GREATER_OR_EQUAL, 200.0, true},
                {"length > 300", ContigAttribute.LENGTH, ComparisonOperator.GREATER_THAN, 300.0, false},
                {"kmer_cov<6", ContigAttribute.KMER_COV, ComparisonOperator.LESS_THAN, 6.0, true},
                {"cov>=5.5", ContigAttribute.COVERAGE, ComparisonOperator.GREATER_OR_EQUAL, 5.5, true},
                {"gc_prop<=0.4", ContigAttribute.GC_PROP, ComparisonOperator.LESS_OR_EQUAL, 0.4, true},
                {"at_prop==0.5", ContigAttribute.AT_PROP, ComparisonOperator.EQUAL, 0.5, true},
                {"n_prop!=0.1", ContigAttribute.N_PROP, ComparisonOperator.NOT_EQUAL, 0.1, false},
                {"  length>=1e2 ", ContigAttribute.LENGTH, ComparisonOperator.GREATER_OR_EQUAL, 100.0, true},
        };
    }

    @Test(dataProvider = "rules")
    public void testParseAndTest(final String text, final ContigAttribute attribute, final ComparisonOperator operator,
                                 final double threshold, final boolean passes) {
        final FilterRule rule = FilterRule.parse(text);
        Assert.assertEquals(rule, new FilterRule(attribute, operator, threshold));
        Assert.assertEquals(rule.test(ENTRY), passes);
    }

    @DataProvider(name = "badRules")
    public Object[][] badRules() {
        return new Object[][]{{"length"}, {"length=>200"}, {"depth>=3"}, {"length>=lots"}, {">=3"}, {"length >= 2 3"}};
    }

    @Test(dataProvider = "badRules", expectedExceptions = UserException.BadInput.class)
    public void testParseBadRule(final String text) {
        FilterRule.parse(text);
    }

    @Test
    public void testToString() {
        Assert.assertEquals(FilterRule.parse("length>=200").toString(), "length>=200");
        Assert.assertEquals(FilterRule.parse("gc_prop <= 0.95").toString(), "gc_prop<=0.95");
    }

    @Test
    public void testRejectionText() {
        Assert.assertEquals(new FilterRejection(FilterRule.parse("length>=200"), 150).toString(), "length/150/200");
        Assert.assertEquals(new FilterRejection(FilterRule.parse("kmer_cov>=2"), 1.5).toString(), "kmer_cov/1.5/2");
        Assert.assertEquals(new FilterRejection(FilterRule.parse("gc_prop>=0.05"), 0.0).toString(), "gc_prop/0.0/0.05");
    }

    @Test
    public void testComparisonOperatorSymbols() {
        for (final ComparisonOperator operator : ComparisonOperator.values()) {
            Assert.assertEquals(ComparisonOperator.fromSymbol(operator.getSymbol()), operator);
        }
        Assert.assertThrows(UserException.BadInput.class, () -> ComparisonOperator.fromSymbol("=>"));
    }

    @Test
    public void testAttributeKeys() {
        for (final ContigAttribute attribute : ContigAttribute.values()) {
            Assert.assertEquals(ContigAttribute.fromKey(attribute.getKey()), attribute);
        }
        Assert.assertEquals(ContigAttribute.KMER_COV.valueOf(ENTRY), ContigAttribute.COVERAGE.valueOf(ENTRY));
        Assert.assertEquals(ContigAttribute.LENGTH.valueOf(ENTRY), 300.0);
    }
}
