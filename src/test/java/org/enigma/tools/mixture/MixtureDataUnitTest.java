package org.enigma.tools.mixture;

import org.enigma.exceptions.UserException;
import org.enigma.testutils.BaseTest;
import org.enigma.tools.mixture.family.IsotopeGaussianFamily;
import org.enigma.tools.mixture.family.MultinomialFamily;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;

public final class MixtureDataUnitTest extends BaseTest {
    private static final int[][] MIXTURE = {{2, 0}, {1, 1}, {0, 2}, {2, 0}};

    private static MixtureData withKnownOrigins(final int... knownOrigins) {
        return new MixtureData(MixtureTestUtils.individualNames(MIXTURE.length), MIXTURE,
                MixtureTestUtils.baselineWithHatchery(), MixtureTestUtils.ONE_DIALLELIC_LOCUS,
                MixtureTestUtils.panelWithHatchery(), knownOrigins, new MultinomialFamily());
    }

    @Test
    public void testKnownOrigins() {
        final MixtureData data = withKnownOrigins(0, 3, MixtureData.UNKNOWN_ORIGIN, 1);
        Assert.assertEquals(data.numIndividuals(), 4);
        Assert.assertFalse(data.isKnownOrigin(0));
        Assert.assertTrue(data.isKnownOrigin(1));
        Assert.assertEquals(data.knownOrigin(1), 2);
        Assert.assertEquals(data.knownOrigin(3), 0);
        Assert.assertEquals(data.knownOrigin(0), -1);
        Assert.assertEquals(data.getUnknownIndividuals(), new int[] {0, 2});
    }

    @Test
    public void testCountsAreCopied() {
        final int[][] baseline = MixtureTestUtils.baselineWithHatchery();
        final MixtureData data = new MixtureData(MixtureTestUtils.individualNames(MIXTURE.length), MIXTURE, baseline,
                MixtureTestUtils.ONE_DIALLELIC_LOCUS, MixtureTestUtils.panelWithHatchery(), new MultinomialFamily());
        baseline[0][0] = 0;
        Assert.assertEquals(data.baselineCount(0, 0), 1000);
        Assert.assertEquals(data.baselineCount(2, 1), 500);
        Assert.assertEquals(data.mixtureCount(1, 1), 1);
        Assert.assertEquals(data.getUnknownIndividuals().length, MIXTURE.length);
    }

    @Test
    public void testOriginBeyondPopulations() {
        try {
            withKnownOrigins(0, 4, 0, 0);
            Assert.fail("Expected an unknown population.");
        } catch (final UserException.UnknownPopulation e) {
            Assert.assertTrue(e.getMessage().contains("fish2"));
            Assert.assertTrue(e.getMessage().contains("hatcheries"));
        }
    }

    @Test(expectedExceptions = UserException.UnknownPopulation.class)
    public void testNegativeOrigin() {
        withKnownOrigins(-1, 0, 0, 0);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testWrongNumberOfOrigins() {
        withKnownOrigins(0, 0, 0);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testWrongNumberOfBaselineRows() {
        MixtureTestUtils.mixture(MIXTURE, new int[][] {{1, 1}, {1, 1}}, MixtureTestUtils.panelWithHatchery(), new MultinomialFamily());
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testWrongNumberOfColumns() {
        MixtureTestUtils.mixture(new int[][] {{2, 0, 0}}, MixtureTestUtils.baselineWithHatchery(),
                MixtureTestUtils.panelWithHatchery(), new MultinomialFamily());
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testNegativeCounts() {
        MixtureTestUtils.mixture(new int[][] {{2, -1}}, MixtureTestUtils.baselineWithHatchery(),
                MixtureTestUtils.panelWithHatchery(), new MultinomialFamily());
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testMismatchedNames() {
        new MixtureData(Arrays.asList("fish1", "fish2"), MIXTURE, MixtureTestUtils.baselineWithHatchery(),
                MixtureTestUtils.ONE_DIALLELIC_LOCUS, MixtureTestUtils.panelWithHatchery(), new MultinomialFamily());
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testFamilyIsValidated() {
        //the isoscape must cover both wild populations
        MixtureTestUtils.mixture(MIXTURE, MixtureTestUtils.baselineWithHatchery(), MixtureTestUtils.panelWithHatchery(),
                new IsotopeGaussianFamily(new double[] {1., 2., 3., 4.}, new double[] {0.}, new double[] {1.}));
    }
}
