package org.enigma.tools.mixture;

import org.enigma.testutils.BaseTest;
import org.enigma.utils.MathUtils;
import org.testng.Assert;
import org.testng.annotations.Test;

public final class MixturePriorCollectionUnitTest extends BaseTest {
    private static final LocusLayout LAYOUT = new LocusLayout(2, 3);

    @Test
    public void testMixingProportionPseudoCounts() {
        final MixturePriorCollection priors = new MixturePriorCollection(new int[3][5], LAYOUT, MixtureTestUtils.panelWithHatchery());
        //groupA holds wildA and the hatchery, groupB holds wildB; each group carries half of the prior weight
        final double[] pseudoCounts = priors.mixingProportionPseudoCounts();
        assertEqualsDoubleArray(pseudoCounts, new double[] {0.25, 0.5, 0.25}, 1e-12);
        Assert.assertEquals(MathUtils.sum(pseudoCounts), 1., 1e-12);
    }

    @Test
    public void testAlleleFrequencyPseudoCounts() {
        final MixturePriorCollection priors = new MixturePriorCollection(new int[3][5], LAYOUT, MixtureTestUtils.panelWithHatchery());
        for (int population = 0; population < 2; population++) {
            Assert.assertEquals(priors.alleleFrequencyPseudoCount(population, 0), 0.5, 1e-12);
            Assert.assertEquals(priors.alleleFrequencyPseudoCount(population, 1), 0.5, 1e-12);
            for (int column = 2; column < 5; column++) {
                Assert.assertEquals(priors.alleleFrequencyPseudoCount(population, column), 1. / 3, 1e-12);
            }
        }
        for (int column = 0; column < 5; column++) {
            Assert.assertEquals(priors.alleleFrequencyPseudoCount(2, column), 0., 0.);
        }
    }

    @Test
    public void testInitialAlleleFrequencies() {
        final int[][] baseline = {
                {3, 1, 0, 0, 0},
                {0, 0, 0, 6, 0},
                {0, 0, 2, 0, 0}};
        final AlleleFrequencies frequencies =
                new MixturePriorCollection(baseline, LAYOUT, MixtureTestUtils.panelWithHatchery()).initialAlleleFrequencies();
        assertEqualsDoubleArray(frequencies.getPopulation(0), new double[] {0.7, 0.3, 1. / 3, 1. / 3, 1. / 3}, 1e-12);
        assertEqualsDoubleArray(frequencies.getPopulation(1), new double[] {0.5, 0.5, 1. / 21, 19. / 21, 1. / 21}, 1e-12);
        //the hatchery has no pseudo-counts: an unobserved locus falls back to uniform frequencies
        assertEqualsDoubleArray(frequencies.getPopulation(2), new double[] {0.5, 0.5, 1., 0., 0.}, 1e-12);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testBaselineShape() {
        new MixturePriorCollection(new int[3][4], LAYOUT, MixtureTestUtils.panelWithHatchery());
    }
}
