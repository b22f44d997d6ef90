package org.enigma.tools.mixture;

import org.enigma.exceptions.EnigmaException;
import org.enigma.testutils.BaseTest;
import org.enigma.tools.mixture.family.IsotopeGaussianFamily;
import org.enigma.tools.mixture.family.MultinomialFamily;
import org.testng.Assert;
import org.testng.annotations.Test;

public final class MixtureLikelihoodsUnitTest extends BaseTest {
    private static final int[][] MIXTURE = {{2, 1}, {0, 3}};

    private static MixtureState state(final double[][] frequencies, final double[] proportions) {
        return new MixtureState(new AlleleFrequencies(frequencies), InfectionProbabilities.empty(),
                new MixingProportions(proportions), new Assignments(new int[MIXTURE.length]), InfectionStatus.empty());
    }

    @Test
    public void testGeneticLogLikelihoods() {
        final MixtureData data = MixtureTestUtils.mixture(MIXTURE, MixtureTestUtils.baselineWithHatchery(),
                MixtureTestUtils.panelWithHatchery(), new MultinomialFamily());
        final AlleleFrequencies frequencies = new AlleleFrequencies(new double[][] {{0.8, 0.2}, {0.5, 0.5}, {0.1, 0.9}});
        Assert.assertEquals(MixtureLikelihoods.geneticLogLikelihood(data, frequencies, 0, 0),
                2 * Math.log(0.8) + Math.log(0.2), 1e-12);
        Assert.assertEquals(MixtureLikelihoods.geneticLogLikelihood(data, frequencies, 1, 2), 3 * Math.log(0.9), 1e-12);
        //hatcheries are not candidate origins
        Assert.assertEquals(MixtureLikelihoods.geneticLogLikelihoods(data, frequencies, 0).length, 2);
    }

    @Test
    public void testAssignmentWeightsAreLikelihoodRatios() {
        final MixtureData data = MixtureTestUtils.mixture(MIXTURE, MixtureTestUtils.baselineWithHatchery(),
                MixtureTestUtils.panelWithHatchery(), new MultinomialFamily());
        final MixtureState state = state(new double[][] {{0.8, 0.2}, {0.5, 0.5}, {0.1, 0.9}}, new double[] {0.5, 0.25, 0.25});
        final double[] weights = MixtureLikelihoods.assignmentWeights(data, state, 0, state.mixingProportions().toArray());
        Assert.assertEquals(weights.length, 2);
        final double expectedRatio = (0.5 * 0.8 * 0.8 * 0.2) / (0.25 * 0.5 * 0.5 * 0.5);
        Assert.assertEquals(weights[0] / weights[1], expectedRatio, 1e-9);
    }

    @Test
    public void testAssignmentWeightsSurviveUnderflow() {
        final int[][] mixture = {{2000, 1000}};
        final MixtureData data = MixtureTestUtils.mixture(mixture, MixtureTestUtils.baselineWithHatchery(),
                MixtureTestUtils.panelWithHatchery(), new MultinomialFamily());
        final MixtureState state = new MixtureState(new AlleleFrequencies(new double[][] {{0.8, 0.2}, {0.5, 0.5}, {0.1, 0.9}}),
                InfectionProbabilities.empty(), new MixingProportions(new double[] {0.5, 0.5, 0.}),
                new Assignments(new int[1]), InfectionStatus.empty());
        final double[] weights = MixtureLikelihoods.assignmentWeights(data, state, 0, state.mixingProportions().toArray());
        Assert.assertTrue(weights[0] > 0 && Double.isFinite(weights[0]));
        Assert.assertTrue(weights[0] > weights[1]);
    }

    @Test
    public void testAuxiliaryLikelihoodMultipliesWeights() {
        final IsotopeGaussianFamily family = new IsotopeGaussianFamily(new double[] {0., 0.}, new double[] {0., 3.}, new double[] {1., 1.});
        final MixtureData data = MixtureTestUtils.mixture(MIXTURE, MixtureTestUtils.baselineWithHatchery(),
                MixtureTestUtils.panelWithHatchery(), family);
        final MixtureState state = state(new double[][] {{0.5, 0.5}, {0.5, 0.5}, {0.5, 0.5}}, new double[] {0.4, 0.4, 0.2});
        final double[] weights = MixtureLikelihoods.assignmentWeights(data, state, 1, state.mixingProportions().toArray());
        Assert.assertEquals(weights[0] / weights[1], Math.exp(4.5), 1e-6);
    }

    @Test(expectedExceptions = EnigmaException.DegenerateSamplingDistribution.class)
    public void testImpossibleGenotype() {
        final MixtureData data = MixtureTestUtils.mixture(MIXTURE, MixtureTestUtils.baselineWithHatchery(),
                MixtureTestUtils.panelWithHatchery(), new MultinomialFamily());
        //no wild population carries the second allele
        final MixtureState state = state(new double[][] {{1., 0.}, {1., 0.}, {0.5, 0.5}}, new double[] {0.5, 0.5, 0.});
        MixtureLikelihoods.assignmentWeights(data, state, 1, state.mixingProportions().toArray());
    }

    @Test(expectedExceptions = EnigmaException.DegenerateSamplingDistribution.class)
    public void testZeroPopulationWeights() {
        final MixtureData data = MixtureTestUtils.mixture(MIXTURE, MixtureTestUtils.baselineWithHatchery(),
                MixtureTestUtils.panelWithHatchery(), new MultinomialFamily());
        final MixtureState state = state(new double[][] {{0.5, 0.5}, {0.5, 0.5}, {0.5, 0.5}}, new double[] {0., 0., 1.});
        MixtureLikelihoods.assignmentWeights(data, state, 0, state.mixingProportions().toArray());
    }
}
