package org.enigma.tools.mixture;

import org.apache.commons.math3.util.FastMath;
import org.enigma.exceptions.EnigmaException;
import org.enigma.tools.mixture.family.MixtureFamily;
import org.enigma.utils.MathUtils;
import org.enigma.utils.Utils;

import java.util.Arrays;

/**
 * Population-conditional likelihoods of mixture individuals.
 *
 * <p>The genetic log-likelihood of individual m under population k is sum_c x[m, c] log q[k, c] (the multinomial
 * coefficient cancels across populations).  Origins of unknown individuals are drawn over wild populations with
 * weights aux(m, k) * w[k] * exp(loglik(m, k) - max_k loglik(m, k)), where w is either the mixing proportions or, at
 * initialization, the mixing-proportion prior.</p>
 */
public final class MixtureLikelihoods {
    private MixtureLikelihoods() {}

    public static double geneticLogLikelihood(final MixtureData data,
                                              final AlleleFrequencies alleleFrequencies,
                                              final int individual,
                                              final int population) {
        final int[] columns = data.nonzeroColumns(individual);
        final int[] counts = data.nonzeroCounts(individual);
        double logLikelihood = 0.;
        for (int i = 0; i < columns.length; i++) {
            logLikelihood += counts[i] * alleleFrequencies.getLog(population, columns[i]);
        }
        return logLikelihood;
    }

    /**
     * Genetic log-likelihoods of an individual under each wild population.
     */
    public static double[] geneticLogLikelihoods(final MixtureData data,
                                                 final AlleleFrequencies alleleFrequencies,
                                                 final int individual) {
        final int numWildPopulations = data.getPanel().numWildPopulations();
        final double[] logLikelihoods = new double[numWildPopulations];
        for (int population = 0; population < numWildPopulations; population++) {
            logLikelihoods[population] = geneticLogLikelihood(data, alleleFrequencies, individual, population);
        }
        return logLikelihoods;
    }

    /**
     * Unnormalized probabilities that an individual of unknown origin comes from each wild population.
     * @param populationWeights     one weight per population (wild and hatchery); only wild entries are used
     * @throws EnigmaException.DegenerateSamplingDistribution if a likelihood is NaN or no population has positive weight
     */
    public static double[] assignmentWeights(final MixtureData data,
                                             final MixtureState state,
                                             final int individual,
                                             final double[] populationWeights) {
        Utils.validateArg(populationWeights.length == data.getPanel().numPopulations(), "There must be one weight per population.");
        final double[] logLikelihoods = geneticLogLikelihoods(data, state.alleleFrequencies(), individual);
        if (!MathUtils.allMatch(logLikelihoods, ll -> !Double.isNaN(ll) && ll != Double.POSITIVE_INFINITY)) {
            throw new EnigmaException.DegenerateSamplingDistribution(String.format(
                    "Non-finite genetic log-likelihoods for individual %s: %s",
                    data.getIndividualNames().get(individual), Arrays.toString(logLikelihoods)));
        }
        if (MathUtils.arrayMax(logLikelihoods) == Double.NEGATIVE_INFINITY) {
            throw new EnigmaException.DegenerateSamplingDistribution(String.format(
                    "Individual %s has zero genetic likelihood under every wild population.",
                    data.getIndividualNames().get(individual)));
        }
        MathUtils.scaleLogSpaceArrayForNumericalStability(logLikelihoods);
        final MixtureFamily family = data.getFamily();
        final double[] weights = new double[logLikelihoods.length];
        for (int population = 0; population < weights.length; population++) {
            weights[population] = family.auxiliaryLikelihood(individual, population, state)
                    * populationWeights[population] * FastMath.exp(logLikelihoods[population]);
        }
        final double total = MathUtils.sum(weights);
        if (!(total > 0) || !Double.isFinite(total) || !MathUtils.allMatch(weights, w -> w >= 0)) {
            throw new EnigmaException.DegenerateSamplingDistribution(String.format(
                    "Assignment weights of individual %s are degenerate: %s",
                    data.getIndividualNames().get(individual), Arrays.toString(weights)));
        }
        return weights;
    }
}
