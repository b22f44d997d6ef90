package org.enigma.utils;

import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * The Dirichlet distribution is a distribution on multinomial distributions: if pi is a vector of positive multinomial weights
 * such that sum_i pi[i] = 1, the Dirichlet pdf is P(pi) = [prod_i Gamma(alpha[i]) / Gamma(sum_i alpha[i])] * prod_i pi[i]^(alpha[i] - 1)
 *
 * The vector alpha comprises the sufficient statistics for the Dirichlet distribution.
 *
 * Since the Dirichlet is the conjugate prior to the multinomial, if one has a Dirichlet prior with concentration alpha
 * and observes each category i n_i times (assuming categories are drawn from a multinomial distribution pi)
 * the posterior is alpha_i -> alpha_i + n_i
 *
 * Individual concentrations may be zero, in which case the corresponding category receives (almost) no weight;
 * see {@link #sample(RandomGenerator)}.
 */
public final class Dirichlet {
    final double[] alpha;

    public Dirichlet(final double... alpha) {
        Utils.nonNull(alpha);
        Utils.validateArg(alpha.length >= 1, "Dirichlet parameters must have at least one element");
        Utils.validateArg(MathUtils.allMatch(alpha, x -> x >= 0), "Dirichlet parameters may not be negative");
        Utils.validateArg(MathUtils.allMatch(alpha, Double::isFinite), "Dirichlet parameters must be finite");
        this.alpha = alpha.clone();
    }

    /**
     * Draws a random vector of weights.  Each category with positive concentration gets an independent Gamma(alpha_i, 1)
     * draw and the draws are normalized; categories that come out exactly zero are then set to {@link Double#MIN_NORMAL}
     * so that their logarithm stays finite.  If the total concentration is zero, an all-zero vector is returned.
     */
    public double[] sample(final RandomGenerator rng) {
        Utils.nonNull(rng);
        final double[] weights = new double[alpha.length];
        if (MathUtils.sum(alpha) == 0) {
            return weights;
        }
        for (int i = 0; i < alpha.length; i++) {
            weights[i] = alpha[i] > 0 ? new GammaDistribution(rng, alpha[i], 1.).sample() : 0.;
        }
        final double total = MathUtils.sum(weights);
        if (total == 0) {
            //every gamma draw underflowed; fall back to the mean
            return meanWeights();
        }
        MathUtils.applyToArrayInPlace(weights, x -> x / total);
        return MathUtils.applyToArrayInPlace(weights, x -> x == 0 ? Double.MIN_NORMAL : x);
    }

    public double[] meanWeights() {
        final double sum = MathUtils.sum(alpha);
        return MathUtils.applyToArray(alpha, x -> x / sum);
    }
}
