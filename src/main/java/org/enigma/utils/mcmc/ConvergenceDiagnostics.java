package org.enigma.utils.mcmc;

import com.google.common.primitives.Doubles;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.util.FastMath;
import org.enigma.utils.MathUtils;
import org.enigma.utils.Utils;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Multi-chain summaries and convergence diagnostics of scalar MCMC traces.
 *
 * <p>Each trace is given as one array per chain; all chains must have the same length.</p>
 *
 * <p>The potential scale reduction factor is the Gelman-Rubin point estimate with the degrees-of-freedom
 * correction of Brooks and Gelman (1998), computed on untransformed values and without discarding any samples.
 * The effective sample size is n * var / S(0) summed over chains, with the spectral density at frequency zero
 * S(0) estimated from an autoregressive model fitted by Yule-Walker with the order chosen by AIC.</p>
 */
public final class ConvergenceDiagnostics {
    private static final double LOWER_PERCENTILE = 5.;
    private static final double UPPER_PERCENTILE = 95.;

    private ConvergenceDiagnostics() {}

    /**
     * Pools the chains and summarizes them.
     */
    public static PosteriorSummary summarize(final List<double[]> chains) {
        validateChains(chains);
        final double[] pooled = Doubles.concat(chains.toArray(new double[0][]));
        final Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(pooled);
        return new PosteriorSummary(
                new Mean().evaluate(pooled),
                percentile.evaluate(50.),
                pooled.length > 1 ? new StandardDeviation().evaluate(pooled) : Double.NaN,
                percentile.evaluate(LOWER_PERCENTILE),
                percentile.evaluate(UPPER_PERCENTILE),
                potentialScaleReductionFactor(chains),
                effectiveSampleSize(chains));
    }

    /**
     * Returns the univariate potential scale reduction factor, or empty if there are fewer than two chains
     * or fewer than two samples per chain.
     */
    public static OptionalDouble potentialScaleReductionFactor(final List<double[]> chains) {
        validateChains(chains);
        final int m = chains.size();
        final int n = chains.get(0).length;
        if (m < 2 || n < 2) {
            return OptionalDouble.empty();
        }
        final Mean meanCalculator = new Mean();
        final Variance varianceCalculator = new Variance();
        final double[] chainMeans = chains.stream().mapToDouble(meanCalculator::evaluate).toArray();
        final double[] chainVariances = chains.stream().mapToDouble(varianceCalculator::evaluate).toArray();
        final double[] squaredChainMeans = MathUtils.applyToArray(chainMeans, MathUtils::square);
        final double grandMean = meanCalculator.evaluate(chainMeans);

        final double w = meanCalculator.evaluate(chainVariances);
        final double b = n * varianceCalculator.evaluate(chainMeans);
        final double varW = varianceCalculator.evaluate(chainVariances) / m;
        final double varB = 2 * b * b / (m - 1);
        final Covariance covariance = new Covariance();
        final double covWB = ((double) n / m) * (covariance.covariance(chainVariances, squaredChainMeans)
                - 2 * grandMean * covariance.covariance(chainVariances, chainMeans));

        final double chainFactor = 1 + 1. / m;
        final double pooledVariance = (n - 1) * w / n + chainFactor * b / n;
        final double varPooledVariance = (MathUtils.square(n - 1) * varW + MathUtils.square(chainFactor) * varB
                + 2 * (n - 1) * chainFactor * covWB) / MathUtils.square(n);
        //infinite degrees of freedom when the pooled variance is known exactly
        final double degreesOfFreedomAdjustment;
        if (varPooledVariance == 0) {
            degreesOfFreedomAdjustment = 1.;
        } else {
            final double degreesOfFreedom = 2 * MathUtils.square(pooledVariance) / varPooledVariance;
            degreesOfFreedomAdjustment = (degreesOfFreedom + 3) / (degreesOfFreedom + 1);
        }
        final double fixedTerm = (n - 1.) / n;
        final double randomTerm = b == 0 && w == 0 ? 0. : chainFactor * (1. / n) * (b / w);
        return OptionalDouble.of(FastMath.sqrt(degreesOfFreedomAdjustment * (fixedTerm + randomTerm)));
    }

    /**
     * Returns the multivariate potential scale reduction factor with the largest eigenvalue of W^-1 B / n
     * fixed to 1, i.e. sqrt((1 - 1/n) + (1 + 1/numVariables) / n).  This value depends only on the dimensions of
     * the traces.  Empty if there are fewer than two chains or fewer than two variables.
     * @param numVariables          number of jointly traced variables
     * @param numSamplesPerChain    number of retained samples per chain
     * @param numChains             number of chains
     */
    public static OptionalDouble multivariatePotentialScaleReductionFactor(final int numVariables,
                                                                           final int numSamplesPerChain,
                                                                           final int numChains) {
        Utils.validateArg(numVariables > 0, "Number of variables must be positive.");
        Utils.validateArg(numSamplesPerChain > 0, "Number of samples per chain must be positive.");
        Utils.validateArg(numChains > 0, "Number of chains must be positive.");
        if (numChains < 2 || numVariables < 2) {
            return OptionalDouble.empty();
        }
        final double largestEigenvalue = 1.;
        final double n = numSamplesPerChain;
        return OptionalDouble.of(FastMath.sqrt((1 - 1 / n) + (1 + 1. / numVariables) * largestEigenvalue / n));
    }

    /**
     * Returns the effective sample size summed over chains.  Constant chains contribute 0; chains with fewer
     * than two samples make the result NaN.
     */
    public static double effectiveSampleSize(final List<double[]> chains) {
        validateChains(chains);
        return chains.stream().mapToDouble(ConvergenceDiagnostics::effectiveSampleSize).sum();
    }

    /**
     * Returns the effective sample size of a single chain.
     */
    public static double effectiveSampleSize(final double[] chain) {
        Utils.nonNull(chain);
        final int n = chain.length;
        if (n < 2) {
            return Double.NaN;
        }
        final double variance = new Variance().evaluate(chain);
        if (variance == 0) {
            return 0.;
        }
        final double spectrum = spectrumAtZero(chain);
        return spectrum == 0 ? 0. : n * variance / spectrum;
    }

    /**
     * Estimates the spectral density at frequency zero from an AR(p) fit, var.pred / (1 - sum(ar))^2.
     * The order is chosen by AIC among 0..min(n - 1, floor(10 log10 n)); the Yule-Walker equations are solved
     * with the Levinson-Durbin recursion on the biased (divide-by-n) autocovariances of the demeaned chain.
     */
    static double spectrumAtZero(final double[] chain) {
        final int n = chain.length;
        final int maxOrder = Math.min(n - 1, (int) FastMath.floor(10 * FastMath.log10(n)));
        final double[] autocovariance = autocovariance(chain, maxOrder);

        //coefficients[k] holds the AR(k) coefficients phi_1..phi_k at indices 1..k
        final double[][] coefficients = new double[maxOrder + 1][maxOrder + 1];
        final double[] predictionVariance = new double[maxOrder + 1];
        predictionVariance[0] = autocovariance[0];
        for (int k = 1; k <= maxOrder; k++) {
            if (predictionVariance[k - 1] <= 0) {
                predictionVariance[k] = 0.;
                System.arraycopy(coefficients[k - 1], 0, coefficients[k], 0, k);
                continue;
            }
            double numerator = autocovariance[k];
            for (int j = 1; j < k; j++) {
                numerator -= coefficients[k - 1][j] * autocovariance[k - j];
            }
            final double partialAutocorrelation = numerator / predictionVariance[k - 1];
            coefficients[k][k] = partialAutocorrelation;
            for (int j = 1; j < k; j++) {
                coefficients[k][j] = coefficients[k - 1][j] - partialAutocorrelation * coefficients[k - 1][k - j];
            }
            predictionVariance[k] = predictionVariance[k - 1] * (1 - MathUtils.square(partialAutocorrelation));
        }

        int order = 0;
        double minAIC = Double.POSITIVE_INFINITY;
        for (int k = 0; k <= maxOrder; k++) {
            final double aic = n * FastMath.log(predictionVariance[k]) + 2 * k;
            if (aic < minAIC) {
                minAIC = aic;
                order = k;
            }
        }
        final double varPred = predictionVariance[order] * n / (n - (order + 1.));
        double coefficientSum = 0.;
        for (int j = 1; j <= order; j++) {
            coefficientSum += coefficients[order][j];
        }
        return varPred / MathUtils.square(1 - coefficientSum);
    }

    private static double[] autocovariance(final double[] chain, final int maxLag) {
        final int n = chain.length;
        final double mean = new Mean().evaluate(chain);
        final double[] result = new double[maxLag + 1];
        for (int lag = 0; lag <= maxLag; lag++) {
            double sum = 0.;
            for (int t = 0; t + lag < n; t++) {
                sum += (chain[t] - mean) * (chain[t + lag] - mean);
            }
            result[lag] = sum / n;
        }
        return result;
    }

    private static void validateChains(final List<double[]> chains) {
        Utils.nonEmpty(chains, "At least one chain is required.");
        Utils.containsNoNull(chains, "Chains cannot be null.");
        final int length = chains.get(0).length;
        Utils.validateArg(length > 0, "Chains cannot be empty.");
        Utils.validateArg(chains.stream().allMatch(c -> c.length == length), "All chains must have the same length.");
    }
}
