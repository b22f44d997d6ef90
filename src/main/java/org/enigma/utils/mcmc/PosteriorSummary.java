package org.enigma.utils.mcmc;

import java.util.OptionalDouble;

/**
 * Summary of the posterior of a univariate model parameter pooled over chains, with its convergence diagnostics.
 * The potential scale reduction factor is empty when it is not applicable (fewer than two chains).
 */
public final class PosteriorSummary {
    private final double mean;
    private final double median;
    private final double standardDeviation;
    private final double lower;
    private final double upper;
    private final OptionalDouble potentialScaleReductionFactor;
    private final double effectiveSampleSize;

    public PosteriorSummary(final double mean,
                            final double median,
                            final double standardDeviation,
                            final double lower,
                            final double upper,
                            final OptionalDouble potentialScaleReductionFactor,
                            final double effectiveSampleSize) {
        this.mean = mean;
        this.median = median;
        this.standardDeviation = standardDeviation;
        this.lower = lower;
        this.upper = upper;
        this.potentialScaleReductionFactor = potentialScaleReductionFactor;
        this.effectiveSampleSize = effectiveSampleSize;
    }

    public double mean() {
        return mean;
    }

    public double median() {
        return median;
    }

    public double standardDeviation() {
        return standardDeviation;
    }

    /** 5th percentile. */
    public double lower() {
        return lower;
    }

    /** 95th percentile. */
    public double upper() {
        return upper;
    }

    public OptionalDouble potentialScaleReductionFactor() {
        return potentialScaleReductionFactor;
    }

    public double effectiveSampleSize() {
        return effectiveSampleSize;
    }

    @Override
    public String toString() {
        return String.format("PosteriorSummary{mean=%s, median=%s, sd=%s, 5%%=%s, 95%%=%s, psrf=%s, ess=%s}",
                mean, median, standardDeviation, lower, upper,
                potentialScaleReductionFactor.isPresent() ? potentialScaleReductionFactor.getAsDouble() : "NA",
                effectiveSampleSize);
    }
}
