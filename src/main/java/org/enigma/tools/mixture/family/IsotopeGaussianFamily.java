package org.enigma.tools.mixture.family;

import org.enigma.exceptions.UserException;
import org.enigma.tools.mixture.MixtureState;
import org.enigma.tools.mixture.PopulationPanel;
import org.enigma.utils.MathUtils;
import org.enigma.utils.Utils;

/**
 * Continuous isotope signature (e.g. a strontium ratio) with a fixed Gaussian isoscape per wild population.
 * Individuals without a measurement (NaN) contribute a factor of 1 for every population.
 */
public final class IsotopeGaussianFamily extends MixtureFamily {
    public static final String NAME = "normal";

    private final double[] values;
    private final double[] populationMeans;
    private final double[] populationStandardDeviations;
    private final double[][] densities;

    /**
     * @param values                        isotope value of each mixture individual; NaN if missing
     * @param populationMeans               isoscape mean of each wild population
     * @param populationStandardDeviations  isoscape standard deviation of each wild population
     */
    public IsotopeGaussianFamily(final double[] values,
                                 final double[] populationMeans,
                                 final double[] populationStandardDeviations) {
        Utils.nonNull(values);
        Utils.nonNull(populationMeans);
        Utils.nonNull(populationStandardDeviations);
        if (populationMeans.length != populationStandardDeviations.length) {
            throw new UserException.BadInput(String.format("The isoscape has %d means but %d standard deviations.",
                    populationMeans.length, populationStandardDeviations.length));
        }
        if (!MathUtils.allMatch(populationMeans, Double::isFinite)
                || !MathUtils.allMatch(populationStandardDeviations, sd -> sd > 0 && Double.isFinite(sd))) {
            throw new UserException.BadInput("Isoscape means must be finite and standard deviations finite and positive.");
        }
        if (!MathUtils.allMatch(values, v -> Double.isNaN(v) || Double.isFinite(v))) {
            throw new UserException.BadInput("Isotope values must be finite or NaN (missing).");
        }
        this.values = values.clone();
        this.populationMeans = populationMeans.clone();
        this.populationStandardDeviations = populationStandardDeviations.clone();
        densities = new double[values.length][populationMeans.length];
        for (int individual = 0; individual < values.length; individual++) {
            for (int population = 0; population < populationMeans.length; population++) {
                densities[individual][population] = Double.isNaN(values[individual])
                        ? 1.
                        : MathUtils.normalDistribution(populationMeans[population], populationStandardDeviations[population], values[individual]);
            }
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void validate(final int numIndividuals, final PopulationPanel panel) {
        if (values.length != numIndividuals) {
            throw new UserException.BadInput(String.format("There are %d isotope values for %d mixture individuals.",
                    values.length, numIndividuals));
        }
        if (populationMeans.length != panel.numWildPopulations()) {
            throw new UserException.BadInput(String.format("The isoscape covers %d populations but there are %d wild populations.",
                    populationMeans.length, panel.numWildPopulations()));
        }
    }

    /**
     * Gaussian density of the individual's value under the population's isoscape.  Hatcheries carry no isoscape
     * and contribute a factor of 1.
     */
    @Override
    public double auxiliaryLikelihood(final int individual, final int population, final MixtureState state) {
        return population < populationMeans.length ? densities[individual][population] : 1.;
    }
}
