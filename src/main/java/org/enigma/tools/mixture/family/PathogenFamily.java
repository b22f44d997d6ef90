package org.enigma.tools.mixture.family;

import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.enigma.exceptions.UserException;
import org.enigma.tools.mixture.Assignments;
import org.enigma.tools.mixture.InfectionProbabilities;
import org.enigma.tools.mixture.InfectionStatus;
import org.enigma.tools.mixture.MixtureState;
import org.enigma.tools.mixture.PopulationPanel;
import org.enigma.utils.MathUtils;
import org.enigma.utils.Utils;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Binary pathogen-infection status with a Beta-distributed infection probability per stratum and reporting group.
 *
 * <p>Statuses are coded 1 (infected), 0 (not infected) or {@link #MISSING}.  Missing statuses are imputed at every
 * iteration from the infection probability of the individual's stratum and current reporting group.  The imputed
 * statuses count towards the infection probabilities, but an individual whose status was missing contributes a
 * factor of 1 to the likelihood of its own origin.</p>
 */
public final class PathogenFamily extends MixtureFamily {
    private static final Logger logger = LogManager.getLogger(PathogenFamily.class);

    public static final String NAME = "ichthy";
    public static final int MISSING = -1;
    public static final double DEFAULT_PRIOR_ALPHA = 1.;
    public static final double DEFAULT_PRIOR_BETA = 1.;

    private final PopulationPanel panel;
    private final int[] observedStatuses;
    private final boolean[] isMissing;
    private final int[] missingIndividuals;
    private final int[] strata;
    private final int numStrata;
    private final double[][] priorAlpha;
    private final double[][] priorBeta;

    /**
     * Uses a Beta(1, 1) prior for every stratum and reporting group.
     * @param panel     baseline populations and reporting groups of the mixture
     * @param statuses  status of each mixture individual: 1, 0 or {@link #MISSING}
     * @param strata    1-based stratum of each mixture individual
     */
    public PathogenFamily(final PopulationPanel panel, final int[] statuses, final int[] strata) {
        this(panel, statuses, strata,
                constantMatrix(maxStratum(strata), panel.numGroups(), DEFAULT_PRIOR_ALPHA),
                constantMatrix(maxStratum(strata), panel.numGroups(), DEFAULT_PRIOR_BETA));
    }

    /**
     * @param panel         baseline populations and reporting groups of the mixture
     * @param statuses      status of each mixture individual: 1, 0 or {@link #MISSING}
     * @param strata        1-based stratum of each mixture individual
     * @param priorAlpha    Beta prior alpha (pseudo-count of infected) for each stratum and reporting group
     * @param priorBeta     Beta prior beta (pseudo-count of not infected) for each stratum and reporting group
     */
    public PathogenFamily(final PopulationPanel panel,
                          final int[] statuses,
                          final int[] strata,
                          final double[][] priorAlpha,
                          final double[][] priorBeta) {
        this.panel = Utils.nonNull(panel);
        Utils.nonNull(statuses);
        Utils.nonNull(strata);
        Utils.nonNull(priorAlpha);
        Utils.nonNull(priorBeta);
        if (statuses.length != strata.length) {
            throw new UserException.BadInput(String.format("There are %d infection statuses but %d strata.", statuses.length, strata.length));
        }
        if (!MathUtils.allMatch(statuses, s -> s == 0 || s == 1 || s == MISSING)) {
            throw new UserException.BadInput("Infection statuses must be 1, 0 or " + MISSING + " (missing).");
        }
        if (!MathUtils.allMatch(strata, s -> s >= 1)) {
            throw new UserException.BadInput("Strata must be 1-based.");
        }
        numStrata = maxStratum(strata);
        validatePrior(priorAlpha, "alpha");
        validatePrior(priorBeta, "beta");

        isMissing = new boolean[statuses.length];
        observedStatuses = new int[statuses.length];
        for (int individual = 0; individual < statuses.length; individual++) {
            isMissing[individual] = statuses[individual] == MISSING;
            observedStatuses[individual] = isMissing[individual] ? 0 : statuses[individual];
        }
        missingIndividuals = IntStream.range(0, statuses.length).filter(i -> isMissing[i]).toArray();
        this.strata = Arrays.stream(strata).map(s -> s - 1).toArray();
        this.priorAlpha = Arrays.stream(priorAlpha).map(double[]::clone).toArray(double[][]::new);
        this.priorBeta = Arrays.stream(priorBeta).map(double[]::clone).toArray(double[][]::new);
        logger.debug(String.format("%d of %d infection statuses are missing.", missingIndividuals.length, statuses.length));
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int numStrata() {
        return numStrata;
    }

    public boolean isMissing(final int individual) {
        return isMissing[individual];
    }

    /** 0-based stratum of an individual. */
    public int stratum(final int individual) {
        return strata[individual];
    }

    @Override
    public void validate(final int numIndividuals, final PopulationPanel panel) {
        if (observedStatuses.length != numIndividuals) {
            throw new UserException.BadInput(String.format("There are %d infection statuses for %d mixture individuals.",
                    observedStatuses.length, numIndividuals));
        }
        if (panel.numGroups() != this.panel.numGroups() || panel.numPopulations() != this.panel.numPopulations()
                || !IntStream.range(0, panel.numPopulations()).allMatch(p -> panel.groupIndex(p) == this.panel.groupIndex(p))) {
            throw new UserException.BadInput("The pathogen covariate was built for a panel with different reporting groups.");
        }
    }

    /**
     * theta^s (1 - theta)^(1 - s), where theta is the infection probability of the individual's stratum and of the
     * population's reporting group; 1 if the status was missing.
     */
    @Override
    public double auxiliaryLikelihood(final int individual, final int population, final MixtureState state) {
        if (isMissing[individual]) {
            return 1.;
        }
        final double theta = state.infectionProbabilities().get(strata[individual], panel.groupIndex(population));
        return observedStatuses[individual] == 1 ? theta : 1 - theta;
    }

    /**
     * Draws every infection probability from its prior.
     */
    @Override
    public InfectionProbabilities initialInfectionProbabilities(final RandomGenerator rng) {
        final double[][] theta = new double[numStrata][panel.numGroups()];
        for (int stratum = 0; stratum < numStrata; stratum++) {
            for (int group = 0; group < panel.numGroups(); group++) {
                theta[stratum][group] = new BetaDistribution(rng, priorAlpha[stratum][group], priorBeta[stratum][group]).sample();
            }
        }
        return new InfectionProbabilities(theta);
    }

    @Override
    public InfectionStatus initialInfectionStatus() {
        return new InfectionStatus(observedStatuses);
    }

    /**
     * Cross-tabulates current statuses by stratum and current reporting group and draws
     * theta ~ Beta(alpha + infected, beta + not infected).
     */
    @Override
    public InfectionProbabilities sampleInfectionProbabilities(final RandomGenerator rng, final MixtureState state) {
        final Assignments assignments = state.assignments();
        final InfectionStatus statuses = state.infectionStatus();
        final int[][] infected = new int[numStrata][panel.numGroups()];
        final int[][] notInfected = new int[numStrata][panel.numGroups()];
        for (int individual = 0; individual < strata.length; individual++) {
            final int group = panel.groupIndex(assignments.get(individual));
            if (statuses.get(individual) == 1) {
                infected[strata[individual]][group]++;
            } else {
                notInfected[strata[individual]][group]++;
            }
        }
        final double[][] theta = new double[numStrata][panel.numGroups()];
        for (int stratum = 0; stratum < numStrata; stratum++) {
            for (int group = 0; group < panel.numGroups(); group++) {
                theta[stratum][group] = new BetaDistribution(rng,
                        priorAlpha[stratum][group] + infected[stratum][group],
                        priorBeta[stratum][group] + notInfected[stratum][group]).sample();
            }
        }
        return new InfectionProbabilities(theta);
    }

    /**
     * Imputes each missing status as Bernoulli(theta) with theta the infection probability of the individual's
     * stratum and newly assigned reporting group.
     */
    @Override
    public InfectionStatus sampleInfectionStatus(final RandomGenerator rng, final MixtureState state) {
        if (missingIndividuals.length == 0) {
            return state.infectionStatus();
        }
        final Assignments assignments = state.assignments();
        final InfectionProbabilities theta = state.infectionProbabilities();
        final int[] statuses = observedStatuses.clone();
        for (final int individual : missingIndividuals) {
            final double p = theta.get(strata[individual], panel.groupIndex(assignments.get(individual)));
            statuses[individual] = rng.nextDouble() < p ? 1 : 0;
        }
        return new InfectionStatus(statuses);
    }

    private void validatePrior(final double[][] prior, final String name) {
        if (prior.length != numStrata || !Arrays.stream(prior).allMatch(row -> row != null && row.length == panel.numGroups())) {
            throw new UserException.BadInput(String.format("The Beta prior %s must have one row per stratum (%d) and one column per reporting group (%d).",
                    name, numStrata, panel.numGroups()));
        }
        if (!Arrays.stream(prior).allMatch(row -> MathUtils.allMatch(row, a -> a > 0 && Double.isFinite(a)))) {
            throw new UserException.BadInput(String.format("The Beta prior %s must be finite and positive.", name));
        }
    }

    private static int maxStratum(final int[] strata) {
        Utils.nonNull(strata);
        if (strata.length == 0) {
            throw new UserException.BadInput("There must be a stratum for every mixture individual.");
        }
        return MathUtils.arrayMax(strata);
    }

    private static double[][] constantMatrix(final int numRows, final int numColumns, final double value) {
        final double[][] matrix = new double[Math.max(numRows, 0)][numColumns];
        for (final double[] row : matrix) {
            Arrays.fill(row, value);
        }
        return matrix;
    }
}
