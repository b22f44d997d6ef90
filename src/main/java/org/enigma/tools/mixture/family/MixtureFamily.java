package org.enigma.tools.mixture.family;

import org.apache.commons.math3.random.RandomGenerator;
import org.enigma.tools.mixture.InfectionProbabilities;
import org.enigma.tools.mixture.InfectionStatus;
import org.enigma.tools.mixture.MixtureState;
import org.enigma.tools.mixture.PopulationPanel;

/**
 * Auxiliary covariate model that multiplies the genetic likelihood of each candidate population of origin.
 *
 * <p>A family may carry nuisance parameters (infection probabilities and imputed infection statuses); the default
 * implementations of the nuisance hooks leave them empty and unchanged.</p>
 */
public abstract class MixtureFamily {

    /**
     * Name of the family as used on the command line and in output.
     */
    public abstract String getName();

    /**
     * Checks the covariate tables against the mixture.
     * @throws org.enigma.exceptions.UserException.BadInput if they are inconsistent
     */
    public abstract void validate(final int numIndividuals, final PopulationPanel panel);

    /**
     * Likelihood of the covariate of {@code individual} given that it originates from {@code population}, up to a
     * factor that does not depend on the population.
     */
    public abstract double auxiliaryLikelihood(final int individual, final int population, final MixtureState state);

    public InfectionProbabilities initialInfectionProbabilities(final RandomGenerator rng) {
        return InfectionProbabilities.empty();
    }

    /**
     * Infection statuses before any imputation; missing statuses hold an arbitrary placeholder.
     */
    public InfectionStatus initialInfectionStatus() {
        return InfectionStatus.empty();
    }

    /**
     * Draws the infection probabilities conditional on the current assignments and statuses.
     */
    public InfectionProbabilities sampleInfectionProbabilities(final RandomGenerator rng, final MixtureState state) {
        return state.infectionProbabilities();
    }

    /**
     * Imputes the missing infection statuses conditional on the current assignments and infection probabilities.
     */
    public InfectionStatus sampleInfectionStatus(final RandomGenerator rng, final MixtureState state) {
        return state.infectionStatus();
    }

    /**
     * Number of strata over which infection probabilities are estimated; 0 if the family has none.
     */
    public int numStrata() {
        return 0;
    }

    @Override
    public String toString() {
        return getName();
    }
}
