package org.enigma.tools.mixture.family;

import org.enigma.tools.mixture.MixtureState;
import org.enigma.tools.mixture.PopulationPanel;

/**
 * Genetic data only.
 */
public final class MultinomialFamily extends MixtureFamily {
    public static final String NAME = "multinomial";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void validate(final int numIndividuals, final PopulationPanel panel) {}

    @Override
    public double auxiliaryLikelihood(final int individual, final int population, final MixtureState state) {
        return 1.;
    }
}
