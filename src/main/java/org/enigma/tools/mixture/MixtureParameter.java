package org.enigma.tools.mixture;

import org.enigma.utils.mcmc.ParameterEnum;

/**
 * Parameters of the mixture model, in the order in which a Gibbs sweep updates them.
 */
public enum MixtureParameter implements ParameterEnum {
    ALLELE_FREQUENCIES("allele_frequencies"),
    INFECTION_PROBABILITIES("infection_probabilities"),
    MIXING_PROPORTIONS("mixing_proportions"),
    ASSIGNMENTS("assignments"),
    INFECTION_STATUS("infection_status");

    public final String name;

    MixtureParameter(final String name) {
        this.name = name;
    }
}
