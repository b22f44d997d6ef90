package org.enigma.tools.mixture;

import org.enigma.utils.Utils;
import org.enigma.utils.mcmc.Parameter;
import org.enigma.utils.mcmc.ParameterizedState;

import java.util.Arrays;

/**
 * Values of all {@link MixtureParameter}s at one iteration of a chain.  Every value is immutable, so a state can be
 * shared freely once it has been recorded.
 */
public final class MixtureState extends ParameterizedState<MixtureParameter> {
    public MixtureState(final AlleleFrequencies alleleFrequencies,
                        final InfectionProbabilities infectionProbabilities,
                        final MixingProportions mixingProportions,
                        final Assignments assignments,
                        final InfectionStatus infectionStatus) {
        super(Arrays.<Parameter<MixtureParameter, ?>>asList(
                new Parameter<>(MixtureParameter.ALLELE_FREQUENCIES, alleleFrequencies),
                new Parameter<>(MixtureParameter.INFECTION_PROBABILITIES, infectionProbabilities),
                new Parameter<>(MixtureParameter.MIXING_PROPORTIONS, mixingProportions),
                new Parameter<>(MixtureParameter.ASSIGNMENTS, assignments),
                new Parameter<>(MixtureParameter.INFECTION_STATUS, infectionStatus)));
        Utils.validateArg(alleleFrequencies.numPopulations() == mixingProportions.numPopulations(),
                "Allele frequencies and mixing proportions must cover the same populations.");
    }

    private MixtureState(final MixtureState state) {
        super(state);
    }

    public AlleleFrequencies alleleFrequencies() {
        return get(MixtureParameter.ALLELE_FREQUENCIES, AlleleFrequencies.class);
    }

    public InfectionProbabilities infectionProbabilities() {
        return get(MixtureParameter.INFECTION_PROBABILITIES, InfectionProbabilities.class);
    }

    public MixingProportions mixingProportions() {
        return get(MixtureParameter.MIXING_PROPORTIONS, MixingProportions.class);
    }

    public Assignments assignments() {
        return get(MixtureParameter.ASSIGNMENTS, Assignments.class);
    }

    public InfectionStatus infectionStatus() {
        return get(MixtureParameter.INFECTION_STATUS, InfectionStatus.class);
    }

    @Override
    public MixtureState copy() {
        return new MixtureState(this);
    }
}
