package org.enigma.tools.mixture;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.enigma.exceptions.EnigmaException;
import org.enigma.tools.mixture.family.MixtureFamily;
import org.enigma.utils.Dirichlet;
import org.enigma.utils.MathUtils;
import org.enigma.utils.Utils;
import org.enigma.utils.mcmc.GibbsSampler;
import org.enigma.utils.mcmc.ParameterSampler;
import org.enigma.utils.mcmc.ParameterizedModel;

/**
 * Runs one Markov chain of the mixture model (Pella-Masuda, with an optional auxiliary covariate) by Gibbs sampling.
 *
 * <p>A sweep updates, in order: allele frequencies (fully Bayesian mode only), infection probabilities, mixing
 * proportions, origins of the individuals of unknown origin, and missing infection statuses.  In fully Bayesian
 * mode the chain first runs {@code --num-adaptation} sweeps with allele frequencies held fixed and records none of
 * them.  Of the following {@code --num-iterations} sweeps, those past the burn-in and on the thinning grid are
 * recorded.</p>
 */
public final class MixtureModeller {
    private static final Logger logger = LogManager.getLogger(MixtureModeller.class);

    private final MixtureData data;
    private final MixtureState initialState;
    private final MixtureModelArgumentCollection arguments;

    /**
     * @param data          data of the run
     * @param initialState  state the chain starts from, see {@link #initializeState}
     * @param arguments     run parameters; validated here
     */
    public MixtureModeller(final MixtureData data,
                           final MixtureState initialState,
                           final MixtureModelArgumentCollection arguments) {
        this.data = Utils.nonNull(data);
        this.initialState = Utils.nonNull(initialState);
        this.arguments = Utils.nonNull(arguments);
        arguments.validate();
    }

    /**
     * Builds the state all chains start from: posterior-mean allele frequencies given the baseline, infection
     * probabilities drawn from their prior, mixing proportions at their prior mean, origins of unknown individuals
     * drawn proportionally to auxiliary likelihood x mixing-proportion prior x genetic likelihood, and missing
     * infection statuses imputed from those origins.
     */
    public static MixtureState initializeState(final MixtureData data, final RandomGenerator rng) {
        Utils.nonNull(data);
        Utils.nonNull(rng);
        final MixturePriorCollection priors = data.getPriors();
        final MixtureFamily family = data.getFamily();
        final AlleleFrequencies alleleFrequencies = priors.initialAlleleFrequencies();
        final InfectionProbabilities infectionProbabilities = family.initialInfectionProbabilities(rng);
        final double[] mixingProportionPseudoCounts = priors.mixingProportionPseudoCounts();
        final MixingProportions mixingProportions = new MixingProportions(new Dirichlet(mixingProportionPseudoCounts).meanWeights());

        final int[] origins = new int[data.numIndividuals()];
        for (int individual = 0; individual < origins.length; individual++) {
            origins[individual] = data.isKnownOrigin(individual) ? data.knownOrigin(individual) : 0;
        }
        final MixtureState unassignedState = new MixtureState(alleleFrequencies, infectionProbabilities, mixingProportions,
                new Assignments(origins), family.initialInfectionStatus());
        for (final int individual : data.getUnknownIndividuals()) {
            final double[] weights = MixtureLikelihoods.assignmentWeights(data, unassignedState, individual, mixingProportionPseudoCounts);
            origins[individual] = MathUtils.sampleIndexProportionally(weights, rng);
        }
        final Assignments assignments = new Assignments(origins);
        final MixtureState assignedState = new MixtureState(alleleFrequencies, infectionProbabilities, mixingProportions,
                assignments, family.initialInfectionStatus());
        return new MixtureState(alleleFrequencies, infectionProbabilities, mixingProportions,
                assignments, family.sampleInfectionStatus(rng, assignedState));
    }

    /**
     * Performs one Gibbs sweep.  The input state is left unchanged.
     * @param state                     current state
     * @param data                      data of the run
     * @param updateAlleleFrequencies   false to hold allele frequencies fixed (conditional GSI or adaptation)
     * @param rng                       source of randomness
     * @return                          the next state
     * @throws EnigmaException.DegenerateSamplingDistribution if an origin cannot be drawn
     */
    public static MixtureState gibbsStep(final MixtureState state,
                                         final MixtureData data,
                                         final boolean updateAlleleFrequencies,
                                         final RandomGenerator rng) {
        Utils.nonNull(state);
        Utils.nonNull(rng);
        final ParameterizedModel<MixtureParameter, MixtureState, MixtureData> model = buildModel(state.copy(), data, updateAlleleFrequencies);
        model.update(rng);
        return model.state();
    }

    /**
     * Runs the chain.
     * @param chainId   1-based chain id, used in logs and failure reports
     * @param rng       random stream of this chain only
     * @throws EnigmaException.ChainFailure if the sampling distribution of an origin degenerates
     */
    public MixtureChainSamples fitMCMC(final int chainId, final RandomGenerator rng) {
        Utils.nonNull(rng);
        final int numAdaptation = arguments.effectiveNumAdaptation();
        final MixtureState adaptedState = adapt(chainId, numAdaptation, rng);

        final GibbsSampler<MixtureParameter, MixtureState, MixtureData> sampler = new GibbsSampler<>(
                arguments.numIterations, arguments.effectiveNumBurnIn(), arguments.thinningInterval,
                buildModel(adaptedState.copy(), data, !arguments.conditionalGsi));
        sampler.setNumSamplesPerLogEntry(arguments.logInterval);
        sampler.setDescription("Chain " + chainId);
        try {
            sampler.runMCMC(rng);
        } catch (final EnigmaException.DegenerateSamplingDistribution e) {
            throw new EnigmaException.ChainFailure(chainId, numAdaptation + sampler.getNumSamplesGenerated() + 1, e);
        }
        final MixtureChainSamples samples = new MixtureChainSamples(chainId, sampler.getSamples());
        logger.info(String.format("Chain %d recorded %d samples.", chainId, samples.numSamples()));
        return samples;
    }

    private MixtureState adapt(final int chainId, final int numAdaptation, final RandomGenerator rng) {
        if (numAdaptation == 0) {
            return initialState;
        }
        logger.info(String.format("Chain %d: starting %d adaptation iterations.", chainId, numAdaptation));
        final ParameterizedModel<MixtureParameter, MixtureState, MixtureData> model = buildModel(initialState.copy(), data, false);
        for (int iteration = 1; iteration <= numAdaptation; iteration++) {
            try {
                model.update(rng);
            } catch (final EnigmaException.DegenerateSamplingDistribution e) {
                throw new EnigmaException.ChainFailure(chainId, iteration, e);
            }
            if (iteration % arguments.logInterval == 0) {
                logger.info(String.format("Chain %d: %d of %d adaptation iterations done.", chainId, iteration, numAdaptation));
            }
        }
        return model.state();
    }

    private static ParameterizedModel<MixtureParameter, MixtureState, MixtureData> buildModel(final MixtureState state,
                                                                                              final MixtureData data,
                                                                                              final boolean updateAlleleFrequencies) {
        final ParameterSampler<AlleleFrequencies, MixtureParameter, MixtureState, MixtureData> alleleFrequenciesSampler =
                updateAlleleFrequencies
                        ? new MixtureSamplers.AlleleFrequenciesSampler()
                        : new MixtureSamplers.FixedAlleleFrequenciesSampler();
        return new ParameterizedModel.GibbsBuilder<MixtureParameter, MixtureState, MixtureData>(state, data)
                .addParameterSampler(MixtureParameter.ALLELE_FREQUENCIES, alleleFrequenciesSampler, AlleleFrequencies.class)
                .addParameterSampler(MixtureParameter.INFECTION_PROBABILITIES, new MixtureSamplers.InfectionProbabilitiesSampler(), InfectionProbabilities.class)
                .addParameterSampler(MixtureParameter.MIXING_PROPORTIONS, new MixtureSamplers.MixingProportionsSampler(), MixingProportions.class)
                .addParameterSampler(MixtureParameter.ASSIGNMENTS, new MixtureSamplers.AssignmentsSampler(), Assignments.class)
                .addParameterSampler(MixtureParameter.INFECTION_STATUS, new MixtureSamplers.InfectionStatusSampler(), InfectionStatus.class)
                .build();
    }
}
