package org.enigma.tools.mixture;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.enigma.utils.Dirichlet;
import org.enigma.utils.MathUtils;
import org.enigma.utils.mcmc.ParameterSampler;

/**
 * Conditional samplers of the {@link MixtureParameter}s.  All of them are stateless and may be shared between chains.
 */
final class MixtureSamplers {
    private static final Logger logger = LogManager.getLogger(MixtureSamplers.class);

    private MixtureSamplers() {}

    /**
     * Draws each locus block of each population from Dirichlet(baseline counts + pseudo-counts + counts of the
     * mixture individuals currently assigned to the population).  Blocks with zero total concentration get the
     * uniform frequencies.
     */
    static final class AlleleFrequenciesSampler implements ParameterSampler<AlleleFrequencies, MixtureParameter, MixtureState, MixtureData> {
        @Override
        public AlleleFrequencies sample(final RandomGenerator rng, final MixtureState state, final MixtureData data) {
            final LocusLayout layout = data.getLayout();
            final int numPopulations = data.getPanel().numPopulations();
            final int[][] assignedMixtureCounts = new int[numPopulations][layout.numColumns()];
            final Assignments assignments = state.assignments();
            for (int individual = 0; individual < data.numIndividuals(); individual++) {
                final int[] row = assignedMixtureCounts[assignments.get(individual)];
                for (int column = 0; column < row.length; column++) {
                    row[column] += data.mixtureCount(individual, column);
                }
            }
            final MixturePriorCollection priors = data.getPriors();
            final double[][] frequencies = new double[numPopulations][layout.numColumns()];
            for (int population = 0; population < numPopulations; population++) {
                for (int locus = 0; locus < layout.numLoci(); locus++) {
                    final double[] concentration = priors.posteriorConcentration(population, locus, assignedMixtureCounts[population]);
                    final double[] blockFrequencies = MathUtils.sum(concentration) > 0
                            ? new Dirichlet(concentration).sample(rng)
                            : MixturePriorCollection.uniform(concentration.length);
                    System.arraycopy(blockFrequencies, 0, frequencies[population], layout.blockStart(locus), blockFrequencies.length);
                }
            }
            logger.debug("Sampled allele frequencies.");
            return new AlleleFrequencies(frequencies);
        }
    }

    /**
     * Returns the current allele frequencies unchanged; used under conditional GSI and during adaptation.
     */
    static final class FixedAlleleFrequenciesSampler implements ParameterSampler<AlleleFrequencies, MixtureParameter, MixtureState, MixtureData> {
        @Override
        public AlleleFrequencies sample(final RandomGenerator rng, final MixtureState state, final MixtureData data) {
            return state.alleleFrequencies();
        }
    }

    static final class InfectionProbabilitiesSampler implements ParameterSampler<InfectionProbabilities, MixtureParameter, MixtureState, MixtureData> {
        @Override
        public InfectionProbabilities sample(final RandomGenerator rng, final MixtureState state, final MixtureData data) {
            return data.getFamily().sampleInfectionProbabilities(rng, state);
        }
    }

    /**
     * Draws the mixing proportions from Dirichlet(number of individuals assigned to each population + pseudo-counts).
     */
    static final class MixingProportionsSampler implements ParameterSampler<MixingProportions, MixtureParameter, MixtureState, MixtureData> {
        @Override
        public MixingProportions sample(final RandomGenerator rng, final MixtureState state, final MixtureData data) {
            final int numPopulations = data.getPanel().numPopulations();
            final int[] counts = state.assignments().countByPopulation(numPopulations);
            final double[] concentration = data.getPriors().mixingProportionPseudoCounts();
            for (int population = 0; population < numPopulations; population++) {
                concentration[population] += counts[population];
            }
            return new MixingProportions(new Dirichlet(concentration).sample(rng));
        }
    }

    /**
     * Draws the origin of every individual of unknown origin over the wild populations, proportionally to
     * auxiliary likelihood x mixing proportion x genetic likelihood.  Known origins are kept.
     */
    static final class AssignmentsSampler implements ParameterSampler<Assignments, MixtureParameter, MixtureState, MixtureData> {
        @Override
        public Assignments sample(final RandomGenerator rng, final MixtureState state, final MixtureData data) {
            final double[] proportions = state.mixingProportions().toArray();
            final int[] origins = state.assignments().toArray();
            for (final int individual : data.getUnknownIndividuals()) {
                final double[] weights = MixtureLikelihoods.assignmentWeights(data, state, individual, proportions);
                origins[individual] = MathUtils.sampleIndexProportionally(weights, rng);
            }
            return new Assignments(origins);
        }
    }

    static final class InfectionStatusSampler implements ParameterSampler<InfectionStatus, MixtureParameter, MixtureState, MixtureData> {
        @Override
        public InfectionStatus sample(final RandomGenerator rng, final MixtureState state, final MixtureData data) {
            return data.getFamily().sampleInfectionStatus(rng, state);
        }
    }
}
