package org.enigma.tools.mixture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.enigma.utils.Utils;
import org.enigma.utils.mcmc.ConvergenceDiagnostics;
import org.enigma.utils.mcmc.PosteriorSummary;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Combines the recorded samples of the completed chains into a {@link MixtureResult}.
 */
public final class MixtureResultAssembler {
    private static final Logger logger = LogManager.getLogger(MixtureResultAssembler.class);

    private MixtureResultAssembler() {}

    /**
     * @param data              data of the run
     * @param completedChains   samples of every completed chain, in chain order; at least one
     * @param numBurnInSamples  number of leading samples of each chain recorded during the burn-in; these are traced
     *                          but left out of the summaries
     * @param failedChains      failure message of every failed chain, by chain id
     * @param seed              seed of the run
     * @param runTime           wall-clock time of the run
     */
    public static MixtureResult assemble(final MixtureData data,
                                         final List<MixtureChainSamples> completedChains,
                                         final int numBurnInSamples,
                                         final Map<Integer, String> failedChains,
                                         final long seed,
                                         final Duration runTime) {
        Utils.nonNull(data);
        Utils.nonEmpty(completedChains, "There must be at least one completed chain.");
        Utils.nonNull(failedChains);
        final PopulationPanel panel = data.getPanel();
        final List<Integer> chainIds = completedChains.stream().map(MixtureChainSamples::getChainId).collect(Collectors.toList());

        final List<double[][]> groupProportions = completedChains.stream()
                .map(c -> c.groupProportions(panel)).collect(Collectors.toList());
        final MixtureResult.TraceSummary groupSummary = summarize(panel.getGroupNames(), groupProportions, chainIds, numBurnInSamples);
        logger.info("Multivariate potential scale reduction factor of reporting-group proportions: "
                + format(groupSummary.getMultivariatePotentialScaleReductionFactor()));

        final List<MixtureResult.AssignmentTraceRow> assignmentTrace = new ArrayList<>();
        for (final MixtureChainSamples chain : completedChains) {
            final List<Assignments> assignments = chain.getAssignments();
            for (int sample = 0; sample < assignments.size(); sample++) {
                final int[] origins = IntStream.of(assignments.get(sample).toArray()).map(o -> o + 1).toArray();
                assignmentTrace.add(new MixtureResult.AssignmentTraceRow(sample + 1, chain.getChainId(), origins));
            }
        }

        final List<MixtureResult.TraceSummary> infectionSummaries = new ArrayList<>();
        final int numStrata = data.getFamily().numStrata();
        for (int stratum = 0; stratum < numStrata; stratum++) {
            final int s = stratum;
            final List<double[][]> stratumSamples = completedChains.stream()
                    .map(c -> c.getInfectionProbabilities().stream().map(theta -> theta.getStratum(s)).toArray(double[][]::new))
                    .collect(Collectors.toList());
            infectionSummaries.add(summarize(panel.getGroupNames(), stratumSamples, chainIds, numBurnInSamples));
        }

        return new MixtureResult(data.getFamily().getName(), seed, groupSummary, assignmentTrace, infectionSummaries,
                failedChains, runTime);
    }

    /**
     * Summarizes a vector parameter traced by several chains.
     * @param names             name of each component
     * @param chainSamples      samples x components, one matrix per chain; all chains have the same number of samples
     * @param chainIds          1-based id of each chain
     * @param numBurnInSamples  number of leading samples of each chain that are traced but not summarized
     */
    static MixtureResult.TraceSummary summarize(final List<String> names,
                                                final List<double[][]> chainSamples,
                                                final List<Integer> chainIds,
                                                final int numBurnInSamples) {
        Utils.validateArg(chainSamples.size() == chainIds.size(), "There must be one id per chain.");
        final int numSamples = chainSamples.get(0).length;
        Utils.validateArg(chainSamples.stream().allMatch(c -> c.length == numSamples),
                "All chains must have the same number of samples.");
        Utils.validateArg(0 <= numBurnInSamples && numBurnInSamples < numSamples,
                () -> String.format("Cannot leave %d burn-in samples out of %d recorded samples.", numBurnInSamples, numSamples));
        final LinkedHashMap<String, PosteriorSummary> summaries = new LinkedHashMap<>();
        for (int component = 0; component < names.size(); component++) {
            final int j = component;
            final List<double[]> chains = chainSamples.stream()
                    .map(c -> Arrays.stream(c).skip(numBurnInSamples).mapToDouble(row -> row[j]).toArray())
                    .collect(Collectors.toList());
            summaries.put(names.get(component), ConvergenceDiagnostics.summarize(chains));
        }
        final List<MixtureResult.TraceRow> trace = new ArrayList<>();
        for (int chain = 0; chain < chainSamples.size(); chain++) {
            final double[][] samples = chainSamples.get(chain);
            for (int sample = 0; sample < samples.length; sample++) {
                trace.add(new MixtureResult.TraceRow(sample + 1, chainIds.get(chain), samples[sample]));
            }
        }
        final OptionalDouble mpsrf = ConvergenceDiagnostics.multivariatePotentialScaleReductionFactor(
                names.size(), numSamples - numBurnInSamples, chainSamples.size());
        return new MixtureResult.TraceSummary(summaries, trace, mpsrf);
    }

    private static String format(final OptionalDouble value) {
        return value.isPresent() ? String.valueOf(value.getAsDouble()) : "not applicable";
    }
}
