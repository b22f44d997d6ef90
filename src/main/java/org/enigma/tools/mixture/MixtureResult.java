package org.enigma.tools.mixture;

import org.enigma.utils.Utils;
import org.enigma.utils.mcmc.PosteriorSummary;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Output of a mixture-model run: posterior summaries and traces of the reporting-group proportions, the trace of
 * individual assignments, and, for the pathogen family, summaries and traces of the infection probabilities of each
 * stratum.  Chains that failed are listed with their failure messages and contribute nothing else.
 */
public final class MixtureResult {

    /**
     * Values of a vector parameter at one recorded iteration of one chain.  Iterations and chains are 1-based.
     */
    public static final class TraceRow {
        private final int iteration;
        private final int chain;
        private final double[] values;

        public TraceRow(final int iteration, final int chain, final double[] values) {
            this.iteration = iteration;
            this.chain = chain;
            this.values = Utils.nonNull(values).clone();
        }

        public int getIteration() {
            return iteration;
        }

        public int getChain() {
            return chain;
        }

        public double[] getValues() {
            return values.clone();
        }
    }

    /**
     * Origins of all individuals (1-based population indices) at one recorded iteration of one chain.
     */
    public static final class AssignmentTraceRow {
        private final int iteration;
        private final int chain;
        private final int[] origins;

        public AssignmentTraceRow(final int iteration, final int chain, final int[] origins) {
            this.iteration = iteration;
            this.chain = chain;
            this.origins = Utils.nonNull(origins).clone();
        }

        public int getIteration() {
            return iteration;
        }

        public int getChain() {
            return chain;
        }

        public int[] getOrigins() {
            return origins.clone();
        }
    }

    /**
     * Per-component summaries of a vector parameter, in component order, with its multi-chain trace and
     * multivariate potential scale reduction factor.
     */
    public static final class TraceSummary {
        private final Map<String, PosteriorSummary> summaries;
        private final List<TraceRow> trace;
        private final OptionalDouble multivariatePotentialScaleReductionFactor;

        public TraceSummary(final LinkedHashMap<String, PosteriorSummary> summaries,
                            final List<TraceRow> trace,
                            final OptionalDouble multivariatePotentialScaleReductionFactor) {
            this.summaries = Collections.unmodifiableMap(new LinkedHashMap<>(Utils.nonNull(summaries)));
            this.trace = Collections.unmodifiableList(Utils.nonNull(trace));
            this.multivariatePotentialScaleReductionFactor = Utils.nonNull(multivariatePotentialScaleReductionFactor);
        }

        public Map<String, PosteriorSummary> getSummaries() {
            return summaries;
        }

        public PosteriorSummary getSummary(final String name) {
            return Utils.nonNull(summaries.get(name), () -> "No summary named " + name);
        }

        public List<TraceRow> getTrace() {
            return trace;
        }

        public OptionalDouble getMultivariatePotentialScaleReductionFactor() {
            return multivariatePotentialScaleReductionFactor;
        }
    }

    private final String familyName;
    private final long seed;
    private final TraceSummary groupProportions;
    private final List<AssignmentTraceRow> assignmentTrace;
    private final List<TraceSummary> infectionProbabilities;
    private final SortedMap<Integer, String> failedChains;
    private final Duration runTime;

    public MixtureResult(final String familyName,
                         final long seed,
                         final TraceSummary groupProportions,
                         final List<AssignmentTraceRow> assignmentTrace,
                         final List<TraceSummary> infectionProbabilities,
                         final Map<Integer, String> failedChains,
                         final Duration runTime) {
        this.familyName = Utils.nonNull(familyName);
        this.seed = seed;
        this.groupProportions = Utils.nonNull(groupProportions);
        this.assignmentTrace = Collections.unmodifiableList(Utils.nonNull(assignmentTrace));
        this.infectionProbabilities = Collections.unmodifiableList(Utils.nonNull(infectionProbabilities));
        this.failedChains = Collections.unmodifiableSortedMap(new TreeMap<>(Utils.nonNull(failedChains)));
        this.runTime = Utils.nonNull(runTime);
    }

    public String getFamilyName() {
        return familyName;
    }

    /** Seed the run was started from; rerunning with it reproduces the result. */
    public long getSeed() {
        return seed;
    }

    /** Reporting-group proportions, keyed by group display name. */
    public TraceSummary getGroupProportions() {
        return groupProportions;
    }

    public List<AssignmentTraceRow> getAssignmentTrace() {
        return assignmentTrace;
    }

    /**
     * Infection probabilities keyed by reporting-group display name, one entry per stratum (stratum s at index s - 1);
     * empty unless the family is the pathogen family.
     */
    public List<TraceSummary> getInfectionProbabilities() {
        return infectionProbabilities;
    }

    /** Failure message of each failed chain, by 1-based chain id. */
    public SortedMap<Integer, String> getFailedChains() {
        return failedChains;
    }

    public Duration getRunTime() {
        return runTime;
    }
}
