package org.enigma.tools.mixture;

import org.enigma.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Recorded iterations of one chain.  Entry i of each list belongs to the (i + 1)-th recorded iteration.
 */
public final class MixtureChainSamples {
    private final int chainId;
    private final List<MixingProportions> mixingProportions;
    private final List<Assignments> assignments;
    private final List<InfectionProbabilities> infectionProbabilities;

    /**
     * @param chainId   1-based chain id
     */
    public MixtureChainSamples(final int chainId, final List<MixtureState> recordedStates) {
        Utils.validateArg(chainId >= 1, "Chain ids are 1-based.");
        Utils.nonNull(recordedStates);
        this.chainId = chainId;
        final List<MixingProportions> proportionSamples = new ArrayList<>(recordedStates.size());
        final List<Assignments> assignmentSamples = new ArrayList<>(recordedStates.size());
        final List<InfectionProbabilities> infectionSamples = new ArrayList<>(recordedStates.size());
        for (final MixtureState state : recordedStates) {
            proportionSamples.add(state.mixingProportions());
            assignmentSamples.add(state.assignments());
            infectionSamples.add(state.infectionProbabilities());
        }
        mixingProportions = Collections.unmodifiableList(proportionSamples);
        assignments = Collections.unmodifiableList(assignmentSamples);
        infectionProbabilities = Collections.unmodifiableList(infectionSamples);
    }

    public int getChainId() {
        return chainId;
    }

    public int numSamples() {
        return mixingProportions.size();
    }

    public List<MixingProportions> getMixingProportions() {
        return mixingProportions;
    }

    public List<Assignments> getAssignments() {
        return assignments;
    }

    public List<InfectionProbabilities> getInfectionProbabilities() {
        return infectionProbabilities;
    }

    /**
     * Reporting-group proportions of every recorded iteration (samples x groups).
     */
    public double[][] groupProportions(final PopulationPanel panel) {
        Utils.nonNull(panel);
        return mixingProportions.stream().map(p -> panel.sumByGroup(p.toArray())).toArray(double[][]::new);
    }
}
