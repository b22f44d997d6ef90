package org.enigma.tools.mixture;

import org.enigma.exceptions.UserException;
import org.enigma.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Baseline populations and their reporting groups.
 *
 * <p>Populations are indexed 0..K+H-1: the K wild populations first, then the H hatcheries, in the order given.
 * This is also the row order of the baseline table.  Reporting groups are given as 1-based ids, one per population,
 * with one display name per id.</p>
 */
public final class PopulationPanel {
    private final List<String> wildPopulations;
    private final List<String> hatcheries;
    private final int[] groupIndices;
    private final List<String> groupNames;
    private final int[] groupSizes;

    /**
     * @param wildPopulations   names of the wild populations; at least one
     * @param hatcheries        names of the hatcheries; may be empty
     * @param groupIds          1-based reporting-group id of each population, wild populations first
     * @param groupNames        display name of each reporting group; group id g is named {@code groupNames.get(g - 1)}
     * @throws UserException.MissingHatcheries if there are more group ids than wild populations but no hatcheries
     * @throws UserException.BadInput if the cardinalities or group ids are otherwise inconsistent
     */
    public PopulationPanel(final List<String> wildPopulations,
                           final List<String> hatcheries,
                           final int[] groupIds,
                           final List<String> groupNames) {
        Utils.nonNull(wildPopulations);
        Utils.nonNull(hatcheries);
        Utils.nonNull(groupIds);
        Utils.nonNull(groupNames);
        if (wildPopulations.isEmpty()) {
            throw new UserException.BadInput("There must be at least one wild population.");
        }
        if (hatcheries.isEmpty() && groupIds.length > wildPopulations.size()) {
            throw new UserException.MissingHatcheries(groupIds.length, wildPopulations.size());
        }
        final int numPopulations = wildPopulations.size() + hatcheries.size();
        if (groupIds.length != numPopulations) {
            throw new UserException.BadInput(String.format(
                    "There are %d populations (%d wild, %d hatcheries) but %d reporting-group ids.",
                    numPopulations, wildPopulations.size(), hatcheries.size(), groupIds.length));
        }
        final List<String> allPopulations = new ArrayList<>(wildPopulations);
        allPopulations.addAll(hatcheries);
        try {
            Utils.checkForDuplicatesAndReturnSet(allPopulations, "Population names must be unique.");
            Utils.checkForDuplicatesAndReturnSet(groupNames, "Reporting-group names must be unique.");
        } catch (final IllegalArgumentException e) {
            throw new UserException.BadInput(e.getMessage(), e);
        }
        groupSizes = new int[groupNames.size()];
        groupIndices = new int[numPopulations];
        for (int population = 0; population < numPopulations; population++) {
            final int groupId = groupIds[population];
            if (groupId < 1 || groupId > groupNames.size()) {
                throw new UserException.BadInput(String.format(
                        "Population %s has reporting-group id %d, but only %d group names were given.",
                        allPopulations.get(population), groupId, groupNames.size()));
            }
            groupIndices[population] = groupId - 1;
            groupSizes[groupId - 1]++;
        }
        this.wildPopulations = Collections.unmodifiableList(new ArrayList<>(wildPopulations));
        this.hatcheries = Collections.unmodifiableList(new ArrayList<>(hatcheries));
        this.groupNames = Collections.unmodifiableList(new ArrayList<>(groupNames));
    }

    public List<String> getWildPopulations() {
        return wildPopulations;
    }

    public List<String> getHatcheries() {
        return hatcheries;
    }

    public List<String> getGroupNames() {
        return groupNames;
    }

    public int numWildPopulations() {
        return wildPopulations.size();
    }

    public int numHatcheries() {
        return hatcheries.size();
    }

    public int numPopulations() {
        return wildPopulations.size() + hatcheries.size();
    }

    public int numGroups() {
        return groupNames.size();
    }

    public boolean isHatchery(final int population) {
        return Utils.validIndex(population, numPopulations()) >= wildPopulations.size();
    }

    public String populationName(final int population) {
        Utils.validIndex(population, numPopulations());
        return isHatchery(population) ? hatcheries.get(population - wildPopulations.size()) : wildPopulations.get(population);
    }

    /** 0-based reporting-group index of a population. */
    public int groupIndex(final int population) {
        return groupIndices[Utils.validIndex(population, numPopulations())];
    }

    /** Number of populations in a reporting group (0-based index). */
    public int groupSize(final int group) {
        return groupSizes[Utils.validIndex(group, groupSizes.length)];
    }

    /** Largest reporting-group id in use (1-based). */
    public int maxGroupId() {
        int max = 0;
        for (final int group : groupIndices) {
            max = Math.max(max, group + 1);
        }
        return max;
    }

    /**
     * Sums population-level values into reporting-group totals.
     * @param populationValues  one value per population
     * @return                  one value per reporting group
     */
    public double[] sumByGroup(final double[] populationValues) {
        Utils.nonNull(populationValues);
        Utils.validateArg(populationValues.length == numPopulations(), "There must be one value per population.");
        final double[] groupValues = new double[numGroups()];
        for (int population = 0; population < populationValues.length; population++) {
            groupValues[groupIndices[population]] += populationValues[population];
        }
        return groupValues;
    }
}
