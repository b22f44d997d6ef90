package org.enigma.tools.mixture;

import org.enigma.utils.MathUtils;
import org.enigma.utils.Utils;

import java.util.Arrays;

/**
 * Population of origin (0-based index into {@link PopulationPanel}) of every mixture individual.
 */
public final class Assignments {
    private final int[] origins;

    public Assignments(final int[] origins) {
        Utils.nonNull(origins);
        Utils.validateArg(MathUtils.allMatch(origins, o -> o >= 0), "Population indices must be non-negative.");
        this.origins = origins.clone();
    }

    public int numIndividuals() {
        return origins.length;
    }

    public int get(final int individual) {
        return origins[individual];
    }

    public int[] toArray() {
        return origins.clone();
    }

    /**
     * Number of individuals assigned to each population.
     */
    public int[] countByPopulation(final int numPopulations) {
        final int[] counts = new int[numPopulations];
        for (final int origin : origins) {
            counts[Utils.validIndex(origin, numPopulations)]++;
        }
        return counts;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(origins, ((Assignments) o).origins);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(origins);
    }

    @Override
    public String toString() {
        return "Assignments" + Arrays.toString(origins);
    }
}
