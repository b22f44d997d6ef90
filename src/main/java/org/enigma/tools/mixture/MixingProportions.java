package org.enigma.tools.mixture;

import org.enigma.utils.MathUtils;
import org.enigma.utils.Utils;

import java.util.Arrays;

/**
 * Proportion of the mixture contributed by each baseline population.
 */
public final class MixingProportions {
    private final double[] proportions;

    public MixingProportions(final double[] proportions) {
        Utils.nonNull(proportions);
        Utils.validateArg(proportions.length > 0, "There must be at least one population.");
        Utils.validateArg(MathUtils.allMatch(proportions, p -> p >= 0 && p <= 1), "Mixing proportions must lie in [0, 1].");
        this.proportions = proportions.clone();
    }

    public int numPopulations() {
        return proportions.length;
    }

    public double get(final int population) {
        return proportions[population];
    }

    public double[] toArray() {
        return proportions.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(proportions, ((MixingProportions) o).proportions);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(proportions);
    }

    @Override
    public String toString() {
        return "MixingProportions" + Arrays.toString(proportions);
    }
}
