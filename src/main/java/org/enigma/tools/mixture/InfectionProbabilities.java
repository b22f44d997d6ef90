package org.enigma.tools.mixture;

import org.enigma.utils.MathUtils;
import org.enigma.utils.Utils;

import java.util.Arrays;

/**
 * Infection probability of each stratum and reporting group (strata x groups).  Families without a pathogen
 * covariate carry the empty instance.
 */
public final class InfectionProbabilities {
    private static final InfectionProbabilities EMPTY = new InfectionProbabilities(new double[0][]);

    private final double[][] probabilities;

    public InfectionProbabilities(final double[][] probabilities) {
        Utils.nonNull(probabilities);
        this.probabilities = new double[probabilities.length][];
        for (int stratum = 0; stratum < probabilities.length; stratum++) {
            final double[] row = Utils.nonNull(probabilities[stratum]);
            Utils.validateArg(MathUtils.allMatch(row, p -> p >= 0 && p <= 1), "Infection probabilities must lie in [0, 1].");
            this.probabilities[stratum] = row.clone();
        }
    }

    public static InfectionProbabilities empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return probabilities.length == 0;
    }

    public int numStrata() {
        return probabilities.length;
    }

    public double get(final int stratum, final int group) {
        return probabilities[stratum][group];
    }

    /** Returns a copy of the probabilities of one stratum, one per reporting group. */
    public double[] getStratum(final int stratum) {
        return probabilities[Utils.validIndex(stratum, probabilities.length)].clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.deepEquals(probabilities, ((InfectionProbabilities) o).probabilities);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(probabilities);
    }

    @Override
    public String toString() {
        return "InfectionProbabilities" + Arrays.deepToString(probabilities);
    }
}
