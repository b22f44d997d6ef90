package org.enigma.tools.mixture;

import org.enigma.utils.MathUtils;
import org.enigma.utils.Utils;

import java.util.Arrays;

/**
 * Infection status (0 or 1) of every mixture individual, with originally missing statuses filled in by imputation.
 * Families without a pathogen covariate carry the empty instance.
 */
public final class InfectionStatus {
    private static final InfectionStatus EMPTY = new InfectionStatus(new int[0]);

    private final int[] statuses;

    public InfectionStatus(final int[] statuses) {
        Utils.nonNull(statuses);
        Utils.validateArg(MathUtils.allMatch(statuses, s -> s == 0 || s == 1), "Infection statuses must be 0 or 1.");
        this.statuses = statuses.clone();
    }

    public static InfectionStatus empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return statuses.length == 0;
    }

    public int numIndividuals() {
        return statuses.length;
    }

    public int get(final int individual) {
        return statuses[individual];
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(statuses, ((InfectionStatus) o).statuses);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(statuses);
    }

    @Override
    public String toString() {
        return "InfectionStatus" + Arrays.toString(statuses);
    }
}
