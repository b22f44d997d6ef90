package org.enigma.tools.mixture;

import org.enigma.utils.MathUtils;
import org.enigma.utils.Utils;

import java.util.Arrays;

/**
 * Column layout shared by the baseline and mixture allele-count tables: the columns are split into one
 * contiguous block per locus, with one column per allele type of that locus.
 */
public final class LocusLayout {
    private final int[] numAlleles;
    private final int[] blockStarts;
    private final int numColumns;

    /**
     * @param numAlleles    number of allele types of each locus, in column order; all must be positive
     */
    public LocusLayout(final int... numAlleles) {
        Utils.nonNull(numAlleles);
        Utils.validateArg(numAlleles.length > 0, "There must be at least one locus.");
        Utils.validateArg(MathUtils.allMatch(numAlleles, n -> n > 0), "Every locus must have at least one allele type.");
        this.numAlleles = numAlleles.clone();
        blockStarts = new int[numAlleles.length];
        int start = 0;
        for (int locus = 0; locus < numAlleles.length; locus++) {
            blockStarts[locus] = start;
            start += numAlleles[locus];
        }
        numColumns = start;
    }

    public int numLoci() {
        return numAlleles.length;
    }

    public int numColumns() {
        return numColumns;
    }

    public int numAlleles(final int locus) {
        return numAlleles[Utils.validIndex(locus, numAlleles.length)];
    }

    /** First column of the block of {@code locus}. */
    public int blockStart(final int locus) {
        return blockStarts[Utils.validIndex(locus, numAlleles.length)];
    }

    /** One past the last column of the block of {@code locus}. */
    public int blockEnd(final int locus) {
        return blockStart(locus) + numAlleles[locus];
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(numAlleles, ((LocusLayout) o).numAlleles);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(numAlleles);
    }

    @Override
    public String toString() {
        return "LocusLayout" + Arrays.toString(numAlleles);
    }
}
