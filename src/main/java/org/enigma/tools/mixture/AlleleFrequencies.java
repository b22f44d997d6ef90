package org.enigma.tools.mixture;

import org.apache.commons.math3.util.FastMath;
import org.enigma.utils.MathUtils;
import org.enigma.utils.Utils;

import java.util.Arrays;

/**
 * Allele frequencies of every baseline population, laid out as in {@link LocusLayout}: each locus block of a
 * population row is a probability simplex.  Logarithms are precomputed for the genetic likelihoods.
 */
public final class AlleleFrequencies {
    private final double[][] frequencies;
    private final double[][] logFrequencies;

    /**
     * @param frequencies   populations x columns; copied
     */
    public AlleleFrequencies(final double[][] frequencies) {
        Utils.nonNull(frequencies);
        Utils.validateArg(frequencies.length > 0, "There must be at least one population.");
        final int numColumns = frequencies[0].length;
        this.frequencies = new double[frequencies.length][];
        logFrequencies = new double[frequencies.length][];
        for (int population = 0; population < frequencies.length; population++) {
            final double[] row = Utils.nonNull(frequencies[population]);
            Utils.validateArg(row.length == numColumns, "All populations must have the same number of columns.");
            Utils.validateArg(MathUtils.allMatch(row, f -> f >= 0 && f <= 1), "Allele frequencies must lie in [0, 1].");
            this.frequencies[population] = row.clone();
            logFrequencies[population] = MathUtils.applyToArray(row, FastMath::log);
        }
    }

    public int numPopulations() {
        return frequencies.length;
    }

    public int numColumns() {
        return frequencies[0].length;
    }

    public double get(final int population, final int column) {
        return frequencies[population][column];
    }

    public double getLog(final int population, final int column) {
        return logFrequencies[population][column];
    }

    /** Returns a copy of the frequencies of one population. */
    public double[] getPopulation(final int population) {
        return frequencies[Utils.validIndex(population, frequencies.length)].clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.deepEquals(frequencies, ((AlleleFrequencies) o).frequencies);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(frequencies);
    }

    @Override
    public String toString() {
        return "AlleleFrequencies" + Arrays.deepToString(frequencies);
    }
}
