package org.enigma.tools.mixture;

import org.enigma.utils.Dirichlet;
import org.enigma.utils.MathUtils;
import org.enigma.utils.Utils;

import java.util.Arrays;

/**
 * Dirichlet pseudo-counts of the mixture model.
 *
 * <ul>
 *     <li>Allele frequencies: each wild population gets 1 / (number of allele types) per column of a locus;
 *     hatcheries get no pseudo-counts.</li>
 *     <li>Mixing proportions: each population gets 1 / (size of its reporting group) / (largest group id), so that
 *     every reporting group carries the same prior weight whatever the number of its populations.</li>
 * </ul>
 */
public final class MixturePriorCollection {
    private final int[][] baselineCounts;
    private final LocusLayout layout;
    private final double[][] alleleFrequencyPseudoCounts;
    private final double[] mixingProportionPseudoCounts;

    /**
     * @param baselineCounts    allele counts of each population (rows ordered as in {@code panel}); not copied
     *                          and must not be modified afterwards
     */
    public MixturePriorCollection(final int[][] baselineCounts, final LocusLayout layout, final PopulationPanel panel) {
        this.baselineCounts = Utils.nonNull(baselineCounts);
        this.layout = Utils.nonNull(layout);
        Utils.nonNull(panel);
        Utils.validateArg(baselineCounts.length == panel.numPopulations(), "There must be one baseline row per population.");
        Utils.validateArg(Arrays.stream(baselineCounts).allMatch(row -> row.length == layout.numColumns()),
                "Baseline rows must have one column per allele type.");
        alleleFrequencyPseudoCounts = new double[panel.numPopulations()][layout.numColumns()];
        for (int population = 0; population < panel.numWildPopulations(); population++) {
            for (int locus = 0; locus < layout.numLoci(); locus++) {
                Arrays.fill(alleleFrequencyPseudoCounts[population], layout.blockStart(locus), layout.blockEnd(locus),
                        1. / layout.numAlleles(locus));
            }
        }
        final int maxGroupId = panel.maxGroupId();
        mixingProportionPseudoCounts = new double[panel.numPopulations()];
        for (int population = 0; population < panel.numPopulations(); population++) {
            mixingProportionPseudoCounts[population] = 1. / panel.groupSize(panel.groupIndex(population)) / maxGroupId;
        }
    }

    public double alleleFrequencyPseudoCount(final int population, final int column) {
        return alleleFrequencyPseudoCounts[population][column];
    }

    public double[] mixingProportionPseudoCounts() {
        return mixingProportionPseudoCounts.clone();
    }

    /**
     * Posterior-mean allele frequencies given the baseline counts alone, (y + prior) / sum(y + prior) per locus block.
     * Blocks with no counts and no pseudo-counts get the uniform frequency 1 / (number of allele types).
     * These are the frequencies used throughout a conditional-GSI run.
     */
    public AlleleFrequencies initialAlleleFrequencies() {
        final int[] noMixtureCounts = new int[layout.numColumns()];
        final double[][] frequencies = new double[baselineCounts.length][layout.numColumns()];
        for (int population = 0; population < baselineCounts.length; population++) {
            for (int locus = 0; locus < layout.numLoci(); locus++) {
                final double[] concentration = posteriorConcentration(population, locus, noMixtureCounts);
                final double[] blockFrequencies = MathUtils.sum(concentration) > 0
                        ? new Dirichlet(concentration).meanWeights()
                        : uniform(concentration.length);
                System.arraycopy(blockFrequencies, 0, frequencies[population], layout.blockStart(locus), blockFrequencies.length);
            }
        }
        return new AlleleFrequencies(frequencies);
    }

    /**
     * Dirichlet concentration of one locus block of one population: baseline counts plus pseudo-counts plus the
     * counts of the mixture individuals currently assigned to the population.
     * @param assignedMixtureCounts summed mixture counts of the individuals assigned to {@code population}, over all columns
     */
    double[] posteriorConcentration(final int population, final int locus, final int[] assignedMixtureCounts) {
        final int start = layout.blockStart(locus);
        final double[] concentration = new double[layout.numAlleles(locus)];
        for (int allele = 0; allele < concentration.length; allele++) {
            concentration[allele] = baselineCounts[population][start + allele]
                    + alleleFrequencyPseudoCounts[population][start + allele]
                    + assignedMixtureCounts[start + allele];
        }
        return concentration;
    }

    static double[] uniform(final int numAlleles) {
        final double[] frequencies = new double[numAlleles];
        Arrays.fill(frequencies, 1. / numAlleles);
        return frequencies;
    }
}
