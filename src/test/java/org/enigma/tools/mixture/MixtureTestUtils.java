package org.enigma.tools.mixture;

import org.enigma.tools.mixture.family.MixtureFamily;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Small synthetic baselines and mixtures with a single di-allelic locus.
 */
final class MixtureTestUtils {
    static final LocusLayout ONE_DIALLELIC_LOCUS = new LocusLayout(2);

    /** Allele counts of a homozygote for the first allele. */
    static final int[] FIRST_ALLELE = {2, 0};
    /** Allele counts of a homozygote for the second allele. */
    static final int[] SECOND_ALLELE = {0, 2};

    private MixtureTestUtils() {}

    /**
     * Three wild populations; pop1 and pop2 report to "north", pop3 to "south".
     */
    static PopulationPanel threePopulationPanel() {
        return new PopulationPanel(Arrays.asList("pop1", "pop2", "pop3"), Collections.emptyList(),
                new int[] {1, 1, 2}, Arrays.asList("north", "south"));
    }

    /**
     * pop1 and pop2 are fixed for the first allele, pop3 for the second.
     */
    static int[][] threePopulationBaseline() {
        return new int[][] {{1000, 0}, {1000, 0}, {0, 1000}};
    }

    /**
     * Two wild populations, one per reporting group, fixed for different alleles, and one hatchery in the first group.
     */
    static PopulationPanel panelWithHatchery() {
        return new PopulationPanel(Arrays.asList("wildA", "wildB"), Collections.singletonList("hatchery"),
                new int[] {1, 2, 1}, Arrays.asList("groupA", "groupB"));
    }

    static int[][] baselineWithHatchery() {
        return new int[][] {{1000, 0}, {0, 1000}, {500, 500}};
    }

    static List<String> individualNames(final int numIndividuals) {
        return IntStream.rangeClosed(1, numIndividuals).mapToObj(i -> "fish" + i).collect(Collectors.toList());
    }

    static int[][] repeatRows(final int[] row, final int numRows) {
        return IntStream.range(0, numRows).mapToObj(i -> row.clone()).toArray(int[][]::new);
    }

    static int[][] concatRows(final int[][] first, final int[][] second) {
        return IntStream.range(0, first.length + second.length)
                .mapToObj(i -> i < first.length ? first[i] : second[i - first.length])
                .toArray(int[][]::new);
    }

    static MixtureData mixture(final int[][] mixtureCounts,
                               final int[][] baselineCounts,
                               final PopulationPanel panel,
                               final MixtureFamily family) {
        return new MixtureData(individualNames(mixtureCounts.length), mixtureCounts, baselineCounts, ONE_DIALLELIC_LOCUS,
                panel, family);
    }

    static MixtureModelArgumentCollection arguments(final int numIterations,
                                                    final int numBurnIn,
                                                    final int thinningInterval,
                                                    final int numChains) {
        final MixtureModelArgumentCollection arguments = new MixtureModelArgumentCollection();
        arguments.numIterations = numIterations;
        arguments.numBurnIn = numBurnIn;
        arguments.thinningInterval = thinningInterval;
        arguments.numChains = numChains;
        arguments.seed = 1234L;
        return arguments;
    }
}
