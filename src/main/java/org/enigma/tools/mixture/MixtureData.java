package org.enigma.tools.mixture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.enigma.exceptions.UserException;
import org.enigma.tools.mixture.family.MixtureFamily;
import org.enigma.utils.MathUtils;
import org.enigma.utils.Utils;
import org.enigma.utils.mcmc.DataCollection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Read-only inputs of the mixture model: mixture and baseline allele counts, populations and reporting groups,
 * known origins and the auxiliary covariate family.  All consistency checks happen here, before any chain starts.
 *
 * <p>Known origins are given 1-based; 0 marks an individual of unknown origin.  Individuals with a known origin,
 * in particular every hatchery individual, are never resampled; unknown individuals are assigned to wild
 * populations only.</p>
 */
public final class MixtureData implements DataCollection {
    private static final Logger logger = LogManager.getLogger(MixtureData.class);

    public static final int UNKNOWN_ORIGIN = 0;

    private final List<String> individualNames;
    private final int[][] mixtureCounts;
    private final int[][] baselineCounts;
    private final LocusLayout layout;
    private final PopulationPanel panel;
    private final int[] knownOrigins;
    private final int[] unknownIndividuals;
    private final MixtureFamily family;
    private final MixturePriorCollection priors;

    //nonzero mixture counts of each individual, for the genetic likelihoods
    private final int[][] nonzeroColumns;
    private final int[][] nonzeroCounts;

    /**
     * Constructs data in which every individual is of unknown origin.
     */
    public MixtureData(final List<String> individualNames,
                       final int[][] mixtureCounts,
                       final int[][] baselineCounts,
                       final LocusLayout layout,
                       final PopulationPanel panel,
                       final MixtureFamily family) {
        this(individualNames, mixtureCounts, baselineCounts, layout, panel, new int[Utils.nonNull(individualNames).size()], family);
    }

    /**
     * @param individualNames   names of the mixture individuals, used in error messages and output
     * @param mixtureCounts     allele counts of each individual (individuals x columns)
     * @param baselineCounts    allele counts of each population (populations x columns), rows ordered as in {@code panel}
     * @param layout            column layout of both count tables
     * @param panel             baseline populations and reporting groups
     * @param knownOrigins      1-based population of each individual, or {@link #UNKNOWN_ORIGIN}
     * @param family            auxiliary covariate model
     */
    public MixtureData(final List<String> individualNames,
                       final int[][] mixtureCounts,
                       final int[][] baselineCounts,
                       final LocusLayout layout,
                       final PopulationPanel panel,
                       final int[] knownOrigins,
                       final MixtureFamily family) {
        Utils.nonNull(individualNames);
        Utils.nonNull(mixtureCounts);
        Utils.nonNull(baselineCounts);
        this.layout = Utils.nonNull(layout);
        this.panel = Utils.nonNull(panel);
        Utils.nonNull(knownOrigins);
        this.family = Utils.nonNull(family);

        final int numIndividuals = individualNames.size();
        if (numIndividuals == 0) {
            throw new UserException.BadInput("The mixture has no individuals.");
        }
        if (mixtureCounts.length != numIndividuals) {
            throw new UserException.BadInput(String.format("There are %d individual names but %d mixture rows.",
                    numIndividuals, mixtureCounts.length));
        }
        if (baselineCounts.length != panel.numPopulations()) {
            throw new UserException.BadInput(String.format("There are %d populations (%d wild, %d hatcheries) but %d baseline rows.",
                    panel.numPopulations(), panel.numWildPopulations(), panel.numHatcheries(), baselineCounts.length));
        }
        this.mixtureCounts = copyCounts(mixtureCounts, layout, "mixture");
        this.baselineCounts = copyCounts(baselineCounts, layout, "baseline");
        this.individualNames = Collections.unmodifiableList(new ArrayList<>(individualNames));

        if (knownOrigins.length != numIndividuals) {
            throw new UserException.BadInput(String.format("There are %d known-origin labels for %d mixture individuals.",
                    knownOrigins.length, numIndividuals));
        }
        final List<String> offendingIndividuals = IntStream.range(0, numIndividuals)
                .filter(i -> knownOrigins[i] < UNKNOWN_ORIGIN || knownOrigins[i] > panel.numPopulations())
                .mapToObj(this.individualNames::get)
                .collect(Collectors.toList());
        if (!offendingIndividuals.isEmpty()) {
            throw new UserException.UnknownPopulation(offendingIndividuals, panel.numPopulations());
        }
        this.knownOrigins = IntStream.of(knownOrigins).map(o -> o - 1).toArray();
        unknownIndividuals = IntStream.range(0, numIndividuals).filter(i -> this.knownOrigins[i] < 0).toArray();

        family.validate(numIndividuals, panel);
        priors = new MixturePriorCollection(this.baselineCounts, layout, panel);

        nonzeroColumns = new int[numIndividuals][];
        nonzeroCounts = new int[numIndividuals][];
        for (int individual = 0; individual < numIndividuals; individual++) {
            final int[] row = this.mixtureCounts[individual];
            nonzeroColumns[individual] = IntStream.range(0, row.length).filter(c -> row[c] != 0).toArray();
            nonzeroCounts[individual] = IntStream.of(nonzeroColumns[individual]).map(c -> row[c]).toArray();
        }
        logger.info(String.format("Mixture of %d individuals (%d of unknown origin), %d loci, %d wild populations, %d hatcheries, %d reporting groups, family %s.",
                numIndividuals, unknownIndividuals.length, layout.numLoci(), panel.numWildPopulations(),
                panel.numHatcheries(), panel.numGroups(), family.getName()));
    }

    public List<String> getIndividualNames() {
        return individualNames;
    }

    public int numIndividuals() {
        return individualNames.size();
    }

    public LocusLayout getLayout() {
        return layout;
    }

    public PopulationPanel getPanel() {
        return panel;
    }

    public MixtureFamily getFamily() {
        return family;
    }

    public MixturePriorCollection getPriors() {
        return priors;
    }

    public int mixtureCount(final int individual, final int column) {
        return mixtureCounts[individual][column];
    }

    public int baselineCount(final int population, final int column) {
        return baselineCounts[population][column];
    }

    /** Whether the individual's origin is given and never resampled. */
    public boolean isKnownOrigin(final int individual) {
        return knownOrigins[individual] >= 0;
    }

    /** 0-based known origin of an individual, or -1. */
    public int knownOrigin(final int individual) {
        return knownOrigins[individual];
    }

    /** Indices of the individuals whose origin is resampled, in increasing order. */
    public int[] getUnknownIndividuals() {
        return unknownIndividuals.clone();
    }

    int[] nonzeroColumns(final int individual) {
        return nonzeroColumns[individual];
    }

    int[] nonzeroCounts(final int individual) {
        return nonzeroCounts[individual];
    }

    private static int[][] copyCounts(final int[][] counts, final LocusLayout layout, final String table) {
        final int[][] copy = new int[counts.length][];
        for (int row = 0; row < counts.length; row++) {
            if (counts[row] == null || counts[row].length != layout.numColumns()) {
                throw new UserException.BadInput(String.format("Row %d of the %s table does not have %d columns.",
                        row + 1, table, layout.numColumns()));
            }
            if (!MathUtils.allMatch(counts[row], c -> c >= 0)) {
                throw new UserException.BadInput(String.format("Row %d of the %s table has negative allele counts.", row + 1, table));
            }
            copy[row] = counts[row].clone();
        }
        return copy;
    }
}
