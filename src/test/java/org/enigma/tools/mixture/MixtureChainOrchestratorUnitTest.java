package org.enigma.tools.mixture;

import org.enigma.exceptions.EnigmaException;
import org.enigma.exceptions.UserException;
import org.enigma.testutils.BaseTest;
import org.enigma.tools.mixture.family.MixtureFamily;
import org.enigma.tools.mixture.family.MultinomialFamily;
import org.enigma.tools.mixture.family.PathogenFamily;
import org.enigma.utils.mcmc.PosteriorSummary;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public final class MixtureChainOrchestratorUnitTest extends BaseTest {
    private static final int NUM_UNKNOWNS = 30;
    private static final int NUM_ITERATIONS = 50;
    private static final int NUM_BURN_IN = 10;

    /**
     * Genetic data only, except on the worker threads selected by name.
     */
    private static final class ThreadSelectiveFamily extends MixtureFamily {
        private final Predicate<String> threadSelector;
        private final boolean throwUnexpectedly;

        ThreadSelectiveFamily(final Predicate<String> threadSelector, final boolean throwUnexpectedly) {
            this.threadSelector = threadSelector;
            this.throwUnexpectedly = throwUnexpectedly;
        }

        @Override
        public String getName() {
            return "thread-selective";
        }

        @Override
        public void validate(final int numIndividuals, final PopulationPanel panel) {}

        @Override
        public double auxiliaryLikelihood(final int individual, final int population, final MixtureState state) {
            if (!threadSelector.test(Thread.currentThread().getName())) {
                return 1.;
            }
            if (throwUnexpectedly) {
                throw new IllegalStateException("unexpected failure");
            }
            return 0.;
        }
    }

    private static MixtureData northernMixture(final MixtureFamily family) {
        return MixtureTestUtils.mixture(MixtureTestUtils.repeatRows(MixtureTestUtils.FIRST_ALLELE, NUM_UNKNOWNS),
                MixtureTestUtils.threePopulationBaseline(), MixtureTestUtils.threePopulationPanel(), family);
    }

    @Test
    public void testEndToEnd() {
        final MixtureData data = northernMixture(new MultinomialFamily());
        final MixtureModelArgumentCollection arguments = MixtureTestUtils.arguments(NUM_ITERATIONS, NUM_BURN_IN, 1, 2);
        final MixtureResult result = new MixtureChainOrchestrator(data, arguments).run();

        Assert.assertEquals(result.getFamilyName(), MultinomialFamily.NAME);
        Assert.assertEquals(result.getSeed(), 1234L);
        Assert.assertTrue(result.getFailedChains().isEmpty());
        Assert.assertTrue(result.getInfectionProbabilities().isEmpty());

        final MixtureResult.TraceSummary groups = result.getGroupProportions();
        Assert.assertEquals(groups.getSummaries().keySet(), new LinkedHashSet<>(Arrays.asList("north", "south")));
        final PosteriorSummary north = groups.getSummary("north");
        log("Posterior of the northern proportion: " + north);
        Assert.assertTrue(north.mean() > 0.8);
        Assert.assertTrue(north.lower() <= north.median() && north.median() <= north.upper());
        Assert.assertTrue(north.potentialScaleReductionFactor().isPresent());
        Assert.assertEquals(groups.getSummary("south").mean(), 1. - north.mean(), 1e-9);
        Assert.assertTrue(groups.getMultivariatePotentialScaleReductionFactor().isPresent());

        final int numRecorded = NUM_ITERATIONS - NUM_BURN_IN;
        Assert.assertEquals(groups.getTrace().size(), 2 * numRecorded);
        for (int row = 0; row < groups.getTrace().size(); row++) {
            final MixtureResult.TraceRow traceRow = groups.getTrace().get(row);
            Assert.assertEquals(traceRow.getChain(), row < numRecorded ? 1 : 2);
            Assert.assertEquals(traceRow.getIteration(), row % numRecorded + 1);
            Assert.assertEquals(traceRow.getValues().length, 2);
        }

        Assert.assertEquals(result.getAssignmentTrace().size(), 2 * numRecorded);
        for (final MixtureResult.AssignmentTraceRow row : result.getAssignmentTrace()) {
            Assert.assertEquals(row.getOrigins().length, NUM_UNKNOWNS);
            //1-based, and never the southern population
            Assert.assertTrue(Arrays.stream(row.getOrigins()).allMatch(o -> o == 1 || o == 2));
        }
    }

    @Test
    public void testKeptBurnInIsTracedButNotSummarized() {
        final MixtureData data = northernMixture(new MultinomialFamily());
        final MixtureModelArgumentCollection arguments = MixtureTestUtils.arguments(NUM_ITERATIONS, NUM_BURN_IN, 2, 2);
        arguments.keepBurnIn = true;
        final MixtureResult result = new MixtureChainOrchestrator(data, arguments).run();

        final int numRecorded = NUM_ITERATIONS / 2;
        final int numRecordedBurnIn = NUM_BURN_IN / 2;
        final MixtureResult.TraceSummary groups = result.getGroupProportions();
        Assert.assertEquals(groups.getTrace().size(), 2 * numRecorded);
        Assert.assertEquals(result.getAssignmentTrace().size(), 2 * numRecorded);

        //recorded iteration i is sweep 2i, so the first NUM_BURN_IN / 2 rows of each chain belong to the burn-in
        final double[] southPastBurnIn = groups.getTrace().stream()
                .filter(row -> row.getIteration() > numRecordedBurnIn)
                .mapToDouble(row -> row.getValues()[1])
                .toArray();
        Assert.assertEquals(southPastBurnIn.length, 2 * (numRecorded - numRecordedBurnIn));
        Assert.assertEquals(groups.getSummary("south").mean(), Arrays.stream(southPastBurnIn).average().getAsDouble(), 1e-12);
    }

    @Test
    public void testSameSeedSameResult() {
        final MixtureData data = northernMixture(new MultinomialFamily());
        final MixtureModelArgumentCollection sequential = MixtureTestUtils.arguments(NUM_ITERATIONS, NUM_BURN_IN, 2, 3);
        sequential.numThreads = 1;
        final MixtureModelArgumentCollection parallel = MixtureTestUtils.arguments(NUM_ITERATIONS, NUM_BURN_IN, 2, 3);
        final MixtureResult first = new MixtureChainOrchestrator(data, sequential).run();
        final MixtureResult second = new MixtureChainOrchestrator(data, parallel).run();
        assertSameTraces(first, second);
    }

    @Test
    public void testDrawnSeedReproducesRun() {
        final MixtureData data = northernMixture(new MultinomialFamily());
        final MixtureModelArgumentCollection unseeded = MixtureTestUtils.arguments(20, 5, 1, 2);
        unseeded.seed = null;
        final MixtureResult first = new MixtureChainOrchestrator(data, unseeded).run();
        final MixtureModelArgumentCollection seeded = MixtureTestUtils.arguments(20, 5, 1, 2);
        seeded.seed = first.getSeed();
        assertSameTraces(first, new MixtureChainOrchestrator(data, seeded).run());
    }

    private static void assertSameTraces(final MixtureResult first, final MixtureResult second) {
        final int numRows = first.getGroupProportions().getTrace().size();
        Assert.assertEquals(second.getGroupProportions().getTrace().size(), numRows);
        for (int row = 0; row < numRows; row++) {
            Assert.assertEquals(second.getGroupProportions().getTrace().get(row).getValues(),
                    first.getGroupProportions().getTrace().get(row).getValues());
            Assert.assertEquals(second.getAssignmentTrace().get(row).getOrigins(),
                    first.getAssignmentTrace().get(row).getOrigins());
        }
    }

    @Test
    public void testChainSeedsAreDistinct() {
        final Set<Long> seeds = IntStream.rangeClosed(1, 100)
                .mapToObj(chainId -> MixtureChainOrchestrator.chainSeed(42L, chainId))
                .collect(Collectors.toSet());
        Assert.assertEquals(seeds.size(), 100);
        Assert.assertEquals(MixtureChainOrchestrator.chainSeed(42L, 3), MixtureChainOrchestrator.chainSeed(42L, 3));
    }

    @Test
    public void testPathogenRun() {
        final int[] statuses = IntStream.range(0, NUM_UNKNOWNS).map(i -> i % 5 == 0 ? PathogenFamily.MISSING : i % 2).toArray();
        final int[] strata = IntStream.range(0, NUM_UNKNOWNS).map(i -> i < NUM_UNKNOWNS / 2 ? 1 : 2).toArray();
        final PopulationPanel panel = MixtureTestUtils.threePopulationPanel();
        final MixtureData data = new MixtureData(MixtureTestUtils.individualNames(NUM_UNKNOWNS),
                MixtureTestUtils.repeatRows(MixtureTestUtils.FIRST_ALLELE, NUM_UNKNOWNS),
                MixtureTestUtils.threePopulationBaseline(), MixtureTestUtils.ONE_DIALLELIC_LOCUS, panel,
                new PathogenFamily(panel, statuses, strata));
        final MixtureModelArgumentCollection arguments = MixtureTestUtils.arguments(NUM_ITERATIONS, NUM_BURN_IN, 1, 2);
        arguments.conditionalGsi = false;
        arguments.numAdaptation = 10;
        final MixtureResult result = new MixtureChainOrchestrator(data, arguments).run();

        Assert.assertEquals(result.getFamilyName(), PathogenFamily.NAME);
        Assert.assertEquals(result.getInfectionProbabilities().size(), 2);
        for (final MixtureResult.TraceSummary stratum : result.getInfectionProbabilities()) {
            Assert.assertEquals(stratum.getSummaries().size(), 2);
            Assert.assertEquals(stratum.getTrace().size(), 2 * (NUM_ITERATIONS - NUM_BURN_IN));
            final PosteriorSummary north = stratum.getSummary("north");
            Assert.assertTrue(north.mean() > 0. && north.mean() < 1.);
        }
    }

    @Test
    public void testFailedChainIsIsolated() {
        //the pool starts one thread per chain, in submission order, so chain 1 runs on the first thread
        final MixtureData data = northernMixture(new ThreadSelectiveFamily(name -> name.equals("enigma-chain-0"), false));
        final MixtureModelArgumentCollection arguments = MixtureTestUtils.arguments(NUM_ITERATIONS, NUM_BURN_IN, 1, 3);
        final MixtureResult result = new MixtureChainOrchestrator(data, arguments).run();
        Assert.assertEquals(result.getFailedChains().keySet(), Collections.singleton(1));
        Assert.assertTrue(result.getFailedChains().get(1).startsWith("Chain 1 failed at iteration 1"));
        final Set<Integer> summarizedChains = result.getGroupProportions().getTrace().stream()
                .map(MixtureResult.TraceRow::getChain).collect(Collectors.toSet());
        Assert.assertEquals(summarizedChains, new HashSet<>(Arrays.asList(2, 3)));
    }

    @Test(expectedExceptions = UserException.AllChainsFailed.class)
    public void testAllChainsFailed() {
        final MixtureData data = northernMixture(new ThreadSelectiveFamily(name -> name.startsWith("enigma-chain-"), false));
        new MixtureChainOrchestrator(data, MixtureTestUtils.arguments(NUM_ITERATIONS, NUM_BURN_IN, 1, 2)).run();
    }

    @Test
    public void testUnexpectedChainErrorIsRethrown() {
        final MixtureData data = northernMixture(new ThreadSelectiveFamily(name -> name.startsWith("enigma-chain-"), true));
        try {
            new MixtureChainOrchestrator(data, MixtureTestUtils.arguments(NUM_ITERATIONS, NUM_BURN_IN, 1, 2)).run();
            Assert.fail("Expected the run to fail.");
        } catch (final EnigmaException e) {
            Assert.assertFalse(e instanceof EnigmaException.ChainFailure);
            Assert.assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }
}
