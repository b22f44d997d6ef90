package org.enigma.tools.mixture;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineException;

import java.io.Serializable;

/**
 * Run parameters of the mixture-model MCMC.
 */
public final class MixtureModelArgumentCollection implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String NUM_ITERATIONS_LONG_NAME = "num-iterations";
    public static final String NUM_BURN_IN_LONG_NAME = "num-burn-in";
    public static final String THINNING_INTERVAL_LONG_NAME = "thin";
    public static final String NUM_CHAINS_LONG_NAME = "num-chains";
    public static final String NUM_ADAPTATION_LONG_NAME = "num-adaptation";
    public static final String KEEP_BURN_IN_LONG_NAME = "keep-burn-in";
    public static final String CONDITIONAL_GSI_LONG_NAME = "conditional-gsi";
    public static final String SEED_LONG_NAME = "seed";
    public static final String NUM_THREADS_LONG_NAME = "num-threads";
    public static final String LOG_INTERVAL_LONG_NAME = "log-interval";

    @Argument(
            doc = "Total number of iterations per chain after adaptation, including burn-in.",
            fullName = NUM_ITERATIONS_LONG_NAME,
            minValue = 1
    )
    public Integer numIterations;

    @Argument(
            doc = "Number of leading iterations treated as burn-in.",
            fullName = NUM_BURN_IN_LONG_NAME,
            minValue = 0
    )
    public Integer numBurnIn;

    @Argument(
            doc = "Record every n-th iteration after burn-in.",
            fullName = THINNING_INTERVAL_LONG_NAME,
            minValue = 1
    )
    public Integer thinningInterval;

    @Argument(
            doc = "Number of independent chains.",
            fullName = NUM_CHAINS_LONG_NAME,
            minValue = 1
    )
    public Integer numChains;

    @Argument(
            doc = "Number of adaptation iterations run before sampling, with allele frequencies held fixed. " +
                    "Ignored in conditional-GSI mode.",
            fullName = NUM_ADAPTATION_LONG_NAME,
            minValue = 0,
            optional = true
    )
    public int numAdaptation = 0;

    @Argument(
            doc = "If true, burn-in iterations are recorded along with the rest.  They appear in the traces but are " +
                    "left out of the posterior summaries and convergence diagnostics.",
            fullName = KEEP_BURN_IN_LONG_NAME,
            optional = true
    )
    public boolean keepBurnIn = false;

    @Argument(
            doc = "If true, baseline allele frequencies are fixed at their posterior mean given the baseline (conditional GSI); " +
                    "otherwise they are sampled jointly with the mixture (fully Bayesian).",
            fullName = CONDITIONAL_GSI_LONG_NAME,
            optional = true
    )
    public boolean conditionalGsi = true;

    @Argument(
            doc = "Seed of the run.  The seed of each chain is derived from it.  If not given, a seed is drawn and logged.",
            fullName = SEED_LONG_NAME,
            optional = true
    )
    public Long seed = null;

    @Argument(
            doc = "Number of worker threads.  Defaults to the number of chains.",
            fullName = NUM_THREADS_LONG_NAME,
            minValue = 1,
            optional = true
    )
    public Integer numThreads = null;

    @Argument(
            doc = "Number of iterations between progress log entries of a chain.",
            fullName = LOG_INTERVAL_LONG_NAME,
            minValue = 1,
            optional = true
    )
    public int logInterval = 100;

    /**
     * Number of adaptation iterations actually run: none in conditional-GSI mode.
     */
    public int effectiveNumAdaptation() {
        return conditionalGsi ? 0 : numAdaptation;
    }

    /**
     * Number of burn-in iterations that are not recorded.
     */
    public int effectiveNumBurnIn() {
        return keepBurnIn ? 0 : numBurnIn;
    }

    /**
     * Number of recorded iterations per chain.
     */
    public int numRetainedSamples() {
        return (numIterations - effectiveNumBurnIn()) / thinningInterval;
    }

    /**
     * Number of leading recorded iterations per chain that fall within the burn-in.  These are traced but not summarized.
     */
    public int numRecordedBurnInSamples() {
        return keepBurnIn ? numBurnIn / thinningInterval : 0;
    }

    /**
     * Number of recorded iterations per chain that enter the posterior summaries.
     */
    public int numSummarizedSamples() {
        return numRetainedSamples() - numRecordedBurnInSamples();
    }

    public int effectiveNumThreads() {
        return numThreads == null ? numChains : Math.min(numThreads, numChains);
    }

    /**
     * @throws CommandLineException.BadArgumentValue if the arguments are inconsistent
     */
    public void validate() {
        requirePresent(numIterations, NUM_ITERATIONS_LONG_NAME);
        requirePresent(numBurnIn, NUM_BURN_IN_LONG_NAME);
        requirePresent(thinningInterval, THINNING_INTERVAL_LONG_NAME);
        requirePresent(numChains, NUM_CHAINS_LONG_NAME);
        if (numIterations <= 0) {
            throw new CommandLineException.BadArgumentValue(NUM_ITERATIONS_LONG_NAME, String.valueOf(numIterations), "should be a positive number");
        }
        if (numBurnIn < 0 || numBurnIn >= numIterations) {
            throw new CommandLineException.BadArgumentValue(NUM_BURN_IN_LONG_NAME, String.valueOf(numBurnIn),
                    "should be non-negative and less than " + NUM_ITERATIONS_LONG_NAME);
        }
        if (thinningInterval <= 0) {
            throw new CommandLineException.BadArgumentValue(THINNING_INTERVAL_LONG_NAME, String.valueOf(thinningInterval), "should be a positive number");
        }
        if (numChains <= 0) {
            throw new CommandLineException.BadArgumentValue(NUM_CHAINS_LONG_NAME, String.valueOf(numChains), "should be a positive number");
        }
        if (numAdaptation < 0) {
            throw new CommandLineException.BadArgumentValue(NUM_ADAPTATION_LONG_NAME, String.valueOf(numAdaptation), "should be non-negative");
        }
        if (numThreads != null && numThreads <= 0) {
            throw new CommandLineException.BadArgumentValue(NUM_THREADS_LONG_NAME, String.valueOf(numThreads), "should be a positive number");
        }
        if (logInterval <= 0) {
            throw new CommandLineException.BadArgumentValue(LOG_INTERVAL_LONG_NAME, String.valueOf(logInterval), "should be a positive number");
        }
        if (numSummarizedSamples() <= 0) {
            throw new CommandLineException.BadArgumentValue(THINNING_INTERVAL_LONG_NAME, String.valueOf(thinningInterval),
                    String.format("no iteration past the burn-in would be recorded with %d iterations and %d burn-in", numIterations, numBurnIn));
        }
    }

    private static void requirePresent(final Integer value, final String name) {
        if (value == null) {
            throw new CommandLineException.MissingArgument(name, "Argument --" + name + " is required.");
        }
    }
}
