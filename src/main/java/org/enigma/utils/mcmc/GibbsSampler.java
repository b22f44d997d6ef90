package org.enigma.utils.mcmc;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.enigma.utils.Utils;
import org.enigma.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Implements Gibbs sampling of a multivariate probability density function by repeatedly sweeping a
 * {@link ParameterizedModel}.
 *
 * Iterations are numbered 1..numSamples.  Iteration i is retained if i > numBurnIn and
 * (i - numBurnIn) is a multiple of the thinning interval, so floor((numSamples - numBurnIn) / thinningInterval)
 * samples are retained.  The initial state is never retained.
 */
public final class GibbsSampler<V extends Enum<V> & ParameterEnum, S extends ParameterizedState<V>, T extends DataCollection> {
    private static final Logger logger = LogManager.getLogger(GibbsSampler.class);
    private static final int NUMBER_OF_SAMPLES_PER_LOG_ENTRY = 25;

    private final int numSamples;
    private final int numBurnIn;
    private final int thinningInterval;
    private int numSamplesPerLogEntry;
    private String description = "MCMC";

    private final ParameterizedModel<V, S, T> model;

    private final List<S> samples = new ArrayList<>();
    private int numSamplesGenerated = 0;

    /**
     * Constructs a GibbsSampler that retains every sample after the burn-in.
     * @param numSamples    total number of samples; must be positive
     * @param model         {@link ParameterizedModel} to be sampled
     */
    public GibbsSampler(final int numSamples, final ParameterizedModel<V, S, T> model) {
        this(numSamples, 0, 1, model);
    }

    /**
     * @param numSamples        total number of samples, including burn-in; must be positive
     * @param numBurnIn         number of leading samples to discard; must be in [0, numSamples)
     * @param thinningInterval  retain every {@code thinningInterval}-th sample after burn-in; must be positive
     * @param model             {@link ParameterizedModel} to be sampled
     */
    public GibbsSampler(final int numSamples, final int numBurnIn, final int thinningInterval,
                        final ParameterizedModel<V, S, T> model) {
        ParamUtils.isPositive(numSamples, "Number of samples must be positive.");
        Utils.validateArg(0 <= numBurnIn && numBurnIn < numSamples,
                "Number of burn-in samples must be non-negative and strictly less than total number of samples.");
        ParamUtils.isPositive(thinningInterval, "Thinning interval must be positive.");
        this.numSamples = numSamples;
        this.numBurnIn = numBurnIn;
        this.thinningInterval = thinningInterval;
        this.numSamplesPerLogEntry = NUMBER_OF_SAMPLES_PER_LOG_ENTRY;
        this.model = Utils.nonNull(model);
    }

    /**
     * Changes the number of samples per log entry.
     * @param numSamplesPerLogEntry number of samples per log entry; must be positive
     */
    public void setNumSamplesPerLogEntry(final int numSamplesPerLogEntry) {
        ParamUtils.isPositive(numSamplesPerLogEntry, "Number of samples per log entry must be positive.");
        this.numSamplesPerLogEntry = numSamplesPerLogEntry;
    }

    /**
     * Changes the prefix of progress log entries, e.g. to tell apart chains running concurrently.
     */
    public void setDescription(final String description) {
        this.description = Utils.nonNull(description);
    }

    /**
     * Runs the Markov Chain Monte Carlo from the current state of the model.
     * Progress is logged according to {@code numSamplesPerLogEntry}.
     * @param rng   source of all randomness of the run
     * @throws IllegalStateException if the sampler has already been run
     */
    public void runMCMC(final RandomGenerator rng) {
        Utils.nonNull(rng);
        Utils.validate(numSamplesGenerated == 0, "MCMC sampling has already been run.");
        logger.info(description + ": starting MCMC sampling.");
        for (int sample = 1; sample <= numSamples; sample++) {
            model.update(rng);
            numSamplesGenerated = sample;
            if (sample > numBurnIn && (sample - numBurnIn) % thinningInterval == 0) {
                samples.add(model.state());
            }
            if (sample % numSamplesPerLogEntry == 0) {
                logger.info(description + ": " + sample + " of " + numSamples + " samples generated.");
            }
        }
        logger.info(description + ": MCMC sampling complete.");
    }

    /**
     * Returns the number of sweeps completed so far.  If a sweep throws, this is the number of the last
     * successful sweep.
     */
    public int getNumSamplesGenerated() {
        return numSamplesGenerated;
    }

    /**
     * Returns the state after the last completed sweep.
     */
    public S getCurrentState() {
        return model.state();
    }

    /**
     * Returns the retained states.
     */
    public List<S> getSamples() {
        Utils.validate(numSamplesGenerated == numSamples, "MCMC sampling has not been run to completion.");
        return Collections.unmodifiableList(samples);
    }

    /**
     * Returns the retained samples of a specified model parameter.
     * @param parameterName         name of parameter
     * @param parameterValueClass   class of parameter value
     * @param <U>                   type of parameter value
     * @return                      List of parameter samples
     */
    public <U> List<U> getSamples(final V parameterName, final Class<U> parameterValueClass) {
        return getSamples().stream().map(s -> s.get(parameterName, parameterValueClass)).collect(Collectors.toList());
    }
}
