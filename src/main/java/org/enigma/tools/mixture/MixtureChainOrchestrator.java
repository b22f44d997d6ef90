package org.enigma.tools.mixture;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.enigma.exceptions.EnigmaException;
import org.enigma.exceptions.UserException;
import org.enigma.utils.Utils;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;

/**
 * Runs independent chains of the mixture model on a fixed pool of worker threads and assembles their samples.
 *
 * <p>The initial state is drawn once, from a generator seeded with the run seed, and shared by all chains.  Chain i
 * then samples with its own generator, seeded from the run seed and i, so a run is reproducible from its seed and
 * chain count whatever the number of threads.  A chain whose sampling distribution degenerates is reported as
 * failed; the other chains are unaffected.</p>
 */
public final class MixtureChainOrchestrator {
    private static final Logger logger = LogManager.getLogger(MixtureChainOrchestrator.class);

    private static final long CHAIN_SEED_INCREMENT = 0x9E3779B97F4A7C15L;

    private final MixtureData data;
    private final MixtureModelArgumentCollection arguments;

    public MixtureChainOrchestrator(final MixtureData data, final MixtureModelArgumentCollection arguments) {
        this.data = Utils.nonNull(data);
        this.arguments = Utils.nonNull(arguments);
        arguments.validate();
    }

    /**
     * Runs all chains and waits for every one of them.
     * @throws UserException.AllChainsFailed if no chain completes
     */
    public MixtureResult run() {
        final Instant start = Instant.now();
        final long seed = arguments.seed != null ? arguments.seed : new SecureRandom().nextLong();
        logger.info(String.format("Running %d chains of the %s mixture model (%s) with seed %d.",
                arguments.numChains, data.getFamily().getName(),
                arguments.conditionalGsi ? "conditional GSI" : "fully Bayesian", seed));

        final MixtureState initialState = MixtureModeller.initializeState(data, createRandomGenerator(seed));
        final MixtureModeller modeller = new MixtureModeller(data, initialState, arguments);

        final ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("enigma-chain-%d")
                .setDaemon(true).build();
        final ExecutorService executorService = Executors.newFixedThreadPool(arguments.effectiveNumThreads(), threadFactory);
        final List<MixtureChainSamples> completedChains = new ArrayList<>();
        final Map<Integer, String> failedChains = new LinkedHashMap<>();
        try {
            final List<Future<MixtureChainSamples>> futures = new ArrayList<>(arguments.numChains);
            for (int chainId = 1; chainId <= arguments.numChains; chainId++) {
                final int id = chainId;
                final RandomGenerator chainRng = createRandomGenerator(chainSeed(seed, id));
                futures.add(executorService.submit(() -> modeller.fitMCMC(id, chainRng)));
            }
            for (int i = 0; i < futures.size(); i++) {
                final int chainId = i + 1;
                try {
                    completedChains.add(futures.get(i).get());
                } catch (final ExecutionException e) {
                    if (e.getCause() instanceof EnigmaException.ChainFailure) {
                        logger.error(e.getCause().getMessage());
                        failedChains.put(chainId, e.getCause().getMessage());
                    } else {
                        throw new EnigmaException("Chain " + chainId + " terminated unexpectedly.", e.getCause());
                    }
                }
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EnigmaException("Interrupted while waiting for chains to finish.", e);
        } finally {
            executorService.shutdownNow();
        }

        if (completedChains.isEmpty()) {
            throw new UserException.AllChainsFailed(new ArrayList<>(failedChains.values()));
        }
        if (!failedChains.isEmpty()) {
            logger.warn(String.format("%d of %d chains failed; summarizing chains %s.", failedChains.size(), arguments.numChains,
                    completedChains.stream().map(c -> String.valueOf(c.getChainId())).reduce((a, b) -> a + ", " + b).orElse("")));
        }
        final Duration runTime = Duration.between(start, Instant.now());
        final MixtureResult result = MixtureResultAssembler.assemble(data, completedChains,
                arguments.numRecordedBurnInSamples(), failedChains, seed, runTime);
        logger.info(String.format("Mixture model completed in %.1f seconds.", runTime.toMillis() / 1000.));
        return result;
    }

    /**
     * Seed of the random stream of a chain; distinct chains of a run get distinct seeds.
     * @param chainId   1-based chain id
     */
    static long chainSeed(final long runSeed, final int chainId) {
        return new Random(runSeed + chainId * CHAIN_SEED_INCREMENT).nextLong();
    }

    private static RandomGenerator createRandomGenerator(final long seed) {
        return RandomGeneratorFactory.createRandomGenerator(new Random(seed));
    }
}
