package org.enigma.exceptions;

/**
 * <p/>
 * Class EnigmaException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class EnigmaException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public EnigmaException(final String msg) {
        super(msg);
    }

    public EnigmaException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    /*
      Subtypes of EnigmaException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends EnigmaException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException(final String s) {
            super(s);
        }
        public ShouldNeverReachHereException(final String s, final Throwable throwable) {
            super(s, throwable);
        }
        public ShouldNeverReachHereException(final Throwable throwable) {this("Should never reach here.", throwable);}
    }

    /**
     * <p/>
     * Raised inside a single Markov chain when its sampling distribution degenerates
     * (non-finite likelihoods or all-zero categorical weights).  Only the chain that raised it is abandoned.
     */
    public static class ChainFailure extends EnigmaException {
        private static final long serialVersionUID = 0L;

        private final int chainId;
        private final int iteration;

        public ChainFailure(final int chainId, final int iteration, final String message) {
            super(String.format("Chain %d failed at iteration %d: %s", chainId, iteration, message));
            this.chainId = chainId;
            this.iteration = iteration;
        }

        public ChainFailure(final int chainId, final int iteration, final Throwable cause) {
            super(String.format("Chain %d failed at iteration %d: %s", chainId, iteration, cause.getMessage()), cause);
            this.chainId = chainId;
            this.iteration = iteration;
        }

        public int getChainId() {
            return chainId;
        }

        public int getIteration() {
            return iteration;
        }
    }

    /**
     * <p/>
     * Raised by a sampler when a categorical draw has no valid weights; the chain wraps it in a {@link ChainFailure}
     * once the iteration is known.
     */
    public static class DegenerateSamplingDistribution extends EnigmaException {
        private static final long serialVersionUID = 0L;

        public DegenerateSamplingDistribution(final String message) {
            super(message);
        }
    }
}
