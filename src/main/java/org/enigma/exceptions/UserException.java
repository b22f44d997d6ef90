package org.enigma.exceptions;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as inconsistent mixture and baseline tables
 * or origin labels that do not name a baseline population.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.BadInput
     * <p/>
     * For input tables whose shapes or values are inconsistent with each other
     */
    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message, final Throwable cause) {
            super(String.format("Bad input: %s", message), cause);
        }

        public BadInput(final String message) {
            super(String.format("Bad input: %s", message));
        }
    }

    /**
     * <p/>
     * Class UserException.UnknownPopulation
     * <p/>
     * For known-origin labels that fall outside of the baseline population space
     */
    public static class UnknownPopulation extends UserException {
        private static final long serialVersionUID = 0L;

        public UnknownPopulation(final Collection<String> offendingIndividuals, final int numPopulations) {
            super(String.format("Unidentified populations in known-origin labels for individuals [%s]; labels must lie in 1..%d. " +
                            "Maybe there are hatcheries in the data that are not listed in the reporting groups?",
                    offendingIndividuals.stream().collect(Collectors.joining(", ")), numPopulations));
        }
    }

    /**
     * <p/>
     * Class UserException.MissingHatcheries
     * <p/>
     * For reporting groups that reference hatcheries absent from the baseline
     */
    public static class MissingHatcheries extends UserException {
        private static final long serialVersionUID = 0L;

        public MissingHatcheries(final int numGroupedPopulations, final int numBaselinePopulations) {
            super(String.format("There were hatcheries (known populations) in the reporting groups, but no hatchery was found " +
                    "in the baseline data: %d populations are grouped but the baseline has %d.", numGroupedPopulations, numBaselinePopulations));
        }
    }

    /**
     * <p/>
     * Class UserException.AllChainsFailed
     * <p/>
     * Thrown when no chain of a run completes, so that there is nothing to summarize
     */
    public static class AllChainsFailed extends UserException {
        private static final long serialVersionUID = 0L;

        public AllChainsFailed(final Collection<String> chainFailures) {
            super(String.format("All %d chains failed: %s", chainFailures.size(), String.join("; ", chainFailures)));
        }
    }
}
