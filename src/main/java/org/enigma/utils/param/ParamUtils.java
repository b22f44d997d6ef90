package org.enigma.utils.param;

/**
 * Range checks for numeric parameters.
 */
public final class ParamUtils {
    private ParamUtils() {}

    /**
     * Checks that the  input is greater than zero and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static int isPositive(final int val, final String message) {
        if (!(val > 0)) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }
}
