package org.enigma.utils;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;

import java.util.function.DoubleUnaryOperator;
import java.util.function.IntPredicate;
import java.util.function.DoublePredicate;

/**
 * MathUtils is a static class (no instantiation allowed!) with some useful math methods.
 */
public final class MathUtils {

    private static final double ROOT_TWO_PI = Math.sqrt(2.0 * Math.PI);

    /**
     * Private constructor.  No instantiating this class!
     */
    private MathUtils() { }

    public static double sum(final double[] values) {
        Utils.nonNull(values);
        double s = 0.0;
        for (double v : values)
            s += v;
        return s;
    }

    public static double square(final double x) {
        return x * x;
    }

    /**
     * Given an array of log space values, subtract all values by the array maximum so that the max element in log space
     * is zero.  This is equivalent to dividing by the maximum element in real space and is useful for avoiding underflow/overflow
     * when the array's values matter only up to an arbitrary normalizing factor, for example, an array of likelihoods.
     *
     * @param array
     * @return the scaled-in-place array
     */
    public static double[] scaleLogSpaceArrayForNumericalStability(final double[] array) {
        Utils.nonNull(array);
        final double maxValue = arrayMax(array);
        return applyToArrayInPlace(array, x -> x - maxValue);
    }

    public static int maxElementIndex(final double[] array) {
        Utils.nonNull(array);
        Utils.validateArg(array.length > 0, "array may not be empty");
        int maxI = 0;
        for (int i = 1; i < array.length; i++) {
            if (array[i] > array[maxI])
                maxI = i;
        }
        return maxI;
    }

    public static double arrayMax(final double[] array) {
        Utils.nonNull(array);
        return array[maxElementIndex(array)];
    }

    public static int arrayMax(final int[] array) {
        Utils.nonNull(array);
        Utils.validateArg(array.length > 0, "array may not be empty");
        int max = array[0];
        for (final int value : array) {
            max = Math.max(max, value);
        }
        return max;
    }

    /**
     * Samples an index of {@code weights} with probability proportional to its weight.
     * The weights need not be normalized, but must be non-negative and have a positive finite sum.
     */
    public static int sampleIndexProportionally(final double[] weights, final RandomGenerator rng) {
        Utils.nonNull(weights);
        Utils.nonNull(rng);
        final double total = sum(weights);
        Utils.validateArg(total > 0 && Double.isFinite(total), () -> "Weights must have a positive finite sum, found " + total);
        final double target = rng.nextDouble() * total;
        double cumulative = 0.;
        int lastPositive = -1;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] > 0) {
                cumulative += weights[i];
                lastPositive = i;
                if (target < cumulative) {
                    return i;
                }
            }
        }
        //round-off can leave target just past the running sum
        return lastPositive;
    }

    /**
     * Computes the density of a normal distribution with the given mean and standard deviation at x.
     */
    public static double normalDistribution(final double mean, final double sd, final double x) {
        Utils.validateArg(sd >= 0, "sd: Standard deviation of normal must be >= 0");
        if ( ! wellFormedDouble(mean) || ! wellFormedDouble(sd) || ! wellFormedDouble(x))
            throw new IllegalArgumentException("mean, sd, or, x : Normal parameters must be well formatted (non-INF, non-NAN)");
        return FastMath.exp(-(x - mean) * (x - mean) / (2.0 * sd * sd)) / (sd * ROOT_TWO_PI);
    }

    public static boolean wellFormedDouble(final double val) {
        return !Double.isInfinite(val) && !Double.isNaN(val);
    }

    /**
     * The following method implements Arrays.stream(array).map(func).toArray(), which is concise but performs poorly due
     * to the overhead of creating a stream, especially with small arrays.  Thus we wrap the wordy but fast array code
     * in the following method which permits concise Java 8 code.
     *
     * Returns a new array -- the original array in not modified.
     *
     * This method has been benchmarked and performs as well as array-only code.
     */
    public static double[] applyToArray(final double[] array, final DoubleUnaryOperator func) {
        Utils.nonNull(func);
        Utils.nonNull(array);
        final double[] result = new double[array.length];
        for (int m = 0; m < result.length; m++) {
            result[m] = func.applyAsDouble(array[m]);
        }
        return result;
    }

    /**
     * The following method implements Arrays.stream(array).map(func).toArray(), which is concise but performs poorly due
     * to the overhead of creating a stream, especially with small arrays.  Thus we wrap the wordy but fast array code
     * in the following method which permits concise Java 8 code.
     *
     * The original array is modified in place.
     *
     * This method has been benchmarked and performs as well as array-only code.
     */
    public static double[] applyToArrayInPlace(final double[] array, final DoubleUnaryOperator func) {
        Utils.nonNull(array);
        Utils.nonNull(func);
        for (int m = 0; m < array.length; m++) {
            array[m] = func.applyAsDouble(array[m]);
        }
        return array;
    }

    /**
     * Test whether all elements of a double[] array satisfy a double -> boolean predicate
     */
    public static boolean allMatch(final double[] array, final DoublePredicate pred) {
        Utils.nonNull(array);
        Utils.nonNull(pred);
        for (final double x : array) {
            if (!pred.test(x)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Test whether all elements of an int[] array satisfy an int -> boolean predicate
     */
    public static boolean allMatch(final int[] array, final IntPredicate pred) {
        Utils.nonNull(array);
        Utils.nonNull(pred);
        for (final int x : array) {
            if (!pred.test(x)) {
                return false;
            }
        }
        return true;
    }
}
