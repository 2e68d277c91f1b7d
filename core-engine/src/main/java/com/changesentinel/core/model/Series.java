package com.changesentinel.core.model;

import com.changesentinel.core.error.InvalidInputException;
import com.changesentinel.core.error.InvalidParameterException;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Immutable, ordered sequence of real-valued observations.
 *
 * <p>
 * Positions are addressed with 1-based indices throughout the engine, so the
 * first observation is {@code valueAt(1)} and the last is
 * {@code valueAt(length())}.
 * </p>
 *
 * <p>
 * A series may carry a known noise variance &sigma;&sup2;. Cost functions and
 * the CUSUM engine use it as their scale; when absent they assume unit
 * variance.
 * </p>
 *
 * @since 1.0.0
 */
public final class Series implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Shortest series any operation accepts. */
    public static final int MIN_LENGTH = 2;

    private final double[] values;
    private final double knownVariance;
    private final boolean varianceKnown;

    private Series(double[] values, double knownVariance, boolean varianceKnown) {
        Objects.requireNonNull(values, "Series values must not be null");
        if (values.length < MIN_LENGTH) {
            throw new InvalidInputException(
                    "Series must contain at least " + MIN_LENGTH + " observations, got: " + values.length);
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new InvalidInputException(
                        "Series value at position " + (i + 1) + " is not finite: " + values[i]);
            }
        }
        if (varianceKnown && !(knownVariance > 0 && Double.isFinite(knownVariance))) {
            throw new InvalidParameterException("Known variance must be > 0, got: " + knownVariance);
        }
        this.values = values.clone();
        this.knownVariance = knownVariance;
        this.varianceKnown = varianceKnown;
    }

    /**
     * @param values observations in time order; copied
     * @return a series with unknown noise variance
     * @throws InvalidInputException if fewer than two values are given or any
     *                               value is not finite
     */
    public static Series of(double... values) {
        return new Series(values, Double.NaN, false);
    }

    /**
     * @param values   observations in time order; copied
     * @param variance known noise variance &sigma;&sup2;, must be &gt; 0
     * @return a series carrying its noise variance
     */
    public static Series withKnownVariance(double[] values, double variance) {
        return new Series(values, variance, true);
    }

    public int length() {
        return values.length;
    }

    /**
     * @param t 1-based position
     * @return the observation at {@code t}
     */
    public double valueAt(int t) {
        if (t < 1 || t > values.length) {
            throw new InvalidInputException("Position " + t + " outside [1, " + values.length + "]");
        }
        return values[t - 1];
    }

    /**
     * @return a copy of the observations, zero-based
     */
    public double[] toArray() {
        return values.clone();
    }

    public OptionalDouble getKnownVariance() {
        return varianceKnown ? OptionalDouble.of(knownVariance) : OptionalDouble.empty();
    }

    /**
     * @return the known variance, or {@code 1.0} when none was supplied
     */
    public double varianceOrUnit() {
        return varianceKnown ? knownVariance : 1.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Series that))
            return false;
        return varianceKnown == that.varianceKnown
                && Double.compare(knownVariance, that.knownVariance) == 0
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + Double.hashCode(knownVariance);
    }

    @Override
    public String toString() {
        return "Series{n=" + values.length
                + (varianceKnown ? ", variance=" + knownVariance : "")
                + '}';
    }
}
