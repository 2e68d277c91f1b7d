package com.changesentinel.core.cost;

import com.changesentinel.core.error.InvalidInputException;
import com.changesentinel.core.error.InvalidParameterException;
import com.changesentinel.core.model.Series;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable cache of the sufficient statistics of a {@link Series}.
 *
 * <p>
 * Built once per series in a single pass (plus one sort), after which every
 * segment sum is answered in O(1) as a difference of two prefix entries. All
 * arrays are indexed by 1-based position with a zero sentinel at index 0, so
 * the sum over {@code [start, end]} is {@code prefix[end] - prefix[start - 1]}.
 * </p>
 *
 * <p>
 * The y-dependent prefixes accumulate deviations z = y &minus; {@link #getShift()}
 * from the series mean rather than raw values. Residual sums of squares taken
 * from raw Σy² lose every significant digit once the level dwarfs the noise;
 * the {@code centered*} accessors keep them exact for any constant offset.
 * The raw-scale accessors are reconstructed from the centered ones.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are never mutated after construction and may be shared freely
 * between threads and cost functions.
 * </p>
 *
 * @since 1.0.0
 */
public final class PreprocessedSeries {

    private final Series series;
    private final int n;
    private final double shift;

    private final double[] centeredSum;
    private final double[] centeredSumOfSquares;
    private final double[] sumOfT;
    private final double[] sumOfTSquared;
    private final double[] centeredSumOfTY;

    /** Ascending copy of the observations, zero-based. */
    private final double[] sorted;

    private PreprocessedSeries(Series series) {
        this.series = series;
        this.n = series.length();
        this.centeredSum = new double[n + 1];
        this.centeredSumOfSquares = new double[n + 1];
        this.sumOfT = new double[n + 1];
        this.sumOfTSquared = new double[n + 1];
        this.centeredSumOfTY = new double[n + 1];

        double[] values = series.toArray();
        double total = 0;
        for (double y : values) {
            total += y;
        }
        this.shift = total / n;

        for (int t = 1; t <= n; t++) {
            double z = values[t - 1] - shift;
            centeredSum[t] = centeredSum[t - 1] + z;
            centeredSumOfSquares[t] = centeredSumOfSquares[t - 1] + z * z;
            sumOfT[t] = sumOfT[t - 1] + t;
            sumOfTSquared[t] = sumOfTSquared[t - 1] + (double) t * t;
            centeredSumOfTY[t] = centeredSumOfTY[t - 1] + t * z;
        }

        Arrays.sort(values);
        this.sorted = values;
    }

    /**
     * @param series the series to preprocess; must not be {@code null}
     * @return the preprocessed view
     */
    public static PreprocessedSeries of(Series series) {
        return new PreprocessedSeries(Objects.requireNonNull(series, "Series must not be null"));
    }

    // ---------------------------------------------------------------
    // Segment statistics
    // ---------------------------------------------------------------

    /**
     * Validate a segment against this series.
     *
     * @throws InvalidInputException if {@code [start, end]} is empty or leaves
     *                               {@code [1, n]}
     */
    public void checkSegment(int start, int end) {
        if (start < 1 || end > n || start > end) {
            throw new InvalidInputException(
                    "Invalid segment [" + start + ", " + end + "] for series of length " + n);
        }
    }

    /** Σ z over {@code [start, end]}, z = y &minus; shift. */
    public double centeredSum(int start, int end) {
        checkSegment(start, end);
        return centeredSum[end] - centeredSum[start - 1];
    }

    /** Σ z² over {@code [start, end]}. */
    public double centeredSumOfSquares(int start, int end) {
        checkSegment(start, end);
        return centeredSumOfSquares[end] - centeredSumOfSquares[start - 1];
    }

    /** Σ t&middot;z over {@code [start, end]}. */
    public double centeredSumOfTY(int start, int end) {
        checkSegment(start, end);
        return centeredSumOfTY[end] - centeredSumOfTY[start - 1];
    }

    /** Σ y over {@code [start, end]}. */
    public double sum(int start, int end) {
        return centeredSum(start, end) + (end - start + 1) * shift;
    }

    /** Σ y² over {@code [start, end]}. */
    public double sumOfSquares(int start, int end) {
        return centeredSumOfSquares(start, end)
                + 2 * shift * centeredSum(start, end)
                + (end - start + 1) * shift * shift;
    }

    /** Σ t over {@code [start, end]}. */
    public double sumOfT(int start, int end) {
        checkSegment(start, end);
        return sumOfT[end] - sumOfT[start - 1];
    }

    /** Σ t² over {@code [start, end]}. */
    public double sumOfTSquared(int start, int end) {
        checkSegment(start, end);
        return sumOfTSquared[end] - sumOfTSquared[start - 1];
    }

    /** Σ t&middot;y over {@code [start, end]}. */
    public double sumOfTY(int start, int end) {
        return centeredSumOfTY(start, end) + shift * sumOfT(start, end);
    }

    public double mean(int start, int end) {
        return shift + centeredSum(start, end) / (end - start + 1);
    }

    // ---------------------------------------------------------------
    // Whole-series accessors
    // ---------------------------------------------------------------

    public Series getSeries() {
        return series;
    }

    public int length() {
        return n;
    }

    /**
     * @return the whole-series mean subtracted before accumulating
     */
    public double getShift() {
        return shift;
    }

    /**
     * @return copy of the observations in ascending order
     */
    public double[] sortedValues() {
        return sorted.clone();
    }

    /**
     * Build the prefix-count table the nonparametric cost needs for a grid of
     * {@code gridSize} quantiles.
     *
     * @param gridSize number of quantiles, &ge; 1
     * @return an immutable grid over this series
     * @throws InvalidParameterException if {@code gridSize < 1}
     */
    public QuantileGrid quantileGrid(int gridSize) {
        if (gridSize < 1) {
            throw new InvalidParameterException("Quantile grid size must be >= 1, got: " + gridSize);
        }
        return new QuantileGrid(series.toArray(), sorted, gridSize);
    }

    @Override
    public String toString() {
        return "PreprocessedSeries{n=" + n + '}';
    }
}
