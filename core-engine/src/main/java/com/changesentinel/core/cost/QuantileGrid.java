package com.changesentinel.core.cost;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.Arrays;

/**
 * Quantile grid and per-quantile prefix counts for the empirical-CDF cost.
 *
 * <p>
 * The K grid points are quantiles of the whole series at the exponentially
 * spaced probabilities of Haynes, Fearnhead &amp; Eckley (2017):
 * p<sub>k</sub> = 1 / (1 + (2n&minus;1)&middot;exp(c(2k&minus;1)/K)) with
 * c = &minus;log(2n&minus;1), which concentrates grid points in the tails.
 * </p>
 *
 * <p>
 * For every grid point the table stores, per prefix, twice the number of
 * observations strictly below it plus the number equal to it. The segment
 * CDF with the half-weight tie correction is then one subtraction and a
 * division away.
 * </p>
 *
 * @since 1.0.0
 */
public final class QuantileGrid {

    private final double[] quantiles;

    /** {@code doubledCounts[k][t]}: 2·#{i ≤ t : y_i < q_k} + #{i ≤ t : y_i = q_k}. */
    private final int[][] doubledCounts;

    QuantileGrid(double[] values, double[] sorted, int gridSize) {
        int n = values.length;
        this.quantiles = gridQuantiles(sorted, gridSize);
        this.doubledCounts = new int[gridSize][n + 1];

        for (int t = 1; t <= n; t++) {
            double y = values[t - 1];
            int firstAtLeast = lowerBound(quantiles, y);
            int firstAbove = upperBound(quantiles, y);
            for (int k = 0; k < gridSize; k++) {
                int increment = k >= firstAbove ? 2 : (k >= firstAtLeast ? 1 : 0);
                doubledCounts[k][t] = doubledCounts[k][t - 1] + increment;
            }
        }
    }

    private static double[] gridQuantiles(double[] sorted, int gridSize) {
        int n = sorted.length;
        double c = -Math.log(2.0 * n - 1);
        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        percentile.setData(sorted);

        double[] grid = new double[gridSize];
        for (int k = 1; k <= gridSize; k++) {
            double p = 1.0 / (1.0 + (2.0 * n - 1) * Math.exp(c / gridSize * (2.0 * k - 1)));
            grid[k - 1] = percentile.evaluate(100.0 * p);
        }
        // interpolation can lose monotonicity in the last ulp
        for (int k = 1; k < gridSize; k++) {
            grid[k] = Math.max(grid[k], grid[k - 1]);
        }
        return grid;
    }

    // first index with quantiles[k] >= y
    private static int lowerBound(double[] a, double y) {
        int lo = 0;
        int hi = a.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (a[mid] < y) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    // first index with quantiles[k] > y
    private static int upperBound(double[] a, double y) {
        int lo = 0;
        int hi = a.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (a[mid] <= y) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    public int size() {
        return quantiles.length;
    }

    public double quantile(int k) {
        return quantiles[k];
    }

    public double[] quantiles() {
        return quantiles.clone();
    }

    /**
     * Empirical CDF of segment {@code [start, end]} at grid point {@code k},
     * counting ties with weight one half.
     */
    public double cdf(int k, int start, int end) {
        int[] counts = doubledCounts[k];
        return (counts[end] - counts[start - 1]) / (2.0 * (end - start + 1));
    }

    @Override
    public String toString() {
        return "QuantileGrid" + Arrays.toString(quantiles);
    }
}
