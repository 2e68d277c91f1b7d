package com.changesentinel.core.detection;

import com.changesentinel.core.cost.PreprocessedSeries;
import com.changesentinel.core.error.InvalidInputException;
import com.changesentinel.core.error.InvalidParameterException;
import com.changesentinel.core.model.SingleChangeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Single-changepoint CUSUM / likelihood-ratio test for a change in mean.
 *
 * <p>
 * For every split &tau; = 1 &hellip; n&minus;1 the engine computes
 * </p>
 *
 * <pre>
 *   C_tau = sqrt(tau (n - tau) / n) * |mean(y[1..tau]) - mean(y[tau+1..n])| / sigma
 * </pre>
 *
 * <p>
 * from the prefix sums of a {@link PreprocessedSeries} in one forward sweep,
 * tracking the running maximum as it goes. For a Gaussian series with known
 * variance C<sub>&tau;</sub>&sup2; is exactly the likelihood-ratio statistic
 * for a single mean change at &tau;, and also the gain the MEAN cost reports
 * for splitting there.
 * </p>
 *
 * <p>
 * A change is declared when C<sub>max</sub>&sup2; exceeds the threshold.
 * Ties in the maximum resolve to the smallest &tau;.
 * </p>
 *
 * @since 1.0.0
 */
public final class CusumEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CusumEngine.class);

    public static final String METHOD = "cusum";

    private final Double sigmaSquared;

    /**
     * Engine that scales by the series' known variance, or 1 if none.
     */
    public CusumEngine() {
        this.sigmaSquared = null;
    }

    /**
     * @param sigmaSquared noise variance overriding the series' own, &gt; 0
     */
    public CusumEngine(double sigmaSquared) {
        if (!(sigmaSquared > 0 && Double.isFinite(sigmaSquared))) {
            throw new InvalidParameterException("sigmaSquared must be > 0, got: " + sigmaSquared);
        }
        this.sigmaSquared = sigmaSquared;
    }

    /**
     * Run the test.
     *
     * @param series    preprocessed series, n &ge; 2
     * @param threshold decision threshold for C<sub>max</sub>&sup2;, &gt; 0
     * @return decision, location, statistic, change size and full trace
     * @throws InvalidInputException     if the series is shorter than two points
     * @throws InvalidParameterException if the threshold is not positive
     */
    public SingleChangeResult test(PreprocessedSeries series, double threshold) {
        Objects.requireNonNull(series, "PreprocessedSeries must not be null");
        if (!(threshold > 0)) {
            throw new InvalidParameterException("Threshold must be > 0, got: " + threshold);
        }
        int n = requireLength(series);
        double[] trace = new double[n - 1];
        int tauHat = sweep(series, trace);
        double max = trace[tauHat - 1];

        double sizeOfChange = series.mean(tauHat + 1, n) - series.mean(1, tauHat);
        boolean detected = max * max > threshold;
        if (detected) {
            LOG.debug("Change detected at tau={} (C_max^2={} > threshold={}, delta={})",
                    tauHat, max * max, threshold, sizeOfChange);
        } else {
            LOG.trace("No change: C_max^2={} <= threshold={}", max * max, threshold);
        }
        return new SingleChangeResult(detected, tauHat, max, threshold, sizeOfChange, trace);
    }

    /**
     * C<sub>max</sub>&sup2; without materialising the trace; what the Monte
     * Carlo calibrator records per replicate.
     */
    public double maxSquaredStatistic(PreprocessedSeries series) {
        Objects.requireNonNull(series, "PreprocessedSeries must not be null");
        requireLength(series);
        double[] trace = new double[series.length() - 1];
        double max = trace[sweep(series, trace) - 1];
        return max * max;
    }

    // fills trace[tau - 1] = C_tau and returns the smallest arg-max tau
    private int sweep(PreprocessedSeries series, double[] trace) {
        int n = series.length();
        double sigma = Math.sqrt(sigmaSquared != null ? sigmaSquared : series.getSeries().varianceOrUnit());
        double total = series.centeredSum(1, n);

        int argMax = 1;
        double max = Double.NEGATIVE_INFINITY;
        for (int tau = 1; tau < n; tau++) {
            double left = series.centeredSum(1, tau);
            double leftMean = left / tau;
            double rightMean = (total - left) / (n - tau);
            double c = Math.sqrt((double) tau * (n - tau) / n) * Math.abs(leftMean - rightMean) / sigma;
            trace[tau - 1] = c;
            if (c > max) {
                max = c;
                argMax = tau;
            }
        }
        return argMax;
    }

    private static int requireLength(PreprocessedSeries series) {
        int n = series.length();
        if (n < 2) {
            throw new InvalidInputException("CUSUM test needs at least 2 observations, got: " + n);
        }
        return n;
    }
}
