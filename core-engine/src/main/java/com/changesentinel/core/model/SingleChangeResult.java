package com.changesentinel.core.model;

import java.io.Serializable;

/**
 * Outcome of the single-changepoint CUSUM test.
 *
 * <p>
 * The trace holds the standardized statistic
 * C<sub>&tau;</sub>&nbsp;=&nbsp;&radic;(&tau;(n&minus;&tau;)/n)&middot;|&#563;<sub>1:&tau;</sub>&nbsp;&minus;&nbsp;&#563;<sub>&tau;+1:n</sub>|&nbsp;/&nbsp;&sigma;
 * for &tau; = 1 &hellip; n&minus;1. A change is reported when the squared
 * maximum exceeds the threshold, so thresholds are always expressed in squared
 * units.
 * </p>
 *
 * @since 1.0.0
 */
public final class SingleChangeResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean changeDetected;
    private final int changepoint;
    private final double maxStatistic;
    private final double threshold;
    private final double sizeOfChange;
    private final double[] trace;

    /**
     * @param changeDetected whether {@code maxStatistic^2 > threshold}
     * @param changepoint    arg-max &tau;&#770; of the trace (1-based)
     * @param maxStatistic   C<sub>max</sub>, already divided by &sigma;
     * @param threshold      decision threshold in squared units
     * @param sizeOfChange   &Delta;&mu;&#770; = mean after &tau;&#770; minus mean
     *                       up to &tau;&#770;
     * @param trace          C<sub>&tau;</sub> for &tau; = 1 &hellip; n&minus;1;
     *                       copied
     */
    public SingleChangeResult(boolean changeDetected, int changepoint, double maxStatistic,
                              double threshold, double sizeOfChange, double[] trace) {
        this.changeDetected = changeDetected;
        this.changepoint = changepoint;
        this.maxStatistic = maxStatistic;
        this.threshold = threshold;
        this.sizeOfChange = sizeOfChange;
        this.trace = trace.clone();
    }

    public boolean isChangeDetected() {
        return changeDetected;
    }

    /**
     * @return the most likely change location, whether or not the change is
     *         significant
     */
    public int getChangepoint() {
        return changepoint;
    }

    public double getMaxStatistic() {
        return maxStatistic;
    }

    /**
     * @return C<sub>max</sub>&sup2;, the quantity compared with the threshold
     */
    public double getSquaredStatistic() {
        return maxStatistic * maxStatistic;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getSizeOfChange() {
        return sizeOfChange;
    }

    /**
     * @return copy of the statistic trace; index 0 holds C<sub>1</sub>
     */
    public double[] getTrace() {
        return trace.clone();
    }

    /**
     * @param n series length the test ran on
     * @return the detected changepoint as a set, empty if no change was detected
     */
    public ChangepointSet toChangepointSet(int n) {
        return changeDetected ? ChangepointSet.of(n, changepoint) : ChangepointSet.empty(n);
    }

    @Override
    public String toString() {
        return "SingleChangeResult{" +
                "changeDetected=" + changeDetected +
                ", changepoint=" + changepoint +
                ", maxStatistic=" + maxStatistic +
                ", threshold=" + threshold +
                ", sizeOfChange=" + sizeOfChange +
                '}';
    }
}
