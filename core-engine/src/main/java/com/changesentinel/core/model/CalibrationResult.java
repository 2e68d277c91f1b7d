package com.changesentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A calibrated CUSUM threshold together with what produced it.
 *
 * <p>
 * Monte Carlo results also carry every replicate maximum (squared statistic)
 * so callers can plot the simulated null distribution. Warnings are advisory:
 * a result with warnings is still usable.
 * </p>
 *
 * @since 1.0.0
 */
public final class CalibrationResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final CalibrationMethod method;
    private final int seriesLength;
    private final double alpha;
    private final double threshold;
    private final double[] replicateMaxima;
    private final List<String> warnings;

    public CalibrationResult(CalibrationMethod method, int seriesLength, double alpha, double threshold,
                             double[] replicateMaxima, List<String> warnings) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.seriesLength = seriesLength;
        this.alpha = alpha;
        this.threshold = threshold;
        this.replicateMaxima = replicateMaxima != null ? replicateMaxima.clone() : new double[0];
        this.warnings = warnings != null ? List.copyOf(warnings) : Collections.emptyList();
    }

    public CalibrationMethod getMethod() {
        return method;
    }

    public int getSeriesLength() {
        return seriesLength;
    }

    public double getAlpha() {
        return alpha;
    }

    /**
     * @return threshold in squared-statistic units
     */
    public double getThreshold() {
        return threshold;
    }

    /**
     * @return copy of the simulated maxima, empty unless Monte Carlo
     */
    public double[] getReplicateMaxima() {
        return replicateMaxima.clone();
    }

    public int getReplicates() {
        return replicateMaxima.length;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        return "CalibrationResult{" +
                "method=" + method +
                ", n=" + seriesLength +
                ", alpha=" + alpha +
                ", threshold=" + threshold +
                ", replicates=" + replicateMaxima.length +
                ", warnings=" + warnings +
                '}';
    }
}
