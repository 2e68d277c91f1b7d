package com.changesentinel.core.calibration;

import com.changesentinel.core.model.CalibrationMethod;
import com.changesentinel.core.model.CalibrationResult;

/**
 * Produces a CUSUM decision threshold for a series length and a
 * false-positive level. Thresholds are in squared-statistic units: a change
 * is declared when C<sub>max</sub>&sup2; exceeds the returned value.
 *
 * <p>
 * Implementations do not look at any concrete series, so one calibration can
 * serve every series of the same length.
 * </p>
 *
 * @since 1.0.0
 */
public interface ThresholdCalibrator {

    /**
     * @param n     series length
     * @param alpha false-positive level in (0, 1)
     * @return the threshold and how it was obtained
     * @throws com.changesentinel.core.error.InvalidInputException     if n is
     *         too small for this method
     * @throws com.changesentinel.core.error.InvalidParameterException if alpha
     *         is outside (0, 1)
     */
    CalibrationResult calibrate(int n, double alpha);

    CalibrationMethod method();
}
