package com.changesentinel.core.calibration;

import com.changesentinel.core.error.InvalidParameterException;
import com.changesentinel.core.model.CalibrationMethod;
import com.changesentinel.core.model.CalibrationResult;

import java.util.Collections;

/**
 * Caller-supplied threshold, returned unchanged for every length.
 *
 * @since 1.0.0
 */
public final class FixedThreshold implements ThresholdCalibrator {

    private final double threshold;

    /**
     * @param threshold threshold in squared-statistic units, &gt; 0
     */
    public FixedThreshold(double threshold) {
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            throw new InvalidParameterException("Threshold must be a finite value > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public CalibrationResult calibrate(int n, double alpha) {
        CalibrationArguments.check(n, 2, alpha);
        return new CalibrationResult(CalibrationMethod.MANUAL, n, alpha, threshold, null,
                Collections.emptyList());
    }

    @Override
    public CalibrationMethod method() {
        return CalibrationMethod.MANUAL;
    }
}
