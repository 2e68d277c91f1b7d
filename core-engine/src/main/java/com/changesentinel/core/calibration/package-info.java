/**
 * Decision thresholds for the CUSUM test.
 *
 * <p>
 * {@link com.changesentinel.core.calibration.AsymptoticCalibrator} gives the
 * closed-form Gumbel threshold, conservative at finite n;
 * {@link com.changesentinel.core.calibration.MonteCarloCalibrator} simulates
 * the null distribution of the maximum and is preferred in practice. Both
 * expose the same {@link com.changesentinel.core.calibration.ThresholdCalibrator}
 * contract so callers can compare them.
 * </p>
 *
 * @since 1.0.0
 */
package com.changesentinel.core.calibration;
