package com.changesentinel.core.detection;

import com.changesentinel.core.calibration.ThresholdCalibrator;
import com.changesentinel.core.config.DetectionProfile;
import com.changesentinel.core.cost.CostFunction;
import com.changesentinel.core.cost.CostFunctions;
import com.changesentinel.core.cost.CostOptions;
import com.changesentinel.core.cost.PenaltyCriterion;
import com.changesentinel.core.cost.PreprocessedSeries;
import com.changesentinel.core.model.CalibrationResult;
import com.changesentinel.core.model.CostFamily;
import com.changesentinel.core.model.SegmentationResult;
import com.changesentinel.core.model.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Multiple-changepoint detector running Binary Segmentation, Optimal
 * Partitioning or PELT for one cost family.
 *
 * <h3>Penalty</h3>
 * <ul>
 * <li>{@code manual}: the profile's {@code penalty}</li>
 * <li>{@code aic}, {@code bic}, {@code hannan_quinn}: computed from the family
 * and the series length</li>
 * <li>{@code calibrated}: the CUSUM threshold calibrated for the series
 * length; the calibration is attached to the result</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class MultipleChangeDetector implements ChangepointDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MultipleChangeDetector.class);

    private final String profileName;
    private final String method;
    private final CostFamily family;
    private final CostOptions options;
    private final PenaltyCriterion criterion;
    private final Double manualPenalty;
    private final ThresholdCalibrator calibrator;
    private final double alpha;
    private final CancellationSignal signal;
    private final BinarySegmentation binarySegmentation;
    private final OptimalPartitioning optimalPartitioning;

    /**
     * @param profile    a validated {@code binseg}, {@code op} or {@code pelt}
     *                   profile
     * @param calibrator threshold source, required only for a calibrated
     *                   penalty; may be {@code null} otherwise
     * @param signal     checked by the segmenter and any calibration
     */
    public MultipleChangeDetector(DetectionProfile profile, ThresholdCalibrator calibrator,
                                  CancellationSignal signal) {
        Objects.requireNonNull(profile, "DetectionProfile must not be null");
        this.profileName = Objects.requireNonNull(profile.getName(), "Profile name must not be null");
        this.method = Objects.requireNonNull(profile.getMethod(), "Profile method must not be null");
        this.family = profile.costFamily();
        this.options = profile.costOptions();
        this.criterion = profile.penaltyCriterion();
        this.manualPenalty = profile.getPenalty();
        this.alpha = profile.getAlpha();
        this.signal = Objects.requireNonNull(signal, "CancellationSignal must not be null");
        if (criterion == PenaltyCriterion.CALIBRATED) {
            this.calibrator = Objects.requireNonNull(calibrator,
                    "Calibrated penalty for profile '" + profileName + "' needs a ThresholdCalibrator");
        } else {
            this.calibrator = calibrator;
        }

        switch (method) {
            case BinarySegmentation.METHOD -> {
                Integer cap = profile.getMaxChangepoints();
                this.binarySegmentation = cap != null ? new BinarySegmentation(cap) : new BinarySegmentation();
                this.optimalPartitioning = null;
            }
            case OptimalPartitioning.METHOD -> {
                this.binarySegmentation = null;
                this.optimalPartitioning = new OptimalPartitioning(PruningStrategy.none());
            }
            case OptimalPartitioning.PELT_METHOD -> {
                this.binarySegmentation = null;
                this.optimalPartitioning = new OptimalPartitioning(PruningStrategy.pelt());
            }
            default -> throw new IllegalArgumentException(
                    "Unsupported method for multiple changepoints: '" + method + "'");
        }
    }

    @Override
    public SegmentationResult detect(Series series) {
        Objects.requireNonNull(series, "Series must not be null");
        int n = series.length();

        CalibrationResult calibration = null;
        double penalty;
        if (criterion == PenaltyCriterion.MANUAL) {
            penalty = manualPenalty;
        } else if (criterion == PenaltyCriterion.CALIBRATED) {
            calibration = calibrator.calibrate(n, alpha);
            penalty = calibration.getThreshold();
        } else {
            penalty = criterion.penalty(family, n);
        }

        CostFunction cost = CostFunctions.create(family, PreprocessedSeries.of(series), options);
        SegmentationResult result = binarySegmentation != null
                ? binarySegmentation.segment(cost, penalty)
                : optimalPartitioning.segment(cost, penalty, signal);

        LOG.debug("Profile '{}': {} changepoint(s) with {} penalty {}",
                profileName, result.getChangepoints().size(), criterion, penalty);
        return calibration == null ? result : result.toBuilder().calibration(calibration).build();
    }

    @Override
    public String getProfileName() {
        return profileName;
    }

    String getMethod() {
        return method;
    }

    PenaltyCriterion getCriterion() {
        return criterion;
    }
}
