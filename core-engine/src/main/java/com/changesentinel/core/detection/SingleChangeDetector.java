package com.changesentinel.core.detection;

import com.changesentinel.core.calibration.ThresholdCalibrator;
import com.changesentinel.core.config.DetectionProfile;
import com.changesentinel.core.cost.CostFunction;
import com.changesentinel.core.cost.CostFunctions;
import com.changesentinel.core.cost.CostOptions;
import com.changesentinel.core.cost.PreprocessedSeries;
import com.changesentinel.core.model.CalibrationResult;
import com.changesentinel.core.model.CostFamily;
import com.changesentinel.core.model.SegmentationResult;
import com.changesentinel.core.model.Series;
import com.changesentinel.core.model.SingleChangeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * At-most-one-change detector: calibrates a threshold for the series length,
 * runs the {@link CusumEngine} and reports the result as a segmentation with
 * zero or one changepoint.
 *
 * <p>
 * The reported penalty is the threshold, so the penalized cost reads the same
 * way as for the MEAN-family segmenters: a split is worth taking once its gain
 * C<sub>&tau;</sub>&sup2; exceeds it.
 * </p>
 *
 * @since 1.0.0
 */
public class SingleChangeDetector implements ChangepointDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SingleChangeDetector.class);

    private final String profileName;
    private final ThresholdCalibrator calibrator;
    private final double alpha;
    private final CostOptions options;
    private final CusumEngine engine;

    /**
     * @param profile    a validated {@code cusum} profile
     * @param calibrator threshold source for the profile
     */
    public SingleChangeDetector(DetectionProfile profile, ThresholdCalibrator calibrator) {
        Objects.requireNonNull(profile, "DetectionProfile must not be null");
        this.profileName = Objects.requireNonNull(profile.getName(), "Profile name must not be null");
        this.calibrator = Objects.requireNonNull(calibrator, "ThresholdCalibrator must not be null");
        this.alpha = profile.getAlpha();
        this.options = profile.costOptions();
        this.engine = options.getSigmaSquared().isPresent()
                ? new CusumEngine(options.getSigmaSquared().getAsDouble())
                : new CusumEngine();
    }

    @Override
    public SegmentationResult detect(Series series) {
        Objects.requireNonNull(series, "Series must not be null");
        int n = series.length();

        CalibrationResult calibration = calibrator.calibrate(n, alpha);
        PreprocessedSeries preprocessed = PreprocessedSeries.of(series);
        SingleChangeResult test = engine.test(preprocessed, calibration.getThreshold());

        CostFunction cost = CostFunctions.create(CostFamily.MEAN, preprocessed, options);
        SegmentationResult result = Segmentations
                .assemble(CusumEngine.METHOD, cost, test.toChangepointSet(n), calibration.getThreshold())
                .toBuilder()
                .singleChange(test)
                .calibration(calibration)
                .build();

        LOG.debug("Profile '{}': change={}, C_max^2={}, threshold={}",
                profileName, test.isChangeDetected(), test.getSquaredStatistic(), calibration.getThreshold());
        return result;
    }

    @Override
    public String getProfileName() {
        return profileName;
    }

    ThresholdCalibrator getCalibrator() {
        return calibrator;
    }
}
