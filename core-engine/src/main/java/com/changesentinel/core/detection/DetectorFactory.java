package com.changesentinel.core.detection;

import com.changesentinel.core.calibration.AsymptoticCalibrator;
import com.changesentinel.core.calibration.FixedThreshold;
import com.changesentinel.core.calibration.MonteCarloCalibrator;
import com.changesentinel.core.calibration.ThresholdCalibrator;
import com.changesentinel.core.config.DetectionProfile;
import com.changesentinel.core.cost.PenaltyCriterion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link ChangepointDetector} instances from
 * {@link DetectionProfile} configurations.
 *
 * <p>
 * This is the single point of extension when adding new methods: register
 * the method name here and create the corresponding detector.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class - not instantiable
    }

    public static ChangepointDetector create(DetectionProfile profile) {
        return create(profile, CancellationSignal.none());
    }

    /**
     * Create a detector for the given profile.
     *
     * @param profile the profile; must not be {@code null}
     * @param signal  cancellation checked by calibration and segmentation
     * @return a detector bound to the profile
     * @throws NullPointerException     if {@code profile} or its method is
     *                                  {@code null}
     * @throws IllegalArgumentException if the method is unknown
     */
    public static ChangepointDetector create(DetectionProfile profile, CancellationSignal signal) {
        Objects.requireNonNull(profile, "DetectionProfile must not be null");
        Objects.requireNonNull(profile.getMethod(), "Profile method must not be null");

        return switch (profile.getMethod()) {
            case CusumEngine.METHOD -> new SingleChangeDetector(profile, calibrator(profile, signal));
            case BinarySegmentation.METHOD, OptimalPartitioning.METHOD, OptimalPartitioning.PELT_METHOD ->
                    new MultipleChangeDetector(profile,
                            profile.penaltyCriterion() == PenaltyCriterion.CALIBRATED
                                    ? calibrator(profile, signal)
                                    : null,
                            signal);
            default -> throw new IllegalArgumentException(
                    "Unknown method: '" + profile.getMethod()
                            + "'. Supported methods: cusum, binseg, op, pelt");
        };
    }

    /**
     * Create detectors for every profile in the supplied list.
     *
     * @return unmodifiable list of detectors (one per profile)
     */
    public static List<ChangepointDetector> createAll(List<DetectionProfile> profiles,
                                                      CancellationSignal signal) {
        Objects.requireNonNull(profiles, "Profiles list must not be null");
        LOG.info("Creating {} detector(s) from configuration", profiles.size());
        List<ChangepointDetector> detectors = profiles.stream()
                .map(p -> create(p, signal))
                .toList();
        return Collections.unmodifiableList(detectors);
    }

    public static List<ChangepointDetector> createAll(List<DetectionProfile> profiles) {
        return createAll(profiles, CancellationSignal.none());
    }

    static ThresholdCalibrator calibrator(DetectionProfile profile, CancellationSignal signal) {
        return switch (profile.calibrationMethod()) {
            case ASYMPTOTIC -> new AsymptoticCalibrator();
            case MONTE_CARLO -> MonteCarloCalibrator.builder()
                    .replicates(profile.getReplicates())
                    .seed(profile.getSeed())
                    .parallelism(profile.getCalibrationThreads())
                    .cancellationSignal(signal)
                    .build();
            case MANUAL -> new FixedThreshold(Objects.requireNonNull(profile.getThreshold(),
                    "Manual threshold must be set for profile '" + profile.getName() + "'"));
        };
    }
}
