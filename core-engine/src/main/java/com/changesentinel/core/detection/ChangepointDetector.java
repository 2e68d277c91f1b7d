package com.changesentinel.core.detection;

import com.changesentinel.core.model.SegmentationResult;
import com.changesentinel.core.model.Series;

/**
 * Contract for profile-driven detectors.
 * <p>
 * A detector is bound to one {@link com.changesentinel.core.config.DetectionProfile}
 * and holds no per-series state, so one instance may process any number of
 * series, concurrently if the caller wishes.
 * </p>
 */
public interface ChangepointDetector {

    /**
     * Run the profile's analysis on a series.
     *
     * @param series the observations
     * @return changepoints, segment fits and, where applicable, the test and
     *         calibration details
     */
    SegmentationResult detect(Series series);

    /**
     * @return unique name of the profile this detector runs
     */
    String getProfileName();
}
