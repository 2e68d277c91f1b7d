/**
 * Changepoint search engines and the profile-driven detectors built on them.
 *
 * <p>
 * Engines:
 * </p>
 * <ul>
 * <li>{@link com.changesentinel.core.detection.CusumEngine} - single mean
 * change, CUSUM statistic against a threshold</li>
 * <li>{@link com.changesentinel.core.detection.BinarySegmentation} - greedy
 * recursive splitting under a penalty</li>
 * <li>{@link com.changesentinel.core.detection.OptimalPartitioning} - exact
 * penalized optimum, with optional PELT pruning</li>
 * </ul>
 *
 * <p>
 * {@link com.changesentinel.core.detection.DetectorFactory} turns a
 * {@link com.changesentinel.core.config.DetectionProfile} into a ready
 * {@link com.changesentinel.core.detection.ChangepointDetector}; to add a
 * method, implement the interface and register its name there.
 * </p>
 *
 * @since 1.0.0
 */
package com.changesentinel.core.detection;
