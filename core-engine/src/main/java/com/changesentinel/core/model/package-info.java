/**
 * Value types shared by the cost functions, detectors and calibrators.
 *
 * <ul>
 * <li>{@link com.changesentinel.core.model.Series} - immutable input
 * observations</li>
 * <li>{@link com.changesentinel.core.model.Segment} and
 * {@link com.changesentinel.core.model.ChangepointSet} - 1-based positions
 * and the partition they induce</li>
 * <li>{@link com.changesentinel.core.model.SegmentationResult},
 * {@link com.changesentinel.core.model.SingleChangeResult} and
 * {@link com.changesentinel.core.model.CalibrationResult} - detector
 * outputs</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.changesentinel.core.model;
