package com.changesentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a changepoint detection run.
 *
 * <p>
 * Multiple-changepoint segmenters fill in the changepoints, the per-segment
 * fits and the penalized cost. The single-change detector additionally
 * attaches its {@link SingleChangeResult}, and any detector whose threshold
 * was calibrated attaches the {@link CalibrationResult}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; {@code method}, {@code family} and
 * {@code changepoints} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class SegmentationResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String method;
    private final CostFamily family;
    private final ChangepointSet changepoints;
    private final List<SegmentFit> fits;
    private final double penalty;
    private final SingleChangeResult singleChange;
    private final CalibrationResult calibration;

    private SegmentationResult(Builder builder) {
        this.method = Objects.requireNonNull(builder.method, "method must not be null");
        this.family = Objects.requireNonNull(builder.family, "family must not be null");
        this.changepoints = Objects.requireNonNull(builder.changepoints, "changepoints must not be null");
        this.fits = Collections.unmodifiableList(new ArrayList<>(builder.fits));
        this.penalty = builder.penalty;
        this.singleChange = builder.singleChange;
        this.calibration = builder.calibration;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-filled with this result's fields
     */
    public Builder toBuilder() {
        return new Builder()
                .method(method)
                .family(family)
                .changepoints(changepoints)
                .fits(fits)
                .penalty(penalty)
                .singleChange(singleChange)
                .calibration(calibration);
    }

    /**
     * Fluent builder for {@link SegmentationResult}.
     */
    public static class Builder {
        private String method;
        private CostFamily family;
        private ChangepointSet changepoints;
        private List<SegmentFit> fits = Collections.emptyList();
        private double penalty;
        private SingleChangeResult singleChange;
        private CalibrationResult calibration;

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder family(CostFamily family) {
            this.family = family;
            return this;
        }

        public Builder changepoints(ChangepointSet changepoints) {
            this.changepoints = changepoints;
            return this;
        }

        public Builder fits(List<SegmentFit> fits) {
            this.fits = Objects.requireNonNull(fits, "fits must not be null");
            return this;
        }

        public Builder penalty(double penalty) {
            this.penalty = penalty;
            return this;
        }

        public Builder singleChange(SingleChangeResult singleChange) {
            this.singleChange = singleChange;
            return this;
        }

        public Builder calibration(CalibrationResult calibration) {
            this.calibration = calibration;
            return this;
        }

        public SegmentationResult build() {
            return new SegmentationResult(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getMethod() {
        return method;
    }

    public CostFamily getFamily() {
        return family;
    }

    public ChangepointSet getChangepoints() {
        return changepoints;
    }

    public List<SegmentFit> getFits() {
        return fits;
    }

    public double getPenalty() {
        return penalty;
    }

    /**
     * @return sum of the segment costs, without penalty
     */
    public double getTotalCost() {
        double total = 0;
        for (SegmentFit fit : fits) {
            total += fit.getCost();
        }
        return total;
    }

    /**
     * @return segment costs plus {@code penalty} for every changepoint
     */
    public double getPenalizedCost() {
        return getTotalCost() + penalty * changepoints.size();
    }

    /**
     * @return {@code true} if any segment statistic had to be floored
     */
    public boolean isDegenerate() {
        return fits.stream().anyMatch(SegmentFit::isDegenerate);
    }

    public Optional<SingleChangeResult> getSingleChange() {
        return Optional.ofNullable(singleChange);
    }

    public Optional<CalibrationResult> getCalibration() {
        return Optional.ofNullable(calibration);
    }

    @Override
    public String toString() {
        return "SegmentationResult{" +
                "method='" + method + '\'' +
                ", family=" + family +
                ", changepoints=" + changepoints.asList() +
                ", penalty=" + penalty +
                ", penalizedCost=" + getPenalizedCost() +
                (isDegenerate() ? ", degenerate" : "") +
                '}';
    }
}
