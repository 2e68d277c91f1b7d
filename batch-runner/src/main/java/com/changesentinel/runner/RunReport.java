package com.changesentinel.runner;

import com.changesentinel.core.model.CalibrationResult;
import com.changesentinel.core.model.SegmentFit;
import com.changesentinel.core.model.SegmentationResult;
import com.changesentinel.core.model.SingleChangeResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * JSON shape of a batch run: one entry per profile, in configuration order.
 *
 * @since 1.0.0
 */
public final class RunReport {

    private final Instant generatedAt;
    private final String input;
    private final int seriesLength;
    private final List<ProfileReport> profiles;

    public RunReport(Instant generatedAt, String input, int seriesLength, List<ProfileReport> profiles) {
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        this.input = input;
        this.seriesLength = seriesLength;
        this.profiles = Collections.unmodifiableList(new ArrayList<>(profiles));
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public String getInput() {
        return input;
    }

    public int getSeriesLength() {
        return seriesLength;
    }

    public List<ProfileReport> getProfiles() {
        return profiles;
    }

    /**
     * Outcome of one profile.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class ProfileReport {
        private final String profile;
        private final String method;
        private final String family;
        private final List<Integer> changepoints;
        private final List<SegmentReport> segments;
        private final double penalty;
        private final double totalCost;
        private final double penalizedCost;
        private final boolean degenerate;
        private final TestReport test;
        private final CalibrationReport calibration;

        private ProfileReport(String profile, SegmentationResult result) {
            this.profile = profile;
            this.method = result.getMethod();
            this.family = result.getFamily().getConfigName();
            this.changepoints = result.getChangepoints().asList();
            List<SegmentReport> fitted = new ArrayList<>();
            for (SegmentFit fit : result.getFits()) {
                fitted.add(new SegmentReport(fit));
            }
            this.segments = Collections.unmodifiableList(fitted);
            this.penalty = result.getPenalty();
            this.totalCost = result.getTotalCost();
            this.penalizedCost = result.getPenalizedCost();
            this.degenerate = result.isDegenerate();
            this.test = result.getSingleChange().map(TestReport::new).orElse(null);
            this.calibration = result.getCalibration().map(CalibrationReport::new).orElse(null);
        }

        public static ProfileReport of(String profile, SegmentationResult result) {
            Objects.requireNonNull(result, "SegmentationResult must not be null");
            return new ProfileReport(profile, result);
        }

        public String getProfile() {
            return profile;
        }

        public String getMethod() {
            return method;
        }

        public String getFamily() {
            return family;
        }

        public List<Integer> getChangepoints() {
            return changepoints;
        }

        public List<SegmentReport> getSegments() {
            return segments;
        }

        public double getPenalty() {
            return penalty;
        }

        public double getTotalCost() {
            return totalCost;
        }

        public double getPenalizedCost() {
            return penalizedCost;
        }

        public boolean isDegenerate() {
            return degenerate;
        }

        public TestReport getTest() {
            return test;
        }

        public CalibrationReport getCalibration() {
            return calibration;
        }
    }

    public static final class SegmentReport {
        private final int start;
        private final int end;
        private final double cost;
        private final Map<String, Double> parameters;
        private final boolean degenerate;

        SegmentReport(SegmentFit fit) {
            this.start = fit.getSegment().getStart();
            this.end = fit.getSegment().getEnd();
            this.cost = fit.getCost();
            this.parameters = new LinkedHashMap<>(fit.getParameters());
            this.degenerate = fit.isDegenerate();
        }

        public int getStart() {
            return start;
        }

        public int getEnd() {
            return end;
        }

        public double getCost() {
            return cost;
        }

        public Map<String, Double> getParameters() {
            return parameters;
        }

        public boolean isDegenerate() {
            return degenerate;
        }
    }

    /** Single-change test details; the trace is omitted. */
    public static final class TestReport {
        private final boolean changeDetected;
        private final int changepoint;
        private final double maxStatistic;
        private final double squaredStatistic;
        private final double threshold;
        private final double sizeOfChange;

        TestReport(SingleChangeResult result) {
            this.changeDetected = result.isChangeDetected();
            this.changepoint = result.getChangepoint();
            this.maxStatistic = result.getMaxStatistic();
            this.squaredStatistic = result.getSquaredStatistic();
            this.threshold = result.getThreshold();
            this.sizeOfChange = result.getSizeOfChange();
        }

        public boolean isChangeDetected() {
            return changeDetected;
        }

        public int getChangepoint() {
            return changepoint;
        }

        public double getMaxStatistic() {
            return maxStatistic;
        }

        public double getSquaredStatistic() {
            return squaredStatistic;
        }

        public double getThreshold() {
            return threshold;
        }

        public double getSizeOfChange() {
            return sizeOfChange;
        }
    }

    public static final class CalibrationReport {
        private final String method;
        private final double alpha;
        private final double threshold;
        private final int replicates;
        private final List<String> warnings;

        CalibrationReport(CalibrationResult result) {
            this.method = result.getMethod().name().toLowerCase(Locale.ROOT);
            this.alpha = result.getAlpha();
            this.threshold = result.getThreshold();
            this.replicates = result.getReplicates();
            this.warnings = result.getWarnings();
        }

        public String getMethod() {
            return method;
        }

        public double getAlpha() {
            return alpha;
        }

        public double getThreshold() {
            return threshold;
        }

        public int getReplicates() {
            return replicates;
        }

        public List<String> getWarnings() {
            return warnings;
        }
    }
}
