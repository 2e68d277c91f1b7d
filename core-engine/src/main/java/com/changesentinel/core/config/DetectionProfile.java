package com.changesentinel.core.config;

import com.changesentinel.core.cost.CostOptions;
import com.changesentinel.core.cost.PenaltyCriterion;
import com.changesentinel.core.error.InvalidParameterException;
import com.changesentinel.core.model.CalibrationMethod;
import com.changesentinel.core.model.CostFamily;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes one named detection run loaded from configuration.
 *
 * <p>
 * Supported methods:
 * </p>
 * <ul>
 * <li>{@code cusum} - single mean change, threshold from {@code thresholdSource}</li>
 * <li>{@code binseg} - Binary Segmentation, optionally capped by
 * {@code maxChangepoints}</li>
 * <li>{@code op} - exact Optimal Partitioning</li>
 * <li>{@code pelt} - Optimal Partitioning with PELT pruning</li>
 * </ul>
 *
 * <p>
 * The multiple-change methods take their penalty from {@code penalty} (manual)
 * or from {@code penaltyCriterion}; {@code calibrated} reuses the CUSUM
 * threshold and needs the {@code mean} family.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionProfile implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Unique profile name used in logs and reports. */
    private String name;

    /** "cusum", "binseg", "op" or "pelt". */
    private String method;

    private String family = "mean";

    // --- Penalty (binseg / op / pelt) ---
    /** Manual per-changepoint penalty; implies criterion "manual" when set. */
    private Double penalty;

    private String penaltyCriterion;

    private Integer maxChangepoints;

    // --- Threshold (cusum, or calibrated penalty) ---
    private String thresholdSource = "montecarlo";

    private double alpha = 0.05;

    /** Manual threshold in squared-statistic units. */
    private Double threshold;

    private int replicates = 1000;

    private long seed = 42L;

    private int calibrationThreads = 1;

    // --- Cost options ---
    private Double sigmaSquared;

    private double knownMean;

    private Integer quantileGridSize;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all fields required by the declared method are present
     * and legal.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Profile 'name' is required");
        }
        if (method == null || method.isBlank()) {
            errors.add("Profile 'method' is required");
        }

        CostFamily costFamily = null;
        try {
            costFamily = costFamily();
        } catch (InvalidParameterException e) {
            errors.add("Profile '" + name + "': " + e.getMessage());
        }
        if (sigmaSquared != null && !(sigmaSquared > 0)) {
            errors.add("Profile '" + name + "' requires 'sigmaSquared' > 0");
        }
        if (quantileGridSize != null && quantileGridSize < 1) {
            errors.add("Profile '" + name + "' requires 'quantileGridSize' >= 1");
        }

        if (method != null) {
            switch (method) {
                case "cusum" -> {
                    if (costFamily != null && costFamily != CostFamily.MEAN) {
                        errors.add("CUSUM profile '" + name + "' only supports family 'mean'");
                    }
                    validateThreshold(errors);
                }
                case "binseg", "op", "pelt" -> {
                    PenaltyCriterion criterion = null;
                    try {
                        criterion = penaltyCriterion();
                    } catch (InvalidParameterException e) {
                        errors.add("Profile '" + name + "': " + e.getMessage());
                    }
                    if (criterion == PenaltyCriterion.MANUAL
                            && (penalty == null || !(penalty >= 0) || penalty.isInfinite())) {
                        errors.add("Profile '" + name + "' requires a finite 'penalty' >= 0");
                    }
                    if (criterion == PenaltyCriterion.CALIBRATED) {
                        if (costFamily != null && costFamily != CostFamily.MEAN) {
                            errors.add("Calibrated penalty in profile '" + name + "' requires family 'mean'");
                        }
                        validateThreshold(errors);
                    }
                    if (maxChangepoints != null) {
                        if (!"binseg".equals(method)) {
                            errors.add("'maxChangepoints' in profile '" + name + "' is only supported by binseg");
                        } else if (maxChangepoints < 0) {
                            errors.add("Profile '" + name + "' requires 'maxChangepoints' >= 0");
                        }
                    }
                }
                default -> errors.add("Unknown method: '" + method
                        + "'. Supported: cusum, binseg, op, pelt");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionProfile: " + String.join("; ", errors));
        }
    }

    private void validateThreshold(List<String> errors) {
        CalibrationMethod source;
        try {
            source = calibrationMethod();
        } catch (InvalidParameterException e) {
            errors.add("Profile '" + name + "': " + e.getMessage());
            return;
        }
        if (!(alpha > 0 && alpha < 1)) {
            errors.add("Profile '" + name + "' requires 'alpha' in (0, 1)");
        }
        switch (source) {
            case MANUAL -> {
                if (threshold == null || !(threshold > 0) || threshold.isInfinite()) {
                    errors.add("Profile '" + name + "' requires a finite 'threshold' > 0");
                }
            }
            case MONTE_CARLO -> {
                if (replicates < 1) {
                    errors.add("Profile '" + name + "' requires 'replicates' >= 1");
                }
                if (calibrationThreads < 1) {
                    errors.add("Profile '" + name + "' requires 'calibrationThreads' >= 1");
                }
            }
            case ASYMPTOTIC -> {
                // alpha only
            }
        }
    }

    // ---------------------------------------------------------------
    // Typed views
    // ---------------------------------------------------------------

    public CostFamily costFamily() {
        return CostFamily.fromName(family);
    }

    public CalibrationMethod calibrationMethod() {
        return CalibrationMethod.fromName(thresholdSource);
    }

    /**
     * @return the configured criterion; {@code manual} when only a penalty is
     *         given, {@code bic} when neither is
     */
    public PenaltyCriterion penaltyCriterion() {
        if (penaltyCriterion != null) {
            return PenaltyCriterion.fromName(penaltyCriterion);
        }
        return penalty != null ? PenaltyCriterion.MANUAL : PenaltyCriterion.BIC;
    }

    public CostOptions costOptions() {
        return CostOptions.builder()
                .sigmaSquared(sigmaSquared)
                .knownMean(knownMean)
                .quantileGridSize(quantileGridSize)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getMethod() {
        return method;
    }

    /**
     * Set the method, normalised to lowercase.
     */
    public void setMethod(String method) {
        this.method = method != null ? method.toLowerCase(Locale.ROOT) : null;
    }

    public String getFamily() {
        return family;
    }

    public void setFamily(String family) {
        this.family = family;
    }

    public Double getPenalty() {
        return penalty;
    }

    public void setPenalty(Double penalty) {
        this.penalty = penalty;
    }

    public String getPenaltyCriterion() {
        return penaltyCriterion;
    }

    public void setPenaltyCriterion(String penaltyCriterion) {
        this.penaltyCriterion = penaltyCriterion;
    }

    public Integer getMaxChangepoints() {
        return maxChangepoints;
    }

    public void setMaxChangepoints(Integer maxChangepoints) {
        this.maxChangepoints = maxChangepoints;
    }

    public String getThresholdSource() {
        return thresholdSource;
    }

    public void setThresholdSource(String thresholdSource) {
        this.thresholdSource = thresholdSource;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public int getReplicates() {
        return replicates;
    }

    public void setReplicates(int replicates) {
        this.replicates = replicates;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public int getCalibrationThreads() {
        return calibrationThreads;
    }

    public void setCalibrationThreads(int calibrationThreads) {
        this.calibrationThreads = calibrationThreads;
    }

    public Double getSigmaSquared() {
        return sigmaSquared;
    }

    public void setSigmaSquared(Double sigmaSquared) {
        this.sigmaSquared = sigmaSquared;
    }

    public double getKnownMean() {
        return knownMean;
    }

    public void setKnownMean(double knownMean) {
        this.knownMean = knownMean;
    }

    public Integer getQuantileGridSize() {
        return quantileGridSize;
    }

    public void setQuantileGridSize(Integer quantileGridSize) {
        this.quantileGridSize = quantileGridSize;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionProfile that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(method, that.method);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, method);
    }

    @Override
    public String toString() {
        return "DetectionProfile{" +
                "name='" + name + '\'' +
                ", method='" + method + '\'' +
                ", family='" + family + '\'' +
                ", penalty=" + penalty +
                ", penaltyCriterion='" + penaltyCriterion + '\'' +
                ", thresholdSource='" + thresholdSource + '\'' +
                ", alpha=" + alpha +
                ", threshold=" + threshold +
                ", replicates=" + replicates +
                ", maxChangepoints=" + maxChangepoints +
                '}';
    }
}
