package com.changesentinel.core.model;

import com.changesentinel.core.error.InvalidParameterException;

import java.util.Locale;

/**
 * Model families for which a segment cost is defined.
 *
 * <p>
 * The set is closed: every family is implemented in
 * {@code com.changesentinel.core.cost} and selected when a cost function is
 * created.
 * </p>
 *
 * @since 1.0.0
 */
public enum CostFamily {

    /** Change in mean, known variance. */
    MEAN("mean", 1),

    /** Change in variance, known mean. */
    VARIANCE("variance", 1),

    /** Joint change in mean and variance. */
    MEAN_AND_VARIANCE("meanvar", 2),

    /** Change in intercept and slope of a linear trend. */
    SLOPE("slope", 2),

    /** Change in distribution, empirical-CDF based. */
    NONPARAMETRIC("nonparametric", 1);

    private final String configName;
    private final int parameterCount;

    CostFamily(String configName, int parameterCount) {
        this.configName = configName;
        this.parameterCount = parameterCount;
    }

    /**
     * @return the name used for this family in profile configuration
     */
    public String getConfigName() {
        return configName;
    }

    /**
     * @return number of parameters fitted per segment
     */
    public int getParameterCount() {
        return parameterCount;
    }

    /**
     * Resolve a family from its configuration name or enum constant name,
     * ignoring case.
     *
     * @param name family name, e.g. {@code "mean"} or {@code "MEAN_AND_VARIANCE"}
     * @return the family
     * @throws InvalidParameterException if the name is unknown
     */
    public static CostFamily fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (CostFamily family : values()) {
                if (family.configName.equals(normalized)
                        || family.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                    return family;
                }
            }
        }
        throw new InvalidParameterException("Unknown cost family: '" + name
                + "'. Supported: mean, variance, meanvar, slope, nonparametric");
    }
}
