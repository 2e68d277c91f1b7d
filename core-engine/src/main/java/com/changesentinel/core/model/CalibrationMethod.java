package com.changesentinel.core.model;

import com.changesentinel.core.error.InvalidParameterException;

import java.util.Locale;

/**
 * Where a CUSUM decision threshold comes from.
 *
 * @since 1.0.0
 */
public enum CalibrationMethod {

    /** Closed-form Gumbel limit of the normalized CUSUM maximum. */
    ASYMPTOTIC,

    /** Empirical quantile of simulated null maxima. */
    MONTE_CARLO,

    /** Threshold supplied by the caller. */
    MANUAL;

    /**
     * @param name {@code asymptotic}, {@code montecarlo} / {@code monte_carlo}
     *             or {@code manual}, case-insensitive
     * @return the method
     * @throws InvalidParameterException if the name is unknown
     */
    public static CalibrationMethod fromName(String name) {
        if (name == null) {
            throw new InvalidParameterException("Threshold source must not be null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "asymptotic" -> ASYMPTOTIC;
            case "montecarlo", "monte_carlo", "monte-carlo" -> MONTE_CARLO;
            case "manual" -> MANUAL;
            default -> throw new InvalidParameterException("Unknown threshold source: '" + name
                    + "'. Supported: asymptotic, montecarlo, manual");
        };
    }
}
