package com.changesentinel.core.cost;

import com.changesentinel.core.error.InvalidParameterException;
import com.changesentinel.core.model.CostFamily;

import java.util.Locale;

/**
 * Information criteria that turn a family and a series length into a
 * per-changepoint penalty &beta;. Each changepoint adds the family's segment
 * parameters plus one location parameter, so k = parameters + 1.
 *
 * @since 1.0.0
 */
public enum PenaltyCriterion {

    /** Penalty supplied by the caller. */
    MANUAL,

    /** 2k. */
    AIC,

    /** k&middot;log n (also known as SIC). */
    BIC,

    /** 2k&middot;log log n. */
    HANNAN_QUINN,

    /**
     * The calibrated CUSUM threshold reused as &beta;. Meaningful only for the
     * MEAN family, where the split gain equals C<sub>&tau;</sub>&sup2;; resolved by
     * the detector, not here.
     */
    CALIBRATED;

    /**
     * @param family cost family the penalty is for
     * @param n      series length
     * @return the penalty
     * @throws InvalidParameterException for {@link #MANUAL} and
     *                                   {@link #CALIBRATED}, which have no
     *                                   formula, and for {@link #HANNAN_QUINN}
     *                                   when {@code n < 3}
     */
    public double penalty(CostFamily family, int n) {
        int k = family.getParameterCount() + 1;
        return switch (this) {
            case AIC -> 2.0 * k;
            case BIC -> k * Math.log(n);
            case HANNAN_QUINN -> {
                // log log n is negative below n = 3
                if (n < 3) {
                    throw new InvalidParameterException(
                            "HANNAN_QUINN penalty needs a series of at least 3 observations, got: " + n);
                }
                yield 2.0 * k * Math.log(Math.log(n));
            }
            case MANUAL -> throw new InvalidParameterException("MANUAL penalty has no formula; supply a value");
            case CALIBRATED -> throw new InvalidParameterException(
                    "CALIBRATED penalty comes from a threshold calibrator, not a formula");
        };
    }

    /**
     * @param name {@code manual}, {@code aic}, {@code bic} / {@code sic},
     *             {@code hannan_quinn} / {@code hq} or {@code calibrated},
     *             case-insensitive
     */
    public static PenaltyCriterion fromName(String name) {
        if (name == null) {
            throw new InvalidParameterException("Penalty criterion must not be null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "manual" -> MANUAL;
            case "aic" -> AIC;
            case "bic", "sic" -> BIC;
            case "hannan_quinn", "hannan-quinn", "hq" -> HANNAN_QUINN;
            case "calibrated" -> CALIBRATED;
            default -> throw new InvalidParameterException("Unknown penalty criterion: '" + name
                    + "'. Supported: manual, aic, bic, hannan_quinn, calibrated");
        };
    }
}
