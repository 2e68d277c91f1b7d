package com.changesentinel.core.cost;

import com.changesentinel.core.error.InvalidParameterException;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Family-specific settings for {@link CostFunctions#create}.
 *
 * <ul>
 * <li>{@code sigmaSquared} - noise variance for the MEAN and SLOPE costs;
 * when unset the series' known variance is used, else 1</li>
 * <li>{@code knownMean} - mean assumed by the VARIANCE cost, default 0</li>
 * <li>{@code quantileGridSize} - grid size K for the NONPARAMETRIC cost;
 * when unset {@code ceil(4 log n)}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class CostOptions {

    private static final CostOptions DEFAULTS = builder().build();

    private final Double sigmaSquared;
    private final double knownMean;
    private final Integer quantileGridSize;

    private CostOptions(Builder b) {
        this.sigmaSquared = b.sigmaSquared;
        this.knownMean = b.knownMean;
        this.quantileGridSize = b.quantileGridSize;
    }

    public static CostOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public OptionalDouble getSigmaSquared() {
        return sigmaSquared != null ? OptionalDouble.of(sigmaSquared) : OptionalDouble.empty();
    }

    public double getKnownMean() {
        return knownMean;
    }

    public OptionalInt getQuantileGridSize() {
        return quantileGridSize != null ? OptionalInt.of(quantileGridSize) : OptionalInt.empty();
    }

    /**
     * Default nonparametric grid size for a series of length {@code n}.
     */
    public static int defaultGridSize(int n) {
        return Math.max(1, (int) Math.ceil(4 * Math.log(n)));
    }

    public static class Builder {
        private Double sigmaSquared;
        private double knownMean;
        private Integer quantileGridSize;

        public Builder sigmaSquared(Double v) {
            this.sigmaSquared = v;
            return this;
        }

        public Builder knownMean(double v) {
            this.knownMean = v;
            return this;
        }

        public Builder quantileGridSize(Integer v) {
            this.quantileGridSize = v;
            return this;
        }

        /**
         * @throws InvalidParameterException if sigmaSquared is not positive, the
         *                                   mean is not finite or the grid size
         *                                   is below one
         */
        public CostOptions build() {
            if (sigmaSquared != null && !(sigmaSquared > 0 && Double.isFinite(sigmaSquared))) {
                throw new InvalidParameterException("sigmaSquared must be > 0, got: " + sigmaSquared);
            }
            if (!Double.isFinite(knownMean)) {
                throw new InvalidParameterException("knownMean must be finite, got: " + knownMean);
            }
            if (quantileGridSize != null && quantileGridSize < 1) {
                throw new InvalidParameterException("quantileGridSize must be >= 1, got: " + quantileGridSize);
            }
            return new CostOptions(this);
        }
    }

    @Override
    public String toString() {
        return "CostOptions{" +
                "sigmaSquared=" + Optional.ofNullable(sigmaSquared).map(String::valueOf).orElse("auto") +
                ", knownMean=" + knownMean +
                ", quantileGridSize=" + Optional.ofNullable(quantileGridSize).map(String::valueOf).orElse("auto") +
                '}';
    }
}
