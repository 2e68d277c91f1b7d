package com.changesentinel.core.cost;

import com.changesentinel.core.model.CostFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Factory for {@link CostFunction} instances.
 *
 * <p>
 * This is the single place a family is mapped to its implementation; adding a
 * family means adding a {@link CostFamily} constant and a case here.
 * </p>
 *
 * @since 1.0.0
 */
public final class CostFunctions {

    private static final Logger LOG = LoggerFactory.getLogger(CostFunctions.class);

    private CostFunctions() {
        // utility class - not instantiable
    }

    /**
     * Create a cost function with default options.
     */
    public static CostFunction create(CostFamily family, PreprocessedSeries series) {
        return create(family, series, CostOptions.defaults());
    }

    /**
     * Create a cost function for the given family.
     *
     * @param family  model family; must not be {@code null}
     * @param series  preprocessed series the cost will query
     * @param options family-specific settings
     * @return the bound cost function
     */
    public static CostFunction create(CostFamily family, PreprocessedSeries series, CostOptions options) {
        Objects.requireNonNull(family, "CostFamily must not be null");
        Objects.requireNonNull(series, "PreprocessedSeries must not be null");
        Objects.requireNonNull(options, "CostOptions must not be null");

        double sigmaSquared = options.getSigmaSquared().orElse(series.getSeries().varianceOrUnit());
        CostFunction cost = switch (family) {
            case MEAN -> new MeanCost(series, sigmaSquared);
            case VARIANCE -> new VarianceCost(series, options.getKnownMean());
            case MEAN_AND_VARIANCE -> new MeanVarianceCost(series);
            case SLOPE -> new SlopeCost(series, sigmaSquared);
            case NONPARAMETRIC -> new NonparametricCost(series,
                    options.getQuantileGridSize().orElse(CostOptions.defaultGridSize(series.length())));
        };
        LOG.debug("Created {} for n={} with {}", cost.getClass().getSimpleName(), series.length(), options);
        return cost;
    }
}
