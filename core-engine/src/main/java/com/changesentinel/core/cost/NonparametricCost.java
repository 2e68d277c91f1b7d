package com.changesentinel.core.cost;

import com.changesentinel.core.model.CostFamily;
import com.changesentinel.core.model.Segment;
import com.changesentinel.core.model.SegmentFit;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Empirical-CDF cost of Haynes, Fearnhead &amp; Eckley (2017):
 * &minus;m&middot;Σ<sub>k</sub> [F&#770;<sub>k</sub> log F&#770;<sub>k</sub> +
 * (1&minus;F&#770;<sub>k</sub>) log(1&minus;F&#770;<sub>k</sub>)], with
 * F&#770;<sub>k</sub> the segment's CDF at grid quantile k. Each query costs
 * O(K).
 *
 * <p>
 * F&#770; is clamped into [&epsilon;, 1&minus;&epsilon;]. A segment is reported
 * degenerate when every grid point needed clamping, i.e. the grid cannot see
 * any spread inside it.
 * </p>
 */
final class NonparametricCost extends AbstractCostFunction {

    private final QuantileGrid grid;

    NonparametricCost(PreprocessedSeries series, int gridSize) {
        super(series, CostFamily.NONPARAMETRIC, 1);
        this.grid = series.quantileGrid(gridSize);
    }

    @Override
    double segmentCost(int start, int end) {
        int m = end - start + 1;
        double entropy = 0;
        for (int k = 0; k < grid.size(); k++) {
            double f = clamp(grid.cdf(k, start, end));
            entropy += f * Math.log(f) + (1 - f) * Math.log(1 - f);
        }
        return -m * entropy;
    }

    @Override
    SegmentFit segmentFit(int start, int end) {
        int clamped = 0;
        double median = grid.quantile(grid.size() - 1);
        boolean medianFound = false;
        for (int k = 0; k < grid.size(); k++) {
            double f = grid.cdf(k, start, end);
            if (f < EPSILON || f > 1 - EPSILON) {
                clamped++;
            }
            if (!medianFound && f >= 0.5) {
                median = grid.quantile(k);
                medianFound = true;
            }
        }
        Map<String, Double> parameters = new LinkedHashMap<>();
        parameters.put("median", median);
        parameters.put("gridSize", (double) grid.size());
        return new SegmentFit(Segment.of(start, end), segmentCost(start, end), parameters,
                clamped == grid.size());
    }

    private static double clamp(double f) {
        return Math.min(Math.max(f, EPSILON), 1 - EPSILON);
    }

    QuantileGrid grid() {
        return grid;
    }
}
