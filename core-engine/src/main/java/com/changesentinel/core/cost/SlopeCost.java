package com.changesentinel.core.cost;

import com.changesentinel.core.model.CostFamily;
import com.changesentinel.core.model.Segment;
import com.changesentinel.core.model.SegmentFit;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Linear-trend cost: residual sum of squares of the least-squares line
 * y = a + b&middot;t over the segment, divided by &sigma;². The line is
 * solved in closed form from the cached Σt, Σt² and the centered Σtz, Σz,
 * Σz²; the slope and the residuals do not depend on the centering.
 */
final class SlopeCost extends AbstractCostFunction {

    private final double sigmaSquared;

    SlopeCost(PreprocessedSeries series, double sigmaSquared) {
        super(series, CostFamily.SLOPE, 2);
        this.sigmaSquared = sigmaSquared;
    }

    @Override
    double segmentCost(int start, int end) {
        int m = end - start + 1;
        double st = series.sumOfT(start, end);
        double sy = series.centeredSum(start, end);
        double stt = series.sumOfTSquared(start, end) - st * st / m;
        double sty = series.centeredSumOfTY(start, end) - st * sy / m;
        double syy = series.centeredSumOfSquares(start, end) - sy * sy / m;
        return Math.max(syy - sty * sty / stt, 0) / sigmaSquared;
    }

    @Override
    SegmentFit segmentFit(int start, int end) {
        int m = end - start + 1;
        double st = series.sumOfT(start, end);
        double sy = series.centeredSum(start, end);
        double stt = series.sumOfTSquared(start, end) - st * st / m;
        double sty = series.centeredSumOfTY(start, end) - st * sy / m;
        double slope = sty / stt;

        Map<String, Double> parameters = new LinkedHashMap<>();
        parameters.put("intercept", series.getShift() + (sy - slope * st) / m);
        parameters.put("slope", slope);
        return new SegmentFit(Segment.of(start, end), segmentCost(start, end), parameters, false);
    }
}
