package com.changesentinel.core.cost;

import com.changesentinel.core.model.CostFamily;
import com.changesentinel.core.model.Segment;
import com.changesentinel.core.model.SegmentFit;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Joint mean-and-variance cost: m&middot;log &sigma;&#770;² + m, where
 * &sigma;&#770;² is the MLE (divide-by-m) variance of the segment.
 */
final class MeanVarianceCost extends AbstractCostFunction {

    MeanVarianceCost(PreprocessedSeries series) {
        super(series, CostFamily.MEAN_AND_VARIANCE, 2);
    }

    private double rawVariance(int start, int end) {
        int m = end - start + 1;
        double s = series.centeredSum(start, end);
        return Math.max(series.centeredSumOfSquares(start, end) - s * s / m, 0) / m;
    }

    @Override
    double segmentCost(int start, int end) {
        int m = end - start + 1;
        return m * Math.log(Math.max(rawVariance(start, end), EPSILON)) + m;
    }

    @Override
    SegmentFit segmentFit(int start, int end) {
        double variance = rawVariance(start, end);
        Map<String, Double> parameters = new LinkedHashMap<>();
        parameters.put("mean", series.mean(start, end));
        parameters.put("variance", Math.max(variance, EPSILON));
        return new SegmentFit(Segment.of(start, end), segmentCost(start, end), parameters, variance < EPSILON);
    }
}
