package com.changesentinel.core.cost;

import com.changesentinel.core.model.CostFamily;
import com.changesentinel.core.model.Segment;
import com.changesentinel.core.model.SegmentFit;

import java.util.Map;

/**
 * Change-in-variance cost about a known mean &mu;<sub>0</sub>:
 * m&middot;log &theta;&#770; + m with &theta;&#770; = Σ(y &minus; &mu;<sub>0</sub>)² / m.
 */
final class VarianceCost extends AbstractCostFunction {

    private final double knownMean;

    VarianceCost(PreprocessedSeries series, double knownMean) {
        super(series, CostFamily.VARIANCE, 1);
        this.knownMean = knownMean;
    }

    private double rawVariance(int start, int end) {
        int m = end - start + 1;
        // Σ(y - μ0)² = Σ(z - d)² with z = y - shift, d = μ0 - shift
        double d = knownMean - series.getShift();
        double centered = series.centeredSumOfSquares(start, end)
                - 2 * d * series.centeredSum(start, end)
                + m * d * d;
        return Math.max(centered, 0) / m;
    }

    @Override
    double segmentCost(int start, int end) {
        int m = end - start + 1;
        double theta = Math.max(rawVariance(start, end), EPSILON);
        return m * Math.log(theta) + m;
    }

    @Override
    SegmentFit segmentFit(int start, int end) {
        double theta = rawVariance(start, end);
        return new SegmentFit(Segment.of(start, end), segmentCost(start, end),
                Map.of("variance", Math.max(theta, EPSILON)), theta < EPSILON);
    }
}
