package com.changesentinel.core.cost;

import com.changesentinel.core.model.CostFamily;
import com.changesentinel.core.model.Segment;
import com.changesentinel.core.model.SegmentFit;

import java.util.Map;

/**
 * Change-in-mean cost with known variance:
 * (Σy² &minus; m&middot;&#563;²) / &sigma;².
 */
final class MeanCost extends AbstractCostFunction {

    private final double sigmaSquared;

    MeanCost(PreprocessedSeries series, double sigmaSquared) {
        super(series, CostFamily.MEAN, 1);
        this.sigmaSquared = sigmaSquared;
    }

    @Override
    double segmentCost(int start, int end) {
        int m = end - start + 1;
        if (m == 1) {
            return 0;
        }
        double s = series.centeredSum(start, end);
        double rss = series.centeredSumOfSquares(start, end) - s * s / m;
        // prefix differences can dip a hair below zero
        return Math.max(rss, 0) / sigmaSquared;
    }

    @Override
    SegmentFit segmentFit(int start, int end) {
        return new SegmentFit(Segment.of(start, end), segmentCost(start, end),
                Map.of("mean", series.mean(start, end)), false);
    }
}
