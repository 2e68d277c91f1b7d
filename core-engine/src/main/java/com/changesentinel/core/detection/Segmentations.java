package com.changesentinel.core.detection;

import com.changesentinel.core.cost.CostFunction;
import com.changesentinel.core.error.InvalidParameterException;
import com.changesentinel.core.model.ChangepointSet;
import com.changesentinel.core.model.SegmentFit;
import com.changesentinel.core.model.SegmentationResult;

import java.util.List;

/**
 * Helpers shared by the multiple-changepoint segmenters.
 */
final class Segmentations {

    private Segmentations() {
        // utility class - not instantiable
    }

    static void requirePenalty(double penalty) {
        if (!(penalty >= 0) || Double.isInfinite(penalty)) {
            throw new InvalidParameterException("Penalty must be a finite value >= 0, got: " + penalty);
        }
    }

    /**
     * Fit every segment induced by {@code changepoints} and package the result.
     */
    static SegmentationResult assemble(String method, CostFunction cost, ChangepointSet changepoints,
                                       double penalty) {
        List<SegmentFit> fits = changepoints.segments().stream()
                .map(cost::fit)
                .toList();
        return SegmentationResult.builder()
                .method(method)
                .family(cost.family())
                .changepoints(changepoints)
                .fits(fits)
                .penalty(penalty)
                .build();
    }
}
