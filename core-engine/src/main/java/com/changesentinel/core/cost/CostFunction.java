package com.changesentinel.core.cost;

import com.changesentinel.core.model.CostFamily;
import com.changesentinel.core.model.Segment;
import com.changesentinel.core.model.SegmentFit;

/**
 * Segment cost for one model family, bound to one {@link PreprocessedSeries}.
 *
 * <p>
 * The cost of a segment is twice the negative log-likelihood of its data
 * under the segment's own maximum-likelihood parameters, with additive
 * constants dropped. Every query is answered from cached prefix statistics;
 * raw data is never rescanned.
 * </p>
 *
 * <p>
 * Implementations are stateless apart from the series reference and may be
 * shared between threads. Instances are obtained from
 * {@link CostFunctions#create}.
 * </p>
 *
 * @since 1.0.0
 */
public interface CostFunction {

    CostFamily family();

    PreprocessedSeries series();

    /**
     * @return shortest segment this family can fit
     */
    int minSegmentLength();

    /**
     * @param start first position, inclusive, 1-based
     * @param end   last position, inclusive
     * @return the segment cost, always finite
     * @throws com.changesentinel.core.error.InvalidInputException if the
     *         segment is out of range or shorter than {@link #minSegmentLength()}
     */
    double cost(int start, int end);

    /**
     * Fit the segment and report its cost together with the parameter
     * estimates.
     *
     * @param start first position, inclusive, 1-based
     * @param end   last position, inclusive
     * @return the fit
     */
    SegmentFit fit(int start, int end);

    default double cost(Segment segment) {
        return cost(segment.getStart(), segment.getEnd());
    }

    default SegmentFit fit(Segment segment) {
        return fit(segment.getStart(), segment.getEnd());
    }
}
