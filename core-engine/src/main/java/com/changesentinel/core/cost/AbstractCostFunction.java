package com.changesentinel.core.cost;

import com.changesentinel.core.error.InvalidInputException;
import com.changesentinel.core.model.CostFamily;
import com.changesentinel.core.model.SegmentFit;

import java.util.Objects;

/**
 * Range checking shared by every family. Subclasses implement the closed-form
 * cost and fit for a segment already known to be valid.
 */
abstract class AbstractCostFunction implements CostFunction {

    /** Floor applied to variances and probabilities before taking a logarithm. */
    static final double EPSILON = 1e-10;

    final PreprocessedSeries series;
    private final CostFamily family;
    private final int minSegmentLength;

    AbstractCostFunction(PreprocessedSeries series, CostFamily family, int minSegmentLength) {
        this.series = Objects.requireNonNull(series, "PreprocessedSeries must not be null");
        this.family = family;
        this.minSegmentLength = minSegmentLength;
        if (series.length() < minSegmentLength) {
            throw new InvalidInputException(family + " cost needs at least " + minSegmentLength
                    + " observations, series has " + series.length());
        }
    }

    @Override
    public final CostFamily family() {
        return family;
    }

    @Override
    public final PreprocessedSeries series() {
        return series;
    }

    @Override
    public final int minSegmentLength() {
        return minSegmentLength;
    }

    @Override
    public final double cost(int start, int end) {
        check(start, end);
        return segmentCost(start, end);
    }

    @Override
    public final SegmentFit fit(int start, int end) {
        check(start, end);
        return segmentFit(start, end);
    }

    abstract double segmentCost(int start, int end);

    abstract SegmentFit segmentFit(int start, int end);

    private void check(int start, int end) {
        series.checkSegment(start, end);
        if (end - start + 1 < minSegmentLength) {
            throw new InvalidInputException(family + " cost needs segments of at least "
                    + minSegmentLength + " points, got [" + start + ", " + end + "]");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{n=" + series.length() + '}';
    }
}
