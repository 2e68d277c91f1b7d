package com.changesentinel.core.model;

import com.changesentinel.core.error.InvalidInputException;

import java.io.Serializable;

/**
 * Closed, contiguous interval {@code [start, end]} of 1-based series
 * positions. Zero-length segments cannot be constructed.
 *
 * @since 1.0.0
 */
public final class Segment implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int start;
    private final int end;

    private Segment(int start, int end) {
        this.start = start;
        this.end = end;
    }

    /**
     * @param start first position, inclusive, &ge; 1
     * @param end   last position, inclusive, &ge; {@code start}
     * @return the segment
     * @throws InvalidInputException if the bounds do not form a valid interval
     */
    public static Segment of(int start, int end) {
        if (start < 1) {
            throw new InvalidInputException("Segment start must be >= 1, got: " + start);
        }
        if (end < start) {
            throw new InvalidInputException("Segment end " + end + " precedes start " + start);
        }
        return new Segment(start, end);
    }

    /**
     * Check that this segment lies inside a series of length {@code n}.
     *
     * @param n series length
     * @return this segment
     * @throws InvalidInputException if {@code end > n}
     */
    public Segment requireWithin(int n) {
        if (end > n) {
            throw new InvalidInputException("Segment " + this + " exceeds series length " + n);
        }
        return this;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Segment that))
            return false;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
