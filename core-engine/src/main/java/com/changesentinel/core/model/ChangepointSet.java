package com.changesentinel.core.model;

import com.changesentinel.core.error.InvalidInputException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered set of changepoints for a series of length {@code n}.
 *
 * <p>
 * Each changepoint &tau; is the <em>last</em> position of a segment: the
 * segment ending at &tau; is followed by one starting at &tau;&nbsp;+&nbsp;1.
 * Entries are strictly increasing and lie in {@code [1, n - 1]}. The empty set
 * means no change was detected.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChangepointSet implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int seriesLength;
    private final int[] points;

    private ChangepointSet(int seriesLength, int[] points) {
        this.seriesLength = seriesLength;
        this.points = points;
    }

    /**
     * @param seriesLength length {@code n} of the segmented series
     * @return a set with no changepoints
     */
    public static ChangepointSet empty(int seriesLength) {
        requireLength(seriesLength);
        return new ChangepointSet(seriesLength, new int[0]);
    }

    /**
     * Create a set from changepoints that are already in ascending order.
     *
     * @param seriesLength length {@code n} of the segmented series
     * @param points       strictly increasing changepoints in {@code [1, n-1]}
     * @return the changepoint set
     * @throws InvalidInputException if the points are out of range, unsorted or
     *                               duplicated
     */
    public static ChangepointSet of(int seriesLength, int... points) {
        requireLength(seriesLength);
        Objects.requireNonNull(points, "Changepoints must not be null");
        int[] copy = points.clone();
        for (int i = 0; i < copy.length; i++) {
            if (copy[i] < 1 || copy[i] > seriesLength - 1) {
                throw new InvalidInputException("Changepoint " + copy[i]
                        + " outside [1, " + (seriesLength - 1) + "]");
            }
            if (i > 0 && copy[i] <= copy[i - 1]) {
                throw new InvalidInputException("Changepoints must be strictly increasing: "
                        + Arrays.toString(copy));
            }
        }
        return new ChangepointSet(seriesLength, copy);
    }

    /**
     * Create a set from changepoints collected in arbitrary order.
     *
     * @param seriesLength length {@code n} of the segmented series
     * @param points       unique changepoints in any order
     * @return the changepoint set
     * @throws InvalidInputException if a point repeats or is out of range
     */
    public static ChangepointSet fromUnordered(int seriesLength, Collection<Integer> points) {
        Objects.requireNonNull(points, "Changepoints must not be null");
        int[] sorted = points.stream().mapToInt(Integer::intValue).sorted().toArray();
        return of(seriesLength, sorted);
    }

    private static void requireLength(int seriesLength) {
        if (seriesLength < 1) {
            throw new InvalidInputException("Series length must be >= 1, got: " + seriesLength);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public int getSeriesLength() {
        return seriesLength;
    }

    public int size() {
        return points.length;
    }

    public boolean isEmpty() {
        return points.length == 0;
    }

    /**
     * @param index zero-based index into the set
     * @return the changepoint at {@code index}
     */
    public int get(int index) {
        return points[index];
    }

    public int[] toArray() {
        return points.clone();
    }

    public List<Integer> asList() {
        List<Integer> list = new ArrayList<>(points.length);
        for (int p : points) {
            list.add(p);
        }
        return Collections.unmodifiableList(list);
    }

    /**
     * Expand the changepoints into the segments they induce. The result always
     * covers {@code [1, n]} exactly, without gaps or overlaps.
     *
     * @return unmodifiable list of {@code size() + 1} segments in order
     */
    public List<Segment> segments() {
        List<Segment> segments = new ArrayList<>(points.length + 1);
        int start = 1;
        for (int p : points) {
            segments.add(Segment.of(start, p));
            start = p + 1;
        }
        segments.add(Segment.of(start, seriesLength));
        return Collections.unmodifiableList(segments);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChangepointSet that))
            return false;
        return seriesLength == that.seriesLength && Arrays.equals(points, that.points);
    }

    @Override
    public int hashCode() {
        return 31 * seriesLength + Arrays.hashCode(points);
    }

    @Override
    public String toString() {
        return "ChangepointSet" + Arrays.toString(points) + " (n=" + seriesLength + ")";
    }
}
