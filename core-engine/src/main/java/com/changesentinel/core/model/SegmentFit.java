package com.changesentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maximum-likelihood fit of one segment: its cost, the named parameter
 * estimates and whether a degenerate statistic had to be floored.
 *
 * @since 1.0.0
 */
public final class SegmentFit implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Segment segment;
    private final double cost;
    private final Map<String, Double> parameters;
    private final boolean degenerate;

    /**
     * @param segment    the fitted segment
     * @param cost       segment cost on the {@code -2 log L} scale
     * @param parameters parameter estimates keyed by name; copied
     * @param degenerate {@code true} if a variance or probability was floored
     */
    public SegmentFit(Segment segment, double cost, Map<String, Double> parameters, boolean degenerate) {
        this.segment = Objects.requireNonNull(segment, "segment must not be null");
        this.cost = cost;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(parameters, "parameters must not be null")));
        this.degenerate = degenerate;
    }

    public Segment getSegment() {
        return segment;
    }

    public double getCost() {
        return cost;
    }

    /**
     * @return unmodifiable parameter estimates in insertion order
     */
    public Map<String, Double> getParameters() {
        return parameters;
    }

    /**
     * @param name parameter name, e.g. {@code "mean"}
     * @return the estimate
     * @throws IllegalArgumentException if this fit has no such parameter
     */
    public double getParameter(String name) {
        Double value = parameters.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No parameter '" + name + "' in fit of " + segment);
        }
        return value;
    }

    public boolean isDegenerate() {
        return degenerate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SegmentFit that))
            return false;
        return Double.compare(cost, that.cost) == 0
                && degenerate == that.degenerate
                && segment.equals(that.segment)
                && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segment, cost, parameters, degenerate);
    }

    @Override
    public String toString() {
        return "SegmentFit{" + segment + ", cost=" + cost + ", " + parameters
                + (degenerate ? ", degenerate" : "") + '}';
    }
}
