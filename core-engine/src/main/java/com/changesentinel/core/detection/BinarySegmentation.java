package com.changesentinel.core.detection;

import com.changesentinel.core.cost.CostFunction;
import com.changesentinel.core.error.InvalidParameterException;
import com.changesentinel.core.model.ChangepointSet;
import com.changesentinel.core.model.SegmentationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Binary Segmentation: greedy split-and-test multiple-changepoint search.
 *
 * <p>
 * For a segment [s, t] the best split is the &tau; minimising
 * </p>
 *
 * <pre>
 *   Q(tau) = cost(s, tau) + cost(tau + 1, t) - cost(s, t) + penalty
 * </pre>
 *
 * <p>
 * over every &tau; that leaves both halves at least the family's minimum
 * length. The split is accepted only if Q &lt; 0 (a tie at zero does not
 * split); both halves are then searched independently. A segment too short to
 * split is terminal.
 * </p>
 *
 * <h3>Worklist</h3>
 * <p>
 * Pending splits are held in a priority queue ordered by Q (most negative
 * first), then by segment start. Without a cap the accepted set is the same
 * as plain recursion produces; with a cap the strongest splits are taken
 * first. The queue keeps memory bounded by the number of accepted splits and
 * avoids deep call stacks.
 * </p>
 *
 * <h3>Limitations</h3>
 * <p>
 * Each decision sees only the current segment, so two nearby changes whose
 * effects cancel (masking) can be missed or misplaced. The result is a local
 * optimum; {@link OptimalPartitioning} gives the global one.
 * </p>
 *
 * @since 1.0.0
 */
public final class BinarySegmentation {

    private static final Logger LOG = LoggerFactory.getLogger(BinarySegmentation.class);

    public static final String METHOD = "binseg";

    private static final Comparator<Split> ORDER = Comparator
            .comparingDouble((Split s) -> s.gain)
            .thenComparingInt(s -> s.start);

    private final int maxChangepoints;

    public BinarySegmentation() {
        this(Integer.MAX_VALUE);
    }

    /**
     * @param maxChangepoints stop after this many accepted splits, &ge; 0
     */
    public BinarySegmentation(int maxChangepoints) {
        if (maxChangepoints < 0) {
            throw new InvalidParameterException("maxChangepoints must be >= 0, got: " + maxChangepoints);
        }
        this.maxChangepoints = maxChangepoints;
    }

    /**
     * Segment the series bound to {@code cost}.
     *
     * @param cost    cost function for the chosen family
     * @param penalty per-changepoint penalty &beta; &ge; 0
     * @return changepoints, per-segment fits and penalized cost
     */
    public SegmentationResult segment(CostFunction cost, double penalty) {
        Objects.requireNonNull(cost, "CostFunction must not be null");
        Segmentations.requirePenalty(penalty);
        int n = cost.series().length();

        PriorityQueue<Split> pending = new PriorityQueue<>(ORDER);
        offer(pending, cost, 1, n, penalty);

        List<Integer> accepted = new ArrayList<>();
        while (!pending.isEmpty() && accepted.size() < maxChangepoints) {
            Split split = pending.poll();
            accepted.add(split.tau);
            LOG.debug("Split [{}, {}] at tau={} (Q={})", split.start, split.end, split.tau, split.gain);
            offer(pending, cost, split.start, split.tau, penalty);
            offer(pending, cost, split.tau + 1, split.end, penalty);
        }

        ChangepointSet changepoints = ChangepointSet.fromUnordered(n, accepted);
        LOG.debug("Binary segmentation found {} changepoint(s) for n={}", changepoints.size(), n);
        return Segmentations.assemble(METHOD, cost, changepoints, penalty);
    }

    private static void offer(PriorityQueue<Split> pending, CostFunction cost, int start, int end,
                              double penalty) {
        Split best = bestSplit(cost, start, end, penalty);
        if (best != null && best.gain < 0) {
            pending.add(best);
        }
    }

    /**
     * @return the minimising split of {@code [start, end]}, or {@code null} if
     *         the segment is too short to split
     */
    static Split bestSplit(CostFunction cost, int start, int end, double penalty) {
        int minLength = cost.minSegmentLength();
        int first = start + minLength - 1;
        int last = end - minLength;
        if (first > last) {
            return null;
        }
        double whole = cost.cost(start, end);
        int bestTau = first;
        double bestGain = Double.POSITIVE_INFINITY;
        for (int tau = first; tau <= last; tau++) {
            double gain = cost.cost(start, tau) + cost.cost(tau + 1, end) - whole + penalty;
            if (gain < bestGain) {
                bestGain = gain;
                bestTau = tau;
            }
        }
        return new Split(start, end, bestTau, bestGain);
    }

    static final class Split {
        final int start;
        final int end;
        final int tau;
        final double gain;

        Split(int start, int end, int tau, double gain) {
            this.start = start;
            this.end = end;
            this.tau = tau;
            this.gain = gain;
        }
    }

    public int getMaxChangepoints() {
        return maxChangepoints;
    }
}
