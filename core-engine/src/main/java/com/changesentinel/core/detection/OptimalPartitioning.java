package com.changesentinel.core.detection;

import com.changesentinel.core.cost.CostFunction;
import com.changesentinel.core.model.ChangepointSet;
import com.changesentinel.core.model.SegmentationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Optimal Partitioning: exact dynamic program for the minimum penalized
 * segmentation cost.
 *
 * <pre>
 *   Q[0] = -penalty
 *   Q[t] = min over tau &lt; t of  Q[tau] + cost(tau + 1, t) + penalty
 * </pre>
 *
 * <p>
 * The minimising &tau; (smallest on ties) is stored as a back-pointer and the
 * changepoints are recovered by walking back from n. Q[n] equals the sum of
 * segment costs plus penalty per changepoint, minimised over every possible
 * number and placement of changepoints, so the result never costs more than
 * {@link BinarySegmentation}'s for the same penalty.
 * </p>
 *
 * <p>
 * With penalty 0 every extra split is free, so on continuous data the
 * optimum puts each observation in its own segment (n&minus;1 changepoints
 * for the MEAN family). This is the expected behaviour of an unpenalized
 * likelihood, not a defect.
 * </p>
 *
 * <p>
 * Costs O(n²) evaluations without pruning. A {@link PruningStrategy} can
 * discard candidates that can never be optimal again; the PELT strategy keeps
 * the result identical while typically running in near-linear time.
 * </p>
 *
 * @since 1.0.0
 */
public final class OptimalPartitioning {

    private static final Logger LOG = LoggerFactory.getLogger(OptimalPartitioning.class);

    public static final String METHOD = "op";
    public static final String PELT_METHOD = "pelt";

    private final PruningStrategy pruning;

    public OptimalPartitioning() {
        this(PruningStrategy.none());
    }

    public OptimalPartitioning(PruningStrategy pruning) {
        this.pruning = Objects.requireNonNull(pruning, "PruningStrategy must not be null");
    }

    public SegmentationResult segment(CostFunction cost, double penalty) {
        return segment(cost, penalty, CancellationSignal.none());
    }

    /**
     * Segment the series bound to {@code cost}.
     *
     * @param cost    cost function for the chosen family
     * @param penalty per-changepoint penalty &beta; &ge; 0
     * @param signal  checked once per step t
     * @return the optimal changepoints, fits and penalized cost
     * @throws java.util.concurrent.CancellationException if the signal fires
     */
    public SegmentationResult segment(CostFunction cost, double penalty, CancellationSignal signal) {
        Objects.requireNonNull(cost, "CostFunction must not be null");
        Objects.requireNonNull(signal, "CancellationSignal must not be null");
        Segmentations.requirePenalty(penalty);

        int n = cost.series().length();
        int minLength = cost.minSegmentLength();

        double[] optimum = new double[n + 1];
        int[] previous = new int[n + 1];
        Arrays.fill(optimum, Double.POSITIVE_INFINITY);
        optimum[0] = -penalty;

        // live candidates, kept ascending so the first minimiser is the smallest tau
        int[] candidates = new int[n + 1];
        double[] values = new double[n + 1];
        // step from which a pruned candidate may be dropped; t is not a valid
        // last changepoint before t + minLength, so pruning waits until then
        int[] dropFrom = new int[n + 1];
        int live = 0;
        long evaluations = 0;

        for (int t = 1; t <= n; t++) {
            signal.throwIfCancelled("Optimal partitioning");

            int kept = 0;
            for (int i = 0; i < live; i++) {
                if (dropFrom[i] > t) {
                    candidates[kept] = candidates[i];
                    dropFrom[kept] = dropFrom[i];
                    kept++;
                }
            }
            live = kept;

            int entering = t - minLength;
            if (entering >= 0 && Double.isFinite(optimum[entering])) {
                candidates[live] = entering;
                dropFrom[live] = Integer.MAX_VALUE;
                live++;
            }
            if (live == 0) {
                continue;
            }

            double best = Double.POSITIVE_INFINITY;
            int bestTau = -1;
            for (int i = 0; i < live; i++) {
                int tau = candidates[i];
                double value = optimum[tau] + cost.cost(tau + 1, t);
                values[i] = value;
                if (value + penalty < best) {
                    best = value + penalty;
                    bestTau = tau;
                }
            }
            evaluations += live;
            optimum[t] = best;
            previous[t] = bestTau;

            for (int i = 0; i < live; i++) {
                if (dropFrom[i] == Integer.MAX_VALUE && !pruning.keep(values[i], best)) {
                    dropFrom[i] = t + minLength;
                }
            }
        }

        List<Integer> points = new ArrayList<>();
        for (int t = previous[n]; t > 0; t = previous[t]) {
            points.add(t);
        }
        ChangepointSet changepoints = ChangepointSet.fromUnordered(n, points);

        String method = pruning == PruningStrategy.pelt() ? PELT_METHOD : METHOD;
        LOG.debug("{} found {} changepoint(s) for n={} using {} cost evaluations (Q[n]={})",
                method, changepoints.size(), n, evaluations, optimum[n]);
        return Segmentations.assemble(method, cost, changepoints, penalty);
    }

    public PruningStrategy getPruning() {
        return pruning;
    }
}
