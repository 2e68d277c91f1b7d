package com.changesentinel.core.calibration;

import com.changesentinel.core.cost.PreprocessedSeries;
import com.changesentinel.core.detection.CancellationSignal;
import com.changesentinel.core.detection.CusumEngine;
import com.changesentinel.core.error.CalibrationException;
import com.changesentinel.core.error.InvalidParameterException;
import com.changesentinel.core.model.CalibrationMethod;
import com.changesentinel.core.model.CalibrationResult;
import com.changesentinel.core.model.Series;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simulation-based CUSUM threshold.
 *
 * <p>
 * Generates R independent null series of length n (i.i.d. standard normal, no
 * change), records C<sub>max</sub>&sup2; of each with a {@link CusumEngine}
 * and returns the empirical (1&minus;&alpha;) quantile of the R maxima
 * (type-7 estimator, as R's {@code quantile}). Markedly less conservative
 * than {@link AsymptoticCalibrator} at practical lengths.
 * </p>
 *
 * <h3>Reproducibility</h3>
 * <p>
 * Replicate {@code i} draws from its own {@link Well19937c} seeded with
 * {@code (seed, i)}, so the maxima and the threshold are identical for any
 * {@code parallelism}.
 * </p>
 *
 * <h3>Parallelism</h3>
 * <p>
 * With {@code parallelism > 1} replicates run on a fixed pool of daemon
 * threads created per call and shut down before returning. Results are joined
 * in replicate order. A failing replicate aborts the whole calibration with a
 * {@link CalibrationException} naming it; nothing is dropped silently.
 * </p>
 *
 * <h3>Warnings</h3>
 * <p>
 * Runs with fewer than {@value #RECOMMENDED_REPLICATES} replicates, or with
 * fewer than {@value #MIN_TAIL_REPLICATES} replicates expected beyond the
 * threshold, return a result carrying a non-convergence warning.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonteCarloCalibrator implements ThresholdCalibrator {

    private static final Logger LOG = LoggerFactory.getLogger(MonteCarloCalibrator.class);

    public static final int RECOMMENDED_REPLICATES = 1_000;
    static final int MIN_TAIL_REPLICATES = 10;

    /** Computes one replicate maximum; replaceable in tests. */
    interface Replicate {
        double simulate(int n, int index);
    }

    private final int replicates;
    private final long seed;
    private final int parallelism;
    private final CancellationSignal signal;
    private final CusumEngine engine = new CusumEngine(1.0);
    private final Replicate replicate;

    private MonteCarloCalibrator(Builder b) {
        this.replicates = b.replicates;
        this.seed = b.seed;
        this.parallelism = b.parallelism;
        this.signal = b.signal;
        this.replicate = b.replicate != null ? b.replicate : this::simulateNull;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public CalibrationResult calibrate(int n, double alpha) {
        CalibrationArguments.check(n, Series.MIN_LENGTH, alpha);
        LOG.debug("Monte Carlo calibration: n={}, alpha={}, replicates={}, parallelism={}",
                n, alpha, replicates, parallelism);

        double[] maxima = parallelism == 1 ? runSerially(n) : runInParallel(n);
        double threshold = new Percentile()
                .withEstimationType(EstimationType.R_7)
                .evaluate(maxima, 100.0 * (1 - alpha));

        List<String> warnings = new ArrayList<>();
        if (replicates < RECOMMENDED_REPLICATES) {
            warnings.add("Only " + replicates + " replicates; at least " + RECOMMENDED_REPLICATES
                    + " are recommended for a stable quantile");
        }
        if (replicates * alpha < MIN_TAIL_REPLICATES) {
            warnings.add(String.format("Only %.1f replicates expected beyond the %.4f quantile; "
                    + "the tail estimate is unreliable", replicates * alpha, 1 - alpha));
        }
        for (String warning : warnings) {
            LOG.warn("Calibration n={} alpha={}: {}", n, alpha, warning);
        }

        LOG.debug("Monte Carlo threshold for n={}, alpha={}: {}", n, alpha, threshold);
        return new CalibrationResult(CalibrationMethod.MONTE_CARLO, n, alpha, threshold, maxima, warnings);
    }

    private double[] runSerially(int n) {
        double[] maxima = new double[replicates];
        for (int i = 0; i < replicates; i++) {
            signal.throwIfCancelled("Monte Carlo calibration");
            maxima[i] = runReplicate(n, i);
        }
        return maxima;
    }

    private double[] runInParallel(int n) {
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "mc-calibration-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<Double>> futures = new ArrayList<>(replicates);
            for (int i = 0; i < replicates; i++) {
                int index = i;
                futures.add(pool.submit(() -> {
                    signal.throwIfCancelled("Monte Carlo calibration");
                    return runReplicate(n, index);
                }));
            }

            double[] maxima = new double[replicates];
            for (int i = 0; i < replicates; i++) {
                try {
                    maxima[i] = futures.get(i).get();
                } catch (ExecutionException e) {
                    futures.forEach(f -> f.cancel(true));
                    if (e.getCause() instanceof RuntimeException cause) {
                        throw cause;
                    }
                    throw new CalibrationException(i, e.getCause());
                }
            }
            return maxima;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Monte Carlo calibration interrupted");
            cancelled.initCause(e);
            throw cancelled;
        } finally {
            pool.shutdownNow();
        }
    }

    private double runReplicate(int n, int index) {
        try {
            return replicate.simulate(n, index);
        } catch (CancellationException | CalibrationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CalibrationException(index, e);
        }
    }

    private double simulateNull(int n, int index) {
        RandomGenerator rng = new Well19937c(new int[] {(int) seed, (int) (seed >>> 32), index});
        double[] values = new double[n];
        for (int t = 0; t < n; t++) {
            values[t] = rng.nextGaussian();
        }
        return engine.maxSquaredStatistic(PreprocessedSeries.of(Series.of(values)));
    }

    @Override
    public CalibrationMethod method() {
        return CalibrationMethod.MONTE_CARLO;
    }

    public int getReplicates() {
        return replicates;
    }

    public long getSeed() {
        return seed;
    }

    public int getParallelism() {
        return parallelism;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link MonteCarloCalibrator}. Defaults:
     * {@value #RECOMMENDED_REPLICATES} replicates, seed 42, one thread, no
     * cancellation.
     */
    public static class Builder {
        private int replicates = RECOMMENDED_REPLICATES;
        private long seed = 42L;
        private int parallelism = 1;
        private CancellationSignal signal = CancellationSignal.none();
        private Replicate replicate;

        public Builder replicates(int v) {
            this.replicates = v;
            return this;
        }

        public Builder seed(long v) {
            this.seed = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder cancellationSignal(CancellationSignal v) {
            this.signal = v;
            return this;
        }

        Builder replicate(Replicate v) {
            this.replicate = v;
            return this;
        }

        /**
         * @throws InvalidParameterException if replicates or parallelism is
         *                                   below one
         */
        public MonteCarloCalibrator build() {
            if (replicates < 1) {
                throw new InvalidParameterException("replicates must be >= 1, got: " + replicates);
            }
            if (parallelism < 1) {
                throw new InvalidParameterException("parallelism must be >= 1, got: " + parallelism);
            }
            Objects.requireNonNull(signal, "CancellationSignal must not be null");
            return new MonteCarloCalibrator(this);
        }
    }
}
