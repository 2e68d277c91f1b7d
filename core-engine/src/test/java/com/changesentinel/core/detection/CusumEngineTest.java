package com.changesentinel.core.detection;

import com.changesentinel.core.calibration.MonteCarloCalibrator;
import com.changesentinel.core.cost.PreprocessedSeries;
import com.changesentinel.core.error.InvalidParameterException;
import com.changesentinel.core.model.SingleChangeResult;
import com.changesentinel.core.model.Series;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CusumEngine}.
 */
class CusumEngineTest {

    private static final PreprocessedSeries EXAMPLE = PreprocessedSeries.of(Series.of(0.5, -0.1, 12.1, 12.4));

    private final CusumEngine engine = new CusumEngine();

    @Test
    @DisplayName("Should reproduce the four-point worked example")
    void shouldReproduceWorkedExample() {
        SingleChangeResult result = engine.test(EXAMPLE, 9.0);

        assertThat(result.getTrace()).hasSize(3);
        assertThat(result.getTrace()[0]).isCloseTo(6.61, within(0.01));
        assertThat(result.getTrace()[1]).isCloseTo(12.05, within(0.01));
        assertThat(result.getTrace()[2]).isCloseTo(7.13, within(0.01));
        assertThat(result.getChangepoint()).isEqualTo(2);
        assertThat(result.getMaxStatistic()).isCloseTo(12.05, within(1e-9));
        assertThat(result.getSquaredStatistic()).isCloseTo(12.05 * 12.05, within(1e-9));
        assertThat(result.getSizeOfChange()).isCloseTo(12.05, within(1e-9));
        assertThat(result.isChangeDetected()).isTrue();
        assertThat(result.toChangepointSet(4).asList()).containsExactly(2);
    }

    @Test
    @DisplayName("Should compare the squared statistic against the threshold")
    void shouldUseSquaredUnits() {
        // C_max = 12.05, so 150 is above C_max but below C_max^2
        assertThat(engine.test(EXAMPLE, 150.0).isChangeDetected()).isFalse();
        assertThat(engine.test(EXAMPLE, 140.0).isChangeDetected()).isTrue();
        assertThat(engine.test(EXAMPLE, 150.0).toChangepointSet(4).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("A large constant offset should leave the trace unchanged")
    void shouldIgnoreConstantOffset() {
        SingleChangeResult plain = engine.test(
                PreprocessedSeries.of(OptimalPartitioningTest.offsetStep(0.0)), 20.0);
        SingleChangeResult shifted = engine.test(
                PreprocessedSeries.of(OptimalPartitioningTest.offsetStep(1e8)), 20.0);

        assertThat(shifted.isChangeDetected()).isTrue();
        assertThat(shifted.getChangepoint()).isEqualTo(plain.getChangepoint());
        assertThat(shifted.getMaxStatistic()).isCloseTo(plain.getMaxStatistic(), within(1e-4));
        assertThat(shifted.getSizeOfChange()).isCloseTo(plain.getSizeOfChange(), within(1e-4));
    }

    @Test
    @DisplayName("Should scale by the known noise variance")
    void shouldScaleByVariance() {
        double plain = engine.maxSquaredStatistic(EXAMPLE);
        double scaled = new CusumEngine(4.0).maxSquaredStatistic(EXAMPLE);
        double fromSeries = engine.maxSquaredStatistic(PreprocessedSeries.of(
                Series.withKnownVariance(new double[] {0.5, -0.1, 12.1, 12.4}, 4.0)));

        assertThat(scaled).isCloseTo(plain / 4.0, within(1e-9));
        assertThat(fromSeries).isCloseTo(scaled, within(1e-9));
    }

    @Test
    @DisplayName("Ties in the maximum should resolve to the smallest split")
    void shouldBreakTiesLow() {
        SingleChangeResult result = engine.test(PreprocessedSeries.of(Series.of(1.0, 1.0)), 1.0);

        assertThat(result.getChangepoint()).isEqualTo(1);
        assertThat(result.getMaxStatistic()).isZero();
        assertThat(result.isChangeDetected()).isFalse();
    }

    @Test
    @DisplayName("Should reject non-positive thresholds")
    void shouldRejectBadThreshold() {
        assertThatThrownBy(() -> engine.test(EXAMPLE, 0.0)).isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> new CusumEngine(-1.0)).isInstanceOf(InvalidParameterException.class);
    }

    @Test
    @DisplayName("False-positive rate under a Monte Carlo threshold should be close to alpha")
    void shouldHoldFalsePositiveRate() {
        int n = 50;
        double alpha = 0.05;
        double threshold = MonteCarloCalibrator.builder()
                .replicates(2000)
                .seed(1L)
                .build()
                .calibrate(n, alpha)
                .getThreshold();

        Well19937c rng = new Well19937c(987654321L);
        int trials = 600;
        int rejections = 0;
        for (int trial = 0; trial < trials; trial++) {
            double[] y = new double[n];
            for (int t = 0; t < n; t++) {
                y[t] = rng.nextGaussian();
            }
            if (engine.test(PreprocessedSeries.of(Series.of(y)), threshold).isChangeDetected()) {
                rejections++;
            }
        }

        assertThat((double) rejections / trials).isBetween(0.02, 0.09);
    }
}
