package com.changesentinel.core.calibration;

import com.changesentinel.core.error.InvalidInputException;
import com.changesentinel.core.error.InvalidParameterException;
import com.changesentinel.core.model.CalibrationMethod;
import com.changesentinel.core.model.CalibrationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AsymptoticCalibrator} and {@link FixedThreshold}.
 */
class AsymptoticCalibratorTest {

    private final AsymptoticCalibrator calibrator = new AsymptoticCalibrator();

    @Test
    @DisplayName("Should match the Gumbel limit for n=100, alpha=0.05")
    void shouldMatchClosedForm() {
        CalibrationResult result = calibrator.calibrate(100, 0.05);

        assertThat(result.getMethod()).isEqualTo(CalibrationMethod.ASYMPTOTIC);
        assertThat(result.getThreshold()).isCloseTo(9.257, within(0.01));
        assertThat(result.getReplicates()).isZero();
        assertThat(result.hasWarnings()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(ints = {20, 100, 1000, 10000})
    @DisplayName("Smaller alpha should give a larger threshold")
    void shouldDecreaseWithAlpha(int n) {
        assertThat(calibrator.calibrate(n, 0.01).getThreshold())
                .isGreaterThan(calibrator.calibrate(n, 0.05).getThreshold());
    }

    @Test
    @DisplayName("Should be more conservative than simulation at moderate n")
    void shouldBeConservative() {
        double asymptotic = calibrator.calibrate(100, 0.05).getThreshold();
        double simulated = MonteCarloCalibrator.builder().replicates(2000).seed(3L).build()
                .calibrate(100, 0.05).getThreshold();

        assertThat(asymptotic).isGreaterThan(simulated);
    }

    @Test
    @DisplayName("Should reject alpha outside (0, 1) and n below 3")
    void shouldRejectBadArguments() {
        assertThatThrownBy(() -> calibrator.calibrate(100, 0.0)).isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> calibrator.calibrate(100, 1.0)).isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> calibrator.calibrate(2, 0.05)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Fixed threshold should be returned unchanged")
    void fixedThresholdShouldPassThrough() {
        CalibrationResult result = new FixedThreshold(12.5).calibrate(40, 0.1);

        assertThat(result.getThreshold()).isEqualTo(12.5);
        assertThat(result.getMethod()).isEqualTo(CalibrationMethod.MANUAL);
        assertThatThrownBy(() -> new FixedThreshold(0.0)).isInstanceOf(InvalidParameterException.class);
    }
}
