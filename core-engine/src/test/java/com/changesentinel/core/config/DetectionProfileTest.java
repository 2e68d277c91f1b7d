package com.changesentinel.core.config;

import com.changesentinel.core.cost.PenaltyCriterion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionProfile#validate()}.
 */
class DetectionProfileTest {

    @Test
    @DisplayName("Should default to BIC without a penalty and MANUAL with one")
    void shouldResolvePenaltyCriterion() {
        DetectionProfile profile = profile("op");
        assertThat(profile.penaltyCriterion()).isEqualTo(PenaltyCriterion.BIC);

        profile.setPenalty(4.0);
        assertThat(profile.penaltyCriterion()).isEqualTo(PenaltyCriterion.MANUAL);
        assertThatCode(profile::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should require name and method")
    void shouldRequireNameAndMethod() {
        assertThatThrownBy(() -> new DetectionProfile().validate())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'name' is required")
                .hasMessageContaining("'method' is required");
    }

    @Test
    @DisplayName("Calibrated penalty should need the mean family")
    void shouldRestrictCalibratedPenalty() {
        DetectionProfile profile = profile("pelt");
        profile.setPenaltyCriterion("calibrated");
        profile.setFamily("slope");

        assertThatThrownBy(profile::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("requires family 'mean'");
    }

    @Test
    @DisplayName("maxChangepoints should only be accepted by binseg")
    void shouldRestrictCap() {
        DetectionProfile profile = profile("op");
        profile.setMaxChangepoints(3);

        assertThatThrownBy(profile::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("only supported by binseg");
    }

    @Test
    @DisplayName("Should reject bad alpha, replicates and thread counts")
    void shouldRejectBadCalibrationSettings() {
        DetectionProfile profile = profile("cusum");
        profile.setAlpha(1.0);
        profile.setReplicates(0);
        profile.setCalibrationThreads(0);

        assertThatThrownBy(profile::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'alpha' in (0, 1)")
                .hasMessageContaining("'replicates' >= 1")
                .hasMessageContaining("'calibrationThreads' >= 1");
    }

    @Test
    @DisplayName("Should report unknown family and threshold source")
    void shouldRejectUnknownNames() {
        DetectionProfile profile = profile("cusum");
        profile.setFamily("poisson");
        profile.setThresholdSource("bootstrap");

        assertThatThrownBy(profile::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("poisson")
                .hasMessageContaining("bootstrap");
    }

    private static DetectionProfile profile(String method) {
        DetectionProfile profile = new DetectionProfile();
        profile.setName("p");
        profile.setMethod(method);
        return profile;
    }
}
