package com.changesentinel.core.config;

import com.changesentinel.core.cost.PenaltyCriterion;
import com.changesentinel.core.model.CalibrationMethod;
import com.changesentinel.core.model.CostFamily;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ProfilesLoader}.
 */
class ProfilesLoaderTest {

    @Test
    @DisplayName("Should load test profiles from classpath")
    void shouldLoadFromClasspath() {
        ProfilesConfig config = ProfilesLoader.fromClasspath("test-profiles.yml");

        assertThat(config.getProfiles()).hasSize(4);

        DetectionProfile cusum = config.getProfiles().get(0);
        assertThat(cusum.getName()).isEqualTo("level_shift");
        assertThat(cusum.calibrationMethod()).isEqualTo(CalibrationMethod.ASYMPTOTIC);
        assertThat(cusum.getAlpha()).isEqualTo(0.01);

        DetectionProfile exact = config.getProfiles().get(1);
        assertThat(exact.penaltyCriterion()).isEqualTo(PenaltyCriterion.MANUAL);
        assertThat(exact.getPenalty()).isEqualTo(25.0);

        DetectionProfile capped = config.getProfiles().get(2);
        assertThat(capped.costFamily()).isEqualTo(CostFamily.MEAN_AND_VARIANCE);
        assertThat(capped.getMaxChangepoints()).isEqualTo(2);

        DetectionProfile calibrated = config.getProfiles().get(3);
        assertThat(calibrated.getMethod()).isEqualTo("pelt");
        assertThat(calibrated.penaltyCriterion()).isEqualTo(PenaltyCriterion.CALIBRATED);
        assertThat(calibrated.getThreshold()).isEqualTo(12.5);
    }

    @Test
    @DisplayName("Should collect every profile error into one message")
    void shouldFailFastOnInvalidProfiles() {
        assertThatThrownBy(() -> ProfilesLoader.fromClasspath("invalid-profiles.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("only supports family 'mean'")
                .hasMessageContaining("'threshold' > 0")
                .hasMessageContaining("'penalty' >= 0")
                .hasMessageContaining("Unknown method: 'wavelet'")
                .hasMessageContaining("Duplicate profile name: 'broken_binseg'");
    }

    @Test
    @DisplayName("Should reject duplicate YAML keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> ProfilesLoader.fromClasspath("duplicate-key-profiles.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should return an empty configuration for an empty profile list")
    void shouldAllowEmptyProfiles() {
        assertThat(ProfilesLoader.fromClasspath("empty-profiles.yml").getProfiles()).isEmpty();
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("profiles.yml");
        Files.writeString(file, "profiles:\n  - name: quick\n    method: binseg\n    penalty: 3.5\n");

        ProfilesConfig config = ProfilesLoader.fromFile(file.toString());

        assertThat(config.getProfiles()).hasSize(1);
        assertThat(config.getProfiles().get(0).getPenalty()).isEqualTo(3.5);
        assertThat(ProfilesLoader.load(file.toString()).getProfiles()).hasSize(1);
    }

    @Test
    @DisplayName("Should throw when the file or classpath resource does not exist")
    void shouldThrowForMissingSources(@TempDir Path dir) {
        assertThatThrownBy(() -> ProfilesLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> ProfilesLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
