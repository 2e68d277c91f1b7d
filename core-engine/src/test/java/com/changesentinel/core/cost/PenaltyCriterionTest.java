package com.changesentinel.core.cost;

import com.changesentinel.core.error.InvalidParameterException;
import com.changesentinel.core.model.CostFamily;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PenaltyCriterion}.
 */
class PenaltyCriterionTest {

    @Test
    @DisplayName("Should count one location parameter plus the family's segment parameters")
    void shouldComputePenalties() {
        assertThat(PenaltyCriterion.AIC.penalty(CostFamily.MEAN, 100)).isEqualTo(4.0);
        assertThat(PenaltyCriterion.BIC.penalty(CostFamily.MEAN_AND_VARIANCE, 100))
                .isCloseTo(3 * Math.log(100), within(1e-12));
        assertThat(PenaltyCriterion.HANNAN_QUINN.penalty(CostFamily.SLOPE, 50))
                .isCloseTo(6 * Math.log(Math.log(50)), within(1e-12));
    }

    @Test
    @DisplayName("Manual and calibrated penalties have no formula")
    void shouldRejectFormulaFreeCriteria() {
        assertThatThrownBy(() -> PenaltyCriterion.MANUAL.penalty(CostFamily.MEAN, 10))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> PenaltyCriterion.CALIBRATED.penalty(CostFamily.MEAN, 10))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    @DisplayName("Hannan-Quinn should reject series too short for log log n")
    void shouldRejectHannanQuinnOnTwoPoints() {
        assertThatThrownBy(() -> PenaltyCriterion.HANNAN_QUINN.penalty(CostFamily.MEAN, 2))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("HANNAN_QUINN")
                .hasMessageContaining("got: 2");
        assertThat(PenaltyCriterion.HANNAN_QUINN.penalty(CostFamily.MEAN, 3)).isPositive();
    }

    @Test
    @DisplayName("Should parse names and aliases case-insensitively")
    void shouldParseNames() {
        assertThat(PenaltyCriterion.fromName("SIC")).isEqualTo(PenaltyCriterion.BIC);
        assertThat(PenaltyCriterion.fromName(" hq ")).isEqualTo(PenaltyCriterion.HANNAN_QUINN);
        assertThat(PenaltyCriterion.fromName("Calibrated")).isEqualTo(PenaltyCriterion.CALIBRATED);
        assertThatThrownBy(() -> PenaltyCriterion.fromName("mdl"))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("mdl");
    }
}
