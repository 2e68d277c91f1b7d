package com.changesentinel.core.detection;

import com.changesentinel.core.cost.CostFunction;
import com.changesentinel.core.cost.CostFunctions;
import com.changesentinel.core.cost.PreprocessedSeries;
import com.changesentinel.core.error.InvalidParameterException;
import com.changesentinel.core.model.CostFamily;
import com.changesentinel.core.model.SegmentationResult;
import com.changesentinel.core.model.Series;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BinarySegmentation}.
 */
class BinarySegmentationTest {

    @Test
    @DisplayName("Should find two well-separated mean shifts")
    void shouldFindTwoShifts() {
        CostFunction cost = meanCost(threeLevels(11));

        SegmentationResult result = new BinarySegmentation().segment(cost, 3 * Math.log(90));

        assertThat(result.getMethod()).isEqualTo(BinarySegmentation.METHOD);
        assertThat(result.getChangepoints().size()).isEqualTo(2);
        assertThat(result.getChangepoints().get(0)).isCloseTo(30, within(1));
        assertThat(result.getChangepoints().get(1)).isCloseTo(60, within(1));
        assertThat(result.getFits()).hasSize(3);
        assertThat(result.getFits().get(1).getParameter("mean")).isCloseTo(5.0, within(0.5));
    }

    @Test
    @DisplayName("Should report no change when the penalty outweighs every gain")
    void shouldNotSplitUnderLargePenalty() {
        SegmentationResult result = new BinarySegmentation().segment(meanCost(noise(60, 3)), 1e6);

        assertThat(result.getChangepoints().isEmpty()).isTrue();
        assertThat(result.getFits()).hasSize(1);
        assertThat(result.getPenalizedCost()).isEqualTo(result.getTotalCost());
    }

    @Test
    @DisplayName("A split whose gain exactly offsets the penalty should not be taken")
    void shouldNotSplitOnTie() {
        CostFunction cost = meanCost(Series.of(0.0, 0.0, 1.0, 1.0));

        assertThat(new BinarySegmentation().segment(cost, 1.0).getChangepoints().isEmpty()).isTrue();
        assertThat(new BinarySegmentation().segment(cost, 0.999).getChangepoints().asList()).containsExactly(2);
    }

    @Test
    @DisplayName("Should be deterministic")
    void shouldBeDeterministic() {
        CostFunction cost = CostFunctions.create(CostFamily.MEAN_AND_VARIANCE,
                PreprocessedSeries.of(threeLevels(5)));

        SegmentationResult first = new BinarySegmentation().segment(cost, 10.0);
        SegmentationResult second = new BinarySegmentation().segment(cost, 10.0);

        assertThat(first.getChangepoints()).isEqualTo(second.getChangepoints());
        assertThat(first.getPenalizedCost()).isEqualTo(second.getPenalizedCost());
    }

    @Test
    @DisplayName("Should keep the strongest split when capped")
    void shouldHonourCap() {
        CostFunction cost = meanCost(threeLevels(17));
        int strongest = BinarySegmentation.bestSplit(cost, 1, 90, 5.0).tau;

        SegmentationResult capped = new BinarySegmentation(1).segment(cost, 5.0);
        SegmentationResult none = new BinarySegmentation(0).segment(cost, 5.0);

        assertThat(capped.getChangepoints().asList()).containsExactly(strongest);
        assertThat(none.getChangepoints().isEmpty()).isTrue();
        assertThatThrownBy(() -> new BinarySegmentation(-1)).isInstanceOf(InvalidParameterException.class);
    }

    @Test
    @DisplayName("Masked changes: a short pulse is invisible to a single split")
    void shouldMissMaskedPulse() {
        double[] y = new double[42];
        y[20] = 4.0;
        y[21] = 4.0;
        CostFunction cost = meanCost(Series.of(y));

        SegmentationResult binseg = new BinarySegmentation().segment(cost, 10.0);
        SegmentationResult optimal = new OptimalPartitioning().segment(cost, 10.0);

        assertThat(binseg.getChangepoints().isEmpty()).isTrue();
        assertThat(optimal.getChangepoints().asList()).containsExactly(20, 22);
        assertThat(optimal.getPenalizedCost()).isLessThan(binseg.getPenalizedCost());
    }

    @Test
    @DisplayName("Should reject negative or non-finite penalties")
    void shouldRejectBadPenalty() {
        CostFunction cost = meanCost(noise(10, 1));

        assertThatThrownBy(() -> new BinarySegmentation().segment(cost, -1.0))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> new BinarySegmentation().segment(cost, Double.NaN))
                .isInstanceOf(InvalidParameterException.class);
    }

    static Series threeLevels(long seed) {
        Well19937c rng = new Well19937c(seed);
        double[] y = new double[90];
        for (int i = 0; i < y.length; i++) {
            double level = i < 30 ? 0.0 : (i < 60 ? 5.0 : -3.0);
            y[i] = level + 0.5 * rng.nextGaussian();
        }
        return Series.withKnownVariance(y, 0.25);
    }

    static Series noise(int n, long seed) {
        Well19937c rng = new Well19937c(seed);
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            y[i] = rng.nextGaussian();
        }
        return Series.of(y);
    }

    private static CostFunction meanCost(Series series) {
        return CostFunctions.create(CostFamily.MEAN, PreprocessedSeries.of(series));
    }
}
