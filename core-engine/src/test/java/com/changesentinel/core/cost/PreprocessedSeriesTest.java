package com.changesentinel.core.cost;

import com.changesentinel.core.error.InvalidInputException;
import com.changesentinel.core.model.Series;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PreprocessedSeries}.
 */
class PreprocessedSeriesTest {

    private final PreprocessedSeries series = PreprocessedSeries.of(Series.of(2.0, -1.0, 4.0, 3.0, 0.5));

    @Test
    @DisplayName("Range sums should match direct summation")
    void shouldMatchDirectSums() {
        assertThat(series.sum(2, 4)).isCloseTo(-1.0 + 4.0 + 3.0, within(1e-12));
        assertThat(series.sumOfSquares(1, 2)).isCloseTo(4.0 + 1.0, within(1e-12));
        assertThat(series.sumOfT(3, 5)).isCloseTo(3 + 4 + 5, within(1e-12));
        assertThat(series.sumOfTSquared(1, 3)).isCloseTo(1 + 4 + 9, within(1e-12));
        assertThat(series.sumOfTY(4, 5)).isCloseTo(4 * 3.0 + 5 * 0.5, within(1e-12));
        assertThat(series.mean(1, 5)).isCloseTo(8.5 / 5, within(1e-12));
    }

    @Test
    @DisplayName("Should keep a sorted copy without touching the series")
    void shouldSortCopy() {
        assertThat(series.sortedValues()).containsExactly(-1.0, 0.5, 2.0, 3.0, 4.0);
        assertThat(series.getSeries().valueAt(1)).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should reject segments outside [1, n]")
    void shouldRejectBadSegments() {
        assertThatThrownBy(() -> series.sum(0, 2)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> series.sum(3, 6)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> series.sum(4, 3)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> series.sumOfSquares(0, 1)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> series.sumOfT(2, 6)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> series.sumOfTSquared(3, 2)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> series.sumOfTY(0, 5)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> series.mean(5, 4)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> series.centeredSum(0, 0)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Centered sums should be deviations from the series mean")
    void shouldCenterOnSeriesMean() {
        assertThat(series.getShift()).isCloseTo(8.5 / 5, within(1e-12));
        assertThat(series.centeredSum(1, 5)).isCloseTo(0.0, within(1e-12));
        assertThat(series.centeredSum(2, 3)).isCloseTo(-1.0 + 4.0 - 2 * 1.7, within(1e-12));
        assertThat(series.centeredSumOfSquares(1, 1)).isCloseTo(0.3 * 0.3, within(1e-12));
    }

    @Test
    @DisplayName("A large constant offset should not erase the residual sum of squares")
    void shouldKeepResidualsUnderLargeOffset() {
        PreprocessedSeries shifted = PreprocessedSeries.of(Series.of(1e8 + 1, 1e8 - 1, 1e8 + 1, 1e8 - 1));
        double s = shifted.centeredSum(1, 4);
        double rss = shifted.centeredSumOfSquares(1, 4) - s * s / 4;

        assertThat(rss).isCloseTo(4.0, within(1e-9));
        assertThat(shifted.mean(1, 2)).isCloseTo(1e8, within(1e-6));
    }
}
