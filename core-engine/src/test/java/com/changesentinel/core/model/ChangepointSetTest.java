package com.changesentinel.core.model;

import com.changesentinel.core.error.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ChangepointSet} and {@link Segment}.
 */
class ChangepointSetTest {

    @Test
    @DisplayName("Should partition [1, n] into contiguous segments")
    void shouldPartitionSeries() {
        ChangepointSet set = ChangepointSet.of(10, 3, 7);

        assertThat(set.segments()).containsExactly(
                Segment.of(1, 3), Segment.of(4, 7), Segment.of(8, 10));
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 5, 17, 100})
    @DisplayName("Every changepoint set should cover [1, n] without gaps or overlaps")
    void shouldCoverWholeSeries(int n) {
        int[] points = new int[n - 1];
        for (int i = 0; i < points.length; i++) {
            points[i] = i + 1;
        }
        for (ChangepointSet set : List.of(ChangepointSet.empty(n), ChangepointSet.of(n, points))) {
            List<Segment> segments = set.segments();
            assertThat(segments).hasSize(set.size() + 1);
            assertThat(segments.get(0).getStart()).isEqualTo(1);
            assertThat(segments.get(segments.size() - 1).getEnd()).isEqualTo(n);
            int covered = 0;
            for (int i = 0; i < segments.size(); i++) {
                covered += segments.get(i).length();
                if (i > 0) {
                    assertThat(segments.get(i).getStart()).isEqualTo(segments.get(i - 1).getEnd() + 1);
                }
            }
            assertThat(covered).isEqualTo(n);
        }
    }

    @Test
    @DisplayName("Should sort unordered changepoints")
    void shouldSortUnordered() {
        ChangepointSet set = ChangepointSet.fromUnordered(20, List.of(15, 4, 9));

        assertThat(set.asList()).containsExactly(4, 9, 15);
        assertThat(set.get(0)).isEqualTo(4);
    }

    @Test
    @DisplayName("Should reject out-of-range, duplicate and unsorted changepoints")
    void shouldRejectInvalidPoints() {
        assertThatThrownBy(() -> ChangepointSet.of(5, 0)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> ChangepointSet.of(5, 5)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> ChangepointSet.of(5, 3, 2)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> ChangepointSet.fromUnordered(5, List.of(2, 2)))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Should reject segments with end before start or beyond the series")
    void shouldValidateSegments() {
        assertThatThrownBy(() -> Segment.of(0, 3)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> Segment.of(4, 3)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> Segment.of(2, 6).requireWithin(5)).isInstanceOf(InvalidInputException.class);
        assertThat(Segment.of(3, 3).length()).isEqualTo(1);
    }
}
