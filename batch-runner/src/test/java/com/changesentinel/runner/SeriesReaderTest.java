package com.changesentinel.runner;

import com.changesentinel.core.error.InvalidInputException;
import com.changesentinel.core.model.Series;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SeriesReader}.
 */
class SeriesReaderTest {

    @Test
    @DisplayName("Should skip blank lines and comments")
    void shouldSkipCommentsAndBlanks() throws IOException {
        Series series = SeriesReader.read(new StringReader("# header\n1.5\n\n  -2\n# note\n3e1\n"));

        assertThat(series.toArray()).containsExactly(1.5, -2.0, 30.0);
    }

    @Test
    @DisplayName("Should read more values than the initial buffer holds")
    void shouldGrowBuffer(@TempDir Path dir) throws IOException {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 500; i++) {
            text.append(i).append('\n');
        }
        Path file = dir.resolve("series.txt");
        Files.writeString(file, text);

        Series series = SeriesReader.read(file);

        assertThat(series.length()).isEqualTo(500);
        assertThat(series.valueAt(500)).isEqualTo(499.0);
    }

    @Test
    @DisplayName("Should name the line that is not a number")
    void shouldRejectNonNumbers() {
        assertThatThrownBy(() -> SeriesReader.read(new StringReader("1\n2\nabc\n")))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("Line 3");
    }

    @Test
    @DisplayName("Should reject NaN and too-short input through Series validation")
    void shouldRejectInvalidSeries() {
        assertThatThrownBy(() -> SeriesReader.read(new StringReader("1\nNaN\n")))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> SeriesReader.read(new StringReader("# nothing\n")))
                .isInstanceOf(InvalidInputException.class);
    }
}
