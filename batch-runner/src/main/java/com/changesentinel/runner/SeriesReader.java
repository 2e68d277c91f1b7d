package com.changesentinel.runner;

import com.changesentinel.core.error.InvalidInputException;
import com.changesentinel.core.model.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a series written one number per line. Blank lines and lines starting
 * with {@code #} are skipped.
 */
public final class SeriesReader {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesReader.class);

    private SeriesReader() {
        // utility class - not instantiable
    }

    /**
     * @throws InvalidInputException if a line is not a number or the series
     *                               is invalid
     * @throws IOException           if the file cannot be read
     */
    public static Series read(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Series series = read(reader);
            LOG.info("Read {} observation(s) from {}", series.length(), path);
            return series;
        }
    }

    public static Series read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader b ? b : new BufferedReader(source);
        double[] values = new double[64];
        int count = 0;
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            double value;
            try {
                value = Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                throw new InvalidInputException("Line " + lineNumber + " is not a number: '" + trimmed + "'");
            }
            if (count == values.length) {
                double[] grown = new double[values.length * 2];
                System.arraycopy(values, 0, grown, 0, count);
                values = grown;
            }
            values[count++] = value;
        }
        double[] exact = new double[count];
        System.arraycopy(values, 0, exact, 0, count);
        return Series.of(exact);
    }
}
