package com.changesentinel.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Converts a {@link RunReport} to indented JSON with ISO-8601 timestamps.
 */
public final class ReportSerializer {

    private final ObjectMapper mapper;

    public ReportSerializer() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @throws IllegalStateException if the report cannot be serialized
     */
    public String toJson(RunReport report) {
        Objects.requireNonNull(report, "RunReport must not be null");
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report: " + e.getMessage(), e);
        }
    }

    public void write(RunReport report, OutputStream out) throws IOException {
        Objects.requireNonNull(report, "RunReport must not be null");
        mapper.writeValue(out, report);
    }
}
