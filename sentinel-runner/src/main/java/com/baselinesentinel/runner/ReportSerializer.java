package com.baselinesentinel.runner;

import com.baselinesentinel.core.model.AnomalyReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Serializes {@link AnomalyReport} instances to JSON.
 *
 * <p>
 * Instants are written as ISO-8601 strings, e.g.
 * {@code "2024-01-15T08:00:00Z"}. The {@link ObjectMapper} is thread-safe
 * once configured and is shared by all callers.
 * </p>
 */
public final class ReportSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private ReportSerializer() {
    }

    /**
     * @param report report to serialize
     * @return compact JSON document
     * @throws IllegalStateException if serialization fails
     */
    public static String toJson(AnomalyReport report) {
        try {
            return MAPPER.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize anomaly report", e);
        }
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }
}
