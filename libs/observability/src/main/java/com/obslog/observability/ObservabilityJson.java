package com.obslog.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.util.Optional;

/**
 * Shared Jackson configuration for everything this library writes into logs, span attributes
 * and Langfuse observations.
 * <p>
 * Parsing rejects trailing content, so {@code {"a":1} garbage} is not a JSON document.
 * Serialization does not fail on beans without properties.
 */
public final class ObservabilityJson {

    private static final ObjectMapper MAPPER = createMapper();

    private ObservabilityJson() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * Parses bytes as a JSON document, returning empty for malformed input, invalid UTF-8
     * or blank content.
     */
    public static Optional<JsonNode> tryParse(byte[] raw) {
        if (raw == null || raw.length == 0) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(raw);
            if (node == null || node.isMissingNode()) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    /**
     * Serializes a value to compact JSON.
     *
     * @throws IllegalArgumentException if Jackson cannot serialize the value
     */
    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize value of type "
                    + (value == null ? "null" : value.getClass().getName()), e);
        }
    }

    /**
     * Serializes a value to compact UTF-8 JSON bytes.
     *
     * @throws IllegalArgumentException if Jackson cannot serialize the value
     */
    public static byte[] writeBytes(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize value of type "
                    + (value == null ? "null" : value.getClass().getName()), e);
        }
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }
}
