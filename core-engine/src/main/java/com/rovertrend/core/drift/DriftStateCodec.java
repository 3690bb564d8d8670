package com.rovertrend.core.drift;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Objects;

/**
 * JSON snapshot and restore of {@link DriftDetectorState}.
 *
 * <p>
 * Instants are written as ISO-8601 strings and the method state carries a
 * {@code "method"} discriminator.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftStateCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private DriftStateCodec() {
        // utility class, not instantiable
    }

    /**
     * @throws IllegalStateException if serialization fails
     */
    public static String toJson(DriftDetectorState state) {
        Objects.requireNonNull(state, "State must not be null");
        try {
            return MAPPER.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize drift detector state", e);
        }
    }

    /**
     * @throws IllegalArgumentException if {@code json} is not a valid state
     */
    public static DriftDetectorState fromJson(String json) {
        Objects.requireNonNull(json, "JSON must not be null");
        try {
            return MAPPER.readValue(json, DriftDetectorState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid drift detector state: " + e.getOriginalMessage(), e);
        }
    }
}
