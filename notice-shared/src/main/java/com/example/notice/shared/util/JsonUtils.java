package com.example.notice.shared.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;

/**
 * Utility class for common JSON operations, primarily for handling JSON columns in the database.
 */
@Slf4j
public final class JsonUtils {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private JsonUtils() {}

    /**
     * Parses a JSON array string into a List of Strings.
     *
     * @param json The JSON string to parse.
     * @return A List of Strings, or an empty list if parsing fails or the input is null/empty.
     */
    public static List<String> parseJsonArray(String json) {
        if (json == null || json.trim().isEmpty()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse JSON array string: {}", json, e);
            return List.of();
        }
    }

    /**
     * Converts a collection of values into a JSON array string of their {@code toString()} forms.
     *
     * @return A JSON array as a string, or null if the collection is null/empty.
     */
    public static String toJsonArray(Collection<?> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        return toJson(values.stream().map(String::valueOf).toList());
    }

    /**
     * Serializes any value for storage in a JSON column.
     *
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize value of type " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Reads a JSON column back into the given type, returning null for an empty column.
     */
    public static <T> T fromJson(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse JSON column into {}: {}", type.getSimpleName(), json, e);
            return null;
        }
    }
}
