package com.qqsuccubus.social.core.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper for wire frames and stored documents.
 * <p>
 * Timestamps are written as ISO-8601 strings; unknown properties are ignored so older servers
 * accept newer clients.
 * </p>
 */
public final class JsonUtils {
    private JsonUtils() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String writeValueAsString(Object object) {
        try {
            return mapper().writeValueAsString(object);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize " + object.getClass().getSimpleName(), e);
        }
    }

    public static <T> T readValue(String json, Class<T> clazz) {
        try {
            return mapper().readValue(json, clazz);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to read " + clazz.getSimpleName(), e);
        }
    }

    public static <T> T readValue(String json, TypeReference<T> type) {
        try {
            return mapper().readValue(json, type);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to read " + type.getType(), e);
        }
    }

    /**
     * Converts an already-parsed JSON tree (maps, lists, scalars) into a typed value.
     */
    public static <T> T convertValue(Object value, Class<T> clazz) {
        return mapper().convertValue(value, clazz);
    }

    public static <T> T convertValue(Object value, TypeReference<T> type) {
        return mapper().convertValue(value, type);
    }
}
