package com.qqsuccubus.egress.core.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper for everything that crosses the message bus or the HTTP surface.
 * <p>
 * Unknown properties are ignored so nodes and clients of different versions can talk to each other.
 * </p>
 */
public final class JsonUtils {
    private JsonUtils() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
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
            throw new IllegalArgumentException("Failed to parse " + clazz.getSimpleName(), e);
        }
    }

    public static <T> T readValue(String json, TypeReference<T> type) {
        try {
            return mapper().readValue(json, type);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse " + type.getType(), e);
        }
    }
}
