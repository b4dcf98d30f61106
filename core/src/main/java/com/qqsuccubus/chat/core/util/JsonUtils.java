package com.qqsuccubus.chat.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper and unchecked read/write helpers.
 * <p>
 * Instants are written as ISO-8601 strings. Unknown properties are ignored so older clients
 * sending extra fields are not rejected.
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
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + object.getClass().getSimpleName(), e);
        }
    }

    /**
     * Parses JSON text.
     *
     * @throws IllegalArgumentException if the text is not valid JSON for {@code clazz}
     */
    public static <T> T readValue(String json, Class<T> clazz) {
        try {
            return mapper().readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON for " + clazz.getSimpleName(), e);
        }
    }

    /**
     * Converts an already-decoded JSON tree (maps, lists, scalars) into a typed payload.
     *
     * @throws IllegalArgumentException if the tree does not fit {@code clazz}
     */
    public static <T> T convert(Object tree, Class<T> clazz) {
        return mapper().convertValue(tree, clazz);
    }
}
