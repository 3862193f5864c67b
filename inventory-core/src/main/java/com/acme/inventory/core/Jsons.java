package com.acme.inventory.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;

public final class Jsons {
    private static final ObjectMapper M = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private Jsons() {}

    public static ObjectMapper mapper() {
        return M;
    }

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch (Exception e) {
            throw new IllegalArgumentException("Cannot serialize " + o.getClass().getSimpleName(), e);
        }
    }

    public static String toPrettyJson(Object o) {
        try {
            return M.writerWithDefaultPrettyPrinter().writeValueAsString(o);
        } catch (Exception e) {
            throw new IllegalArgumentException("Cannot serialize " + o.getClass().getSimpleName(), e);
        }
    }

    public static byte[] toBytes(Object o) {
        try {
            return M.writeValueAsBytes(o);
        } catch (Exception e) {
            throw new IllegalArgumentException("Cannot serialize " + o.getClass().getSimpleName(), e);
        }
    }

    public static <T> T fromJson(byte[] json, Class<T> clazz) {
        try {
            return M.readValue(json, clazz);
        } catch (Exception e) {
            throw new IllegalArgumentException("Cannot parse " + clazz.getSimpleName(), e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return M.readValue(json, clazz);
        } catch (Exception e) {
            throw new IllegalArgumentException("Cannot parse " + clazz.getSimpleName(), e);
        }
    }

    /** Parses a flat JSON object of string values, as used for tag columns. Blank input is empty. */
    public static Map<String, String> toStringMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return M.readValue(json, STRING_MAP);
        } catch (Exception e) {
            throw new IllegalArgumentException("Cannot parse string map", e);
        }
    }
}
