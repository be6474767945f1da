package com.wardensystems.service;

import java.util.Map;

/**
 * Typed readers for request payloads. Missing or mistyped fields raise INVALID_PAYLOAD.
 */
public final class Payloads {

    private Payloads() {
    }

    public static String requireString(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null || value.toString().isBlank()) {
            throw ServiceException.invalidPayload(key + " is required");
        }
        return value.toString();
    }

    public static String optionalString(Map<String, Object> payload, String key, String defaultValue) {
        Object value = payload.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * Reads an integral field given as a number or a numeric string.
     *
     * @param payload the payload
     * @param key the field name
     * @return the value
     */
    public static long requireLong(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            throw ServiceException.invalidPayload(key + " is required");
        }
        return toLong(key, value);
    }

    public static long optionalLong(Map<String, Object> payload, String key, long defaultValue) {
        Object value = payload.get(key);
        return value != null ? toLong(key, value) : defaultValue;
    }

    private static long toLong(String key, Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw ServiceException.invalidPayload(key + " must be an integer, got '" + value + "'");
        }
    }
}
