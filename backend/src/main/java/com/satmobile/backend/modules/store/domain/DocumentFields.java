package com.satmobile.backend.modules.store.domain;

import java.util.Map;

/**
 * Typed reads of loosely typed document data. Field names may be dotted to reach into
 * nested maps ({@code contexts.defaultChurchId}).
 */
public final class DocumentFields {

    private DocumentFields() {
    }

    public static Object value(Map<String, Object> data, String field) {
        if (data == null) {
            return null;
        }
        Object current = data;
        for (String part : field.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(part);
        }
        return current;
    }

    public static String string(Map<String, Object> data, String field) {
        Object value = value(data, field);
        return value instanceof String text ? text : null;
    }

    /** Trimmed string value, {@code null} when absent or blank. */
    public static String text(Map<String, Object> data, String field) {
        String value = string(data, field);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    public static Boolean bool(Map<String, Object> data, String field) {
        Object value = value(data, field);
        return value instanceof Boolean flag ? flag : null;
    }

    public static boolean isTrue(Map<String, Object> data, String field) {
        return Boolean.TRUE.equals(bool(data, field));
    }

    public static long longValue(Map<String, Object> data, String field, long fallback) {
        Object value = value(data, field);
        return value instanceof Number number ? number.longValue() : fallback;
    }

    public static Map<String, Object> map(Map<String, Object> data, String field) {
        Map<String, Object> nested = asMap(value(data, field));
        return nested != null ? nested : Map.of();
    }

    /** The value viewed as nested document data, {@code null} when it is not a map. */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }
}
