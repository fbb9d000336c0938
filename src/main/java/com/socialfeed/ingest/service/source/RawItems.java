package com.socialfeed.ingest.service.source;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Tolerant accessors over actor dataset items. Wrong shapes yield empty defaults instead of errors.
 */
public final class RawItems {

    private RawItems() {
    }

    /**
     * First non-blank value among {@code keys}, rendered as a string. Empty string if none.
     */
    public static String text(Map<String, Object> item, String... keys) {
        if (item == null) {
            return "";
        }
        for (String key : keys) {
            Object value = item.get(key);
            if (value instanceof String s) {
                if (!s.isEmpty()) return s;
            } else if (value instanceof Number || value instanceof Boolean) {
                return value.toString();
            }
        }
        return "";
    }

    /**
     * Nested object under {@code key}, or an empty map.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> object(Map<String, Object> item, String key) {
        if (item == null) {
            return Collections.emptyMap();
        }
        Object value = item.get(key);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Collections.emptyMap();
    }

    /**
     * Nested list under {@code key}, or an empty list.
     */
    public static List<?> list(Map<String, Object> item, String key) {
        if (item == null) {
            return Collections.emptyList();
        }
        Object value = item.get(key);
        return value instanceof List<?> list ? list : Collections.emptyList();
    }

    /**
     * First element of the list under {@code key} when it is an object, else an empty map.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> firstObject(Map<String, Object> item, String key) {
        List<?> values = list(item, key);
        if (!values.isEmpty() && values.get(0) instanceof Map<?, ?> first) {
            return (Map<String, Object>) first;
        }
        return Collections.emptyMap();
    }

    /**
     * Integer counter under {@code key}; numeric strings are accepted, anything else is 0.
     */
    public static int count(Map<String, Object> item, String key) {
        if (item == null) {
            return 0;
        }
        Object value = item.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }
}
