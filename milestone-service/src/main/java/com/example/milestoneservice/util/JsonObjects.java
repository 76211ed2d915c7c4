package com.example.milestoneservice.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for free-form JSON objects held as {@code Map<String, Object>}.
 */
public final class JsonObjects {

    private JsonObjects() {
    }

    /**
     * Deep-merge source over target into a new map.
     * Nested objects are merged key by key; arrays, scalars and explicit nulls
     * from source replace the target value. Neither argument is modified.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> merge(Map<String, Object> target, Map<String, Object> source) {
        Map<String, Object> result = deepCopy(target);
        if (source == null) {
            return result;
        }
        source.forEach((key, value) -> {
            Object existing = result.get(key);
            if (existing instanceof Map && value instanceof Map) {
                result.put(key, merge((Map<String, Object>) existing, (Map<String, Object>) value));
            } else if (value instanceof Map) {
                result.put(key, deepCopy((Map<String, Object>) value));
            } else {
                result.put(key, value);
            }
        });
        return result;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source == null) {
            return copy;
        }
        source.forEach((key, value) -> copy.put(key,
                value instanceof Map ? deepCopy((Map<String, Object>) value) : value));
        return copy;
    }
}
