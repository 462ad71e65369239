package com.riftinsight.domain.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Makes a result tree safe for strict JSON: NaN and infinite floating point
 * values become null. Maps and collections are rebuilt with the same shape.
 * Other objects (model beans such as timeline points) are first converted to
 * their JSON tree of maps and lists, so their fields are walked too.
 */
public final class ResultSanitizer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ResultSanitizer() {
    }

    public static Object sanitize(Object value) {
        if (value == null || value instanceof JsonNode) {
            // JsonNode is Iterable over its values only, so it is returned as is
            return value;
        }
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> copy.put(k, sanitize(v)));
            return copy;
        }
        if (value instanceof Iterable) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (Iterable<?>) value) {
                copy.add(sanitize(item));
            }
            return copy;
        }
        if (value instanceof Double) {
            return Double.isFinite((Double) value) ? value : null;
        }
        if (value instanceof Float) {
            return Float.isFinite((Float) value) ? value : null;
        }
        if (value instanceof Number || value instanceof CharSequence || value instanceof Boolean
                || value instanceof Character || value instanceof Enum) {
            return value;
        }
        return sanitize(MAPPER.convertValue(value, Object.class));
    }

    public static Map<String, Object> sanitizeMap(Map<String, ?> value) {
        Map<String, Object> copy = new LinkedHashMap<>();
        value.forEach((k, v) -> copy.put(k, sanitize(v)));
        return copy;
    }
}
