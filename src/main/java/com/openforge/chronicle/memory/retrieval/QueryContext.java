package com.openforge.chronicle.memory.retrieval;

import java.util.Map;

/**
 * Situational context of a generation step, supplied by the caller.
 *
 * @param queryText  explicit query; when present it is used as-is
 * @param attributes free-form hints such as {@code weather}, {@code time_of_day}, {@code date} (ISO-8601)
 */
public record QueryContext(String queryText, Map<String, String> attributes) {

    public QueryContext {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static QueryContext empty() {
        return new QueryContext(null, Map.of());
    }

    public static QueryContext ofQuery(String queryText) {
        return new QueryContext(queryText, Map.of());
    }

    public static QueryContext ofAttributes(Map<String, String> attributes) {
        return new QueryContext(null, attributes);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }
}
