package com.hooky.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One request delivered to a receiver.
 *
 * <p>{@code query} and {@code headers} map a name to either a {@code String} or, for repeated
 * names, a {@code List<String>}. {@code body} is a parsed JSON value, a form map, raw text or null.
 */
public record CapturedEvent(
    UUID id,
    Instant timestamp,
    String method,
    String path,
    Map<String, Object> query,
    Map<String, Object> headers,
    Object body
) {
    public CapturedEvent {
        query = query == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(query));
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * Collapses single-valued entries to a plain string, keeping lists for repeated names.
     */
    public static Map<String, Object> flatten(Map<String, List<String>> multiValued) {
        Map<String, Object> flat = new LinkedHashMap<>();
        multiValued.forEach((name, values) -> {
            if (values == null || values.isEmpty()) {
                flat.put(name, "");
            } else if (values.size() == 1) {
                flat.put(name, values.get(0));
            } else {
                flat.put(name, List.copyOf(values));
            }
        });
        return flat;
    }
}
