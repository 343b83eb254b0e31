package com.enterprise.bulkload.load.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What happened to one input row.
 *
 * @param id   reported identifier, or {@code null} when none could be captured
 * @param data column to bound value, in column order; may hold {@code null}s
 */
public record RowOutcome(RowAction action, Object id, Map<String, Object> data) {

    public RowOutcome {
        Objects.requireNonNull(action, "action");
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data == null ? Map.of() : data));
    }

    public RowOutcome withId(Object newId) {
        return new RowOutcome(action, newId, data);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("action", action.label());
        m.put("id", id);
        m.put("data", new LinkedHashMap<>(data));
        return m;
    }
}
