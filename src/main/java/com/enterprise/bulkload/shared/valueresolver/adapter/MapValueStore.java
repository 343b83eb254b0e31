package com.enterprise.bulkload.shared.valueresolver.adapter;

import com.enterprise.bulkload.shared.valueresolver.port.ValueStore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory {@link ValueStore}. The global store bean is one of these.
 */
public class MapValueStore implements ValueStore {

    private final Map<String, Object> values = new LinkedHashMap<>();

    @Override
    public synchronized Object get(String path) {
        return DottedPath.get(values, path);
    }

    @Override
    public synchronized void put(String path, Object value) {
        DottedPath.put(values, path, value);
    }
}
