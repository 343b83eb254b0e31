package com.enterprise.bulkload.shared.valueresolver.adapter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes {@code "a.b.0.c"} paths over nested maps and lists.
 */
public final class DottedPath {

    private DottedPath() {}

    /**
     * Walks the path from {@code root}. Any step through something that is not a
     * map or list, a missing key, or a bad list index yields {@code null}.
     */
    public static Object get(Object root, String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        Object cur = root;
        for (String key : path.split("\\.", -1)) {
            if (cur instanceof Map<?, ?> map) {
                cur = map.get(key);
            } else if (cur instanceof List<?> list) {
                int idx = index(key);
                cur = idx >= 0 && idx < list.size() ? list.get(idx) : null;
            } else {
                return null;
            }
        }
        return cur;
    }

    /**
     * Stores {@code value} at the path. Intermediates are replaced by mutable
     * copies; non-map intermediates become fresh maps.
     */
    public static void put(Map<String, Object> root, String path, Object value) {
        String[] keys = path.split("\\.", -1);
        Map<String, Object> cur = root;
        for (int i = 0; i < keys.length - 1; i++) {
            Map<String, Object> next = mutableCopy(cur.get(keys[i]));
            cur.put(keys[i], next);
            cur = next;
        }
        cur.put(keys[keys.length - 1], value);
    }

    /** String-keyed copy of a map value; empty for anything else. */
    static Map<String, Object> mutableCopy(Object value) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        }
        return copy;
    }

    private static int index(String key) {
        if (key.isEmpty() || key.length() > 9) {
            return -1;
        }
        for (int i = 0; i < key.length(); i++) {
            if (!Character.isDigit(key.charAt(i))) {
                return -1;
            }
        }
        return Integer.parseInt(key);
    }
}
