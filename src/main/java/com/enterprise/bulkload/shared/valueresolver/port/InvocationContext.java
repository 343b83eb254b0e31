package com.enterprise.bulkload.shared.valueresolver.port;

import com.enterprise.bulkload.shared.valueresolver.adapter.MapValueStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ambient state of one invocation: the mutable message plus the flow and
 * global stores that outlive it.
 */
public record InvocationContext(Map<String, Object> message, ValueStore flow, ValueStore global) {

    public InvocationContext {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(flow, "flow");
        Objects.requireNonNull(global, "global");
    }

    /** Message-only context with empty private flow and global stores. */
    public static InvocationContext of(Map<String, Object> message) {
        return new InvocationContext(message, new MapValueStore(), new MapValueStore());
    }

    public static InvocationContext withPayload(Object payload) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("payload", payload);
        return of(message);
    }
}
