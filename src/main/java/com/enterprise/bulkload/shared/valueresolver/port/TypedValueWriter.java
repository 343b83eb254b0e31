package com.enterprise.bulkload.shared.valueresolver.port;

/**
 * Stores a value for downstream consumers. A blank path is a no-op.
 */
@FunctionalInterface
public interface TypedValueWriter {

    void write(ValueScope scope, String path, Object value, InvocationContext context);
}
