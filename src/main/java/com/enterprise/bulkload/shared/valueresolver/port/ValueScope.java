package com.enterprise.bulkload.shared.valueresolver.port;

/**
 * Destination scopes a {@link TypedValueWriter} can store into.
 */
public enum ValueScope {
    MESSAGE,
    FLOW,
    GLOBAL
}
