package com.enterprise.bulkload.load.domain;

/**
 * Values accepted by {@code PRAGMA synchronous}.
 */
public enum SynchronousMode {
    OFF,
    NORMAL,
    FULL,
    EXTRA
}
