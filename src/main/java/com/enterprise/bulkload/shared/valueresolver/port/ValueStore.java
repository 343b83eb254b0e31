package com.enterprise.bulkload.shared.valueresolver.port;

/**
 * Key/value store addressed by dotted paths ({@code "a.b.c"}).
 * Missing keys read as {@code null}; reads never throw.
 */
public interface ValueStore {

    Object get(String path);

    void put(String path, Object value);
}
