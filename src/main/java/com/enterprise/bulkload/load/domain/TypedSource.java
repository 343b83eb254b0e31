package com.enterprise.bulkload.load.domain;

import com.enterprise.bulkload.shared.valueresolver.port.SourceKind;

import java.util.Objects;

public record TypedSource(SourceKind kind, String spec) {

    public TypedSource {
        Objects.requireNonNull(kind, "kind");
    }

    public static TypedSource literal(String value) {
        return new TypedSource(SourceKind.STRING, value);
    }

    public static TypedSource message(String path) {
        return new TypedSource(SourceKind.MESSAGE, path);
    }
}
