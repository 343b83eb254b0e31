package com.enterprise.bulkload.load.domain;

import com.enterprise.bulkload.shared.valueresolver.port.ValueScope;

import java.util.Objects;

public record Destination(ValueScope scope, String path) {

    public Destination {
        Objects.requireNonNull(scope, "scope");
    }

    public static Destination message(String path) {
        return new Destination(ValueScope.MESSAGE, path);
    }
}
