package com.enterprise.bulkload.load.domain;

import java.util.Locale;

public enum RowAction {
    INSERTED,
    UPDATED,
    SKIPPED,
    ERRORED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
