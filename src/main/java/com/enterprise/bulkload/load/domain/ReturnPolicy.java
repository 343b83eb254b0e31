package com.enterprise.bulkload.load.domain;

import java.util.Objects;

import static com.enterprise.bulkload.sql.validation.IdentifierValidator.requireIdentifier;

/**
 * @param idColumn identifier column to report; {@code null} means the engine's implicit row id
 */
public record ReturnPolicy(ReturnMode mode, String idColumn) {

    public ReturnPolicy {
        Objects.requireNonNull(mode, "mode");
        idColumn = idColumn == null || idColumn.isBlank() ? null : requireIdentifier(idColumn);
    }

    public static ReturnPolicy none() {
        return new ReturnPolicy(ReturnMode.NONE, null);
    }

    public static ReturnPolicy inserted(String idColumn) {
        return new ReturnPolicy(ReturnMode.INSERTED, idColumn);
    }

    public static ReturnPolicy affected(String idColumn) {
        return new ReturnPolicy(ReturnMode.AFFECTED, idColumn);
    }

    public boolean enabled() {
        return mode != ReturnMode.NONE;
    }
}
