package com.enterprise.bulkload.load.domain;

import com.enterprise.bulkload.shared.valueresolver.port.SourceKind;

import static com.enterprise.bulkload.sql.validation.IdentifierValidator.requireIdentifier;

/**
 * How one target column gets its value from an input row.
 *
 * @param column     target column, a plain SQL identifier
 * @param sourceKind where the raw value comes from; {@code null} means {@link SourceKind#PATH}
 * @param source     path, expression or literal spec, interpreted per {@code sourceKind}
 * @param transform  normalization; {@code null} means {@link TransformKind#NONE}
 */
public record ColumnMapping(String column, SourceKind sourceKind, String source, TransformKind transform) {

    public ColumnMapping {
        requireIdentifier(column);
        sourceKind = sourceKind == null ? SourceKind.PATH : sourceKind;
        transform = transform == null ? TransformKind.NONE : transform;
    }

    /** Column filled from the row field of the same name, untransformed. */
    public static ColumnMapping of(String column) {
        return new ColumnMapping(column, SourceKind.PATH, column, TransformKind.NONE);
    }

    public static ColumnMapping path(String column, String path, TransformKind transform) {
        return new ColumnMapping(column, SourceKind.PATH, path, transform);
    }

    public static ColumnMapping expression(String column, String expression, TransformKind transform) {
        return new ColumnMapping(column, SourceKind.EXPRESSION, expression, transform);
    }
}
