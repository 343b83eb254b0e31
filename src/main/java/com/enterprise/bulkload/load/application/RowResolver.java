package com.enterprise.bulkload.load.application;

import com.enterprise.bulkload.load.domain.ColumnMapping;
import com.enterprise.bulkload.shared.valueresolver.adapter.DottedPath;
import com.enterprise.bulkload.shared.valueresolver.port.InvocationContext;
import com.enterprise.bulkload.shared.valueresolver.port.SourceKind;
import com.enterprise.bulkload.shared.valueresolver.port.TypedValueResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Extracts the raw value of one mapped column from one input row.
 *
 * <p>{@code PATH} walks the row directly; everything else, expressions included,
 * goes to the {@link TypedValueResolver} with the row in scope. A missing value is
 * {@code null}, never an error.
 */
public class RowResolver {

    private static final Logger log = LoggerFactory.getLogger(RowResolver.class);

    private final TypedValueResolver resolver;

    public RowResolver(TypedValueResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public Object resolve(Object row, ColumnMapping mapping, InvocationContext context) {
        if (mapping.sourceKind() == SourceKind.PATH) {
            return DottedPath.get(row, mapping.source());
        }
        try {
            return resolver.resolve(mapping.sourceKind(), mapping.source(), context, row);
        } catch (RuntimeException e) {
            log.debug("No value for column {}: {}", mapping.column(), e.getMessage());
            return null;
        }
    }
}
