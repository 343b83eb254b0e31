package com.enterprise.bulkload.load.domain.exception;

import org.springframework.core.NestedRuntimeException;

/**
 * Root of the bulk-load failure taxonomy. Every subclass is fatal to the run
 * except {@link RowExecutionException}, which the executor may tolerate.
 */
public abstract class BulkLoadException extends NestedRuntimeException {

    protected BulkLoadException(String message) {
        super(message);
    }

    protected BulkLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
