package com.enterprise.bulkload.load.domain.exception;

/**
 * The database could not be opened or prepared for the run.
 */
public class LoadConnectionException extends BulkLoadException {

    public LoadConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
