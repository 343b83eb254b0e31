package com.enterprise.bulkload.load.domain.exception;

/**
 * A table or column name that cannot be interpolated into SQL text.
 * Raised before any statement executes.
 */
public class InvalidIdentifierException extends BulkLoadException {

    private final String identifier;

    public InvalidIdentifierException(String identifier) {
        super("Invalid identifier: " + identifier);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
