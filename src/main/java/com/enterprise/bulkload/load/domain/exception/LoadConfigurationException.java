package com.enterprise.bulkload.load.domain.exception;

public class LoadConfigurationException extends BulkLoadException {

    public LoadConfigurationException(String message) {
        super(message);
    }
}
