package com.enterprise.bulkload.load.application;

/**
 * Opens a fresh {@link ConnectionSession} per run.
 */
@FunctionalInterface
public interface ConnectionSessionFactory {

    /**
     * @param location database location, e.g. a file path
     * @throws com.enterprise.bulkload.load.domain.exception.LoadConnectionException if it cannot be opened
     */
    ConnectionSession open(String location);
}
