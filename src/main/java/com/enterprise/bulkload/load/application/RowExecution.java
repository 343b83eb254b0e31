package com.enterprise.bulkload.load.application;

import com.enterprise.bulkload.load.domain.RowOutcome;

import java.sql.SQLException;

/**
 * A prepared statement bound to one transaction scope.
 */
public interface RowExecution extends AutoCloseable {

    RowOutcome execute(Object[] params) throws SQLException;

    @Override
    void close() throws SQLException;
}
