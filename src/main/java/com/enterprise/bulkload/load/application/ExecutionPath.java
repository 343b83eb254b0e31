package com.enterprise.bulkload.load.application;

import com.enterprise.bulkload.load.domain.RowOutcome;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One way of executing the run's statement and learning what each row did.
 * Chosen once per run; every row goes through the same path.
 */
public interface ExecutionPath {

    String name();

    /**
     * Prepares the statement on the given connection for a sequence of rows.
     */
    RowExecution open(Connection connection) throws SQLException;

    /**
     * Whether the outcome belongs in the run's returned rows.
     */
    boolean reports(RowOutcome outcome);
}
