package com.enterprise.bulkload.load.application;

/**
 * Raw observation an {@link ExecutionPath} makes about one executed row,
 * before it is classified.
 */
public sealed interface PathResult {

    /** The engine echoed the row back: something was written. */
    record Echoed(Object id, Object[] values) implements PathResult {}

    /** RETURNING produced no row: nothing was written. */
    record NotEchoed() implements PathResult {}

    /**
     * Statement-level change report.
     *
     * @param changes  rows changed by the statement
     * @param newRowId the connection's last generated row id moved
     * @param lastRowId the connection's last generated row id after the statement, {@code null} if none
     */
    record Changed(int changes, boolean newRowId, Long lastRowId) implements PathResult {}
}
