package com.enterprise.bulkload.sql.core;

/**
 * Engine-specific statements the bulk engine needs besides the INSERT itself.
 */
public interface SqlDialect {

    /** Query returning the engine's self-reported version string. */
    String versionQuery();

    /** Query returning the most recent generated row identifier on this connection. */
    String lastInsertIdQuery();

    /** Implicit row identifier used when no id column is configured. */
    String implicitRowId();

    /** First version accepting {@code INSERT ... RETURNING}. */
    EngineVersion minimumReturningVersion();
}
