package com.enterprise.bulkload.sql.core;

public final class Dialects {

    private Dialects() {}

    public static final EngineVersion SQLITE_RETURNING_SINCE = new EngineVersion(3, 35, 0);

    public static final SqlDialect SQLITE = sqlite(SQLITE_RETURNING_SINCE);

    /**
     * SQLite dialect with a custom RETURNING threshold. A threshold above the
     * running engine forces the changes/last-rowid fallback.
     */
    public static SqlDialect sqlite(EngineVersion returningSince) {
        return new SqlDialect() {
            @Override public String versionQuery() {
                return "SELECT sqlite_version()";
            }
            @Override public String lastInsertIdQuery() {
                return "SELECT last_insert_rowid()";
            }
            @Override public String implicitRowId() {
                return "rowid";
            }
            @Override public EngineVersion minimumReturningVersion() {
                return returningSince;
            }
        };
    }
}
