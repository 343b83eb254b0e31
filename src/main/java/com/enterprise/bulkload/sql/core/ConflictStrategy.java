package com.enterprise.bulkload.sql.core;

/**
 * What the INSERT does when a uniqueness constraint fires.
 */
public enum ConflictStrategy {
    NONE("INSERT INTO"),
    IGNORE("INSERT OR IGNORE INTO"),
    REPLACE("INSERT OR REPLACE INTO"),
    UPSERT("INSERT INTO");

    private final String sql;

    ConflictStrategy(String sql) { this.sql = sql; }

    public String sql() { return sql; }
}
