package com.enterprise.bulkload.sql.builder;

import java.util.List;

/**
 * Positional INSERT text built once per run and executed for every row.
 *
 * @param sql       statement with one {@code ?} per column, in column order
 * @param columns   bound columns, in placeholder order
 * @param returning whether the statement ends with a RETURNING clause; the
 *                  result set then holds the id under {@link #ID_ALIAS}
 *                  followed by every column
 */
public record InsertStatement(String sql, List<String> columns, boolean returning) {

    public static final String ID_ALIAS = "__id";

    public InsertStatement {
        columns = List.copyOf(columns);
    }

    public int parameterCount() {
        return columns.size();
    }
}
