package com.enterprise.bulkload.load.application;

import com.enterprise.bulkload.load.domain.ConflictPolicy;
import com.enterprise.bulkload.load.domain.ReturnPolicy;
import com.enterprise.bulkload.load.domain.TransactionPolicy;
import com.enterprise.bulkload.sql.builder.InsertBuilder;
import com.enterprise.bulkload.sql.builder.InsertStatement;
import com.enterprise.bulkload.sql.core.SqlDialect;

import java.util.List;

/**
 * Everything the executor needs for one run, resolved and validated.
 */
public record LoadPlan(String table,
                       RowParameterMapper mapper,
                       ConflictPolicy conflict,
                       TransactionPolicy transaction,
                       ReturnPolicy returning,
                       String preSql,
                       String postSql) {

    public List<String> columns() {
        return mapper.columns();
    }

    /**
     * The run's single INSERT, with or without a RETURNING clause.
     */
    public InsertStatement statement(SqlDialect dialect, boolean withReturning) {
        InsertBuilder builder = InsertBuilder.insert().into(table).columns(columns());
        if (conflict.isUpsert()) {
            builder.onConflictUpdate(conflict.keys(), conflict.updateColumns());
        } else {
            builder.onConflict(conflict.strategy());
        }
        if (withReturning) {
            if (returning.idColumn() != null) {
                builder.returning(returning.idColumn());
            } else {
                builder.returningRowId(dialect.implicitRowId());
            }
        }
        return builder.build();
    }
}
