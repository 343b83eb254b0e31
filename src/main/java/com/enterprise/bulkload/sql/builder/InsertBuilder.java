package com.enterprise.bulkload.sql.builder;

import com.enterprise.bulkload.sql.core.ConflictStrategy;

import java.util.*;
import java.util.stream.Collectors;

import static com.enterprise.bulkload.sql.validation.IdentifierValidator.quote;
import static com.enterprise.bulkload.sql.validation.IdentifierValidator.requireIdentifier;

/**
 * Fluent builder for the single parameterized INSERT of a bulk run.
 *
 * <p>Conflict handling maps to SQLite syntax:
 * <ul>
 *   <li>{@code IGNORE}: {@code INSERT OR IGNORE INTO ...}</li>
 *   <li>{@code REPLACE}: {@code INSERT OR REPLACE INTO ...}</li>
 *   <li>{@code UPSERT}: {@code ... ON CONFLICT(keys) DO UPDATE SET c=excluded.c}</li>
 * </ul>
 *
 * <p>Example:
 * <pre>{@code
 * InsertStatement s = InsertBuilder.insert()
 *     .into("customers")
 *     .columns("email", "name")
 *     .onConflictUpdate(List.of("email"), List.of("name"))
 *     .returning("id")
 *     .build();
 * // INSERT INTO "customers" ("email", "name") VALUES (?, ?)
 * //   ON CONFLICT("email") DO UPDATE SET "name"=excluded."name"
 * //   RETURNING "id" AS __id, "email", "name"
 * }</pre>
 *
 * <p>Every table and column name is validated before it is concatenated;
 * a malformed one fails the build with
 * {@link com.enterprise.bulkload.load.domain.exception.InvalidIdentifierException}.
 */
public class InsertBuilder {

    private String table;
    private final List<String> columns = new ArrayList<>();
    private ConflictStrategy strategy = ConflictStrategy.NONE;
    private final List<String> conflictKeys = new ArrayList<>();
    private final List<String> updateColumns = new ArrayList<>();
    private String returningId;
    private boolean returningRaw;

    private InsertBuilder() {}

    public static InsertBuilder insert() {
        return new InsertBuilder();
    }

    public InsertBuilder into(String table) {
        this.table = Objects.requireNonNull(table, "table");
        return this;
    }

    public InsertBuilder columns(String... cols) {
        return columns(Arrays.asList(cols));
    }

    public InsertBuilder columns(Collection<String> cols) {
        this.columns.addAll(cols);
        return this;
    }

    /**
     * NONE, IGNORE or REPLACE. UPSERT needs keys: use {@link #onConflictUpdate}.
     */
    public InsertBuilder onConflict(ConflictStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        return this;
    }

    /**
     * ON CONFLICT(keys) DO UPDATE SET col=excluded.col for each update column that
     * is also an inserted column. With none left, the first key is assigned to
     * itself: valid syntax, no change.
     */
    public InsertBuilder onConflictUpdate(List<String> keys, Collection<String> updateCols) {
        this.strategy = ConflictStrategy.UPSERT;
        this.conflictKeys.addAll(keys);
        this.updateColumns.addAll(updateCols);
        return this;
    }

    /**
     * RETURNING "idColumn" AS __id, followed by every inserted column.
     */
    public InsertBuilder returning(String idColumn) {
        this.returningId = requireIdentifier(idColumn);
        this.returningRaw = false;
        return this;
    }

    /**
     * RETURNING with the engine's implicit row identifier (unquoted, e.g. {@code rowid}).
     */
    public InsertBuilder returningRowId(String implicitRowId) {
        this.returningId = requireIdentifier(implicitRowId);
        this.returningRaw = true;
        return this;
    }

    public InsertStatement build() {
        Objects.requireNonNull(table, "table required, call .into(table)");
        if (columns.isEmpty()) {
            throw new IllegalStateException("No columns, call .columns()");
        }
        String colNames = columns.stream().map(c -> quote(c)).collect(Collectors.joining(", "));
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));

        StringBuilder sql = new StringBuilder();
        sql.append(strategy.sql()).append(' ').append(quote(table))
           .append(" (").append(colNames).append(")")
           .append(" VALUES (").append(placeholders).append(")");

        if (strategy == ConflictStrategy.UPSERT) {
            appendUpsert(sql);
        }
        if (returningId != null) {
            sql.append(" RETURNING ")
               .append(returningRaw ? returningId : quote(returningId))
               .append(" AS ").append(InsertStatement.ID_ALIAS)
               .append(", ").append(colNames);
        }
        return new InsertStatement(sql.toString(), columns, returningId != null);
    }

    private void appendUpsert(StringBuilder sql) {
        if (conflictKeys.isEmpty()) {
            throw new IllegalStateException("ON CONFLICT keys required for UPSERT");
        }
        String keys = conflictKeys.stream().map(k -> quote(k)).collect(Collectors.joining(","));
        String sets = updateColumns.stream()
                .filter(columns::contains)
                .distinct()
                .map(c -> quote(c) + "=excluded." + quote(c))
                .collect(Collectors.joining(", "));
        if (sets.isEmpty()) {
            String first = quote(conflictKeys.get(0));
            sets = first + "=" + first;
        }
        sql.append(" ON CONFLICT(").append(keys).append(") DO UPDATE SET ").append(sets);
    }
}
