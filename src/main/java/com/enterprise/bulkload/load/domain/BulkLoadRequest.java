package com.enterprise.bulkload.load.domain;

import com.enterprise.bulkload.shared.valueresolver.port.SourceKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Complete configuration of one bulk-load invocation.
 *
 * <p>Built fluently:
 * <pre>{@code
 * BulkLoadRequest request = BulkLoadRequest.builder()
 *     .database(TypedSource.literal("/data/app.db"))
 *     .table("customers")
 *     .map(ColumnMapping.path("email", "contact.email", TransformKind.LOWER))
 *     .map(ColumnMapping.of("name"))
 *     .conflict(ConflictPolicy.upsert(List.of("email"), List.of("name")))
 *     .transaction(TransactionPolicy.chunked(200, true))
 *     .returning(ReturnPolicy.affected("id"))
 *     .build();
 * }</pre>
 *
 * @param database    resolves to the database file location
 * @param records     resolves to the input: a list of rows or a single row
 * @param autoMap     derive columns from the keys of the first map-shaped row
 * @param preSql      statement run once before the rows, outside exec timing
 * @param postSql     statement run once after the rows, outside exec timing
 * @param summaryTo   where the summary map is written
 * @param rowsTo      where returned rows are written when a return mode is set
 */
public record BulkLoadRequest(TypedSource database,
                              Pragmas pragmas,
                              TypedSource records,
                              String table,
                              boolean autoMap,
                              List<ColumnMapping> mappings,
                              ConflictPolicy conflict,
                              TransactionPolicy transaction,
                              String preSql,
                              String postSql,
                              ReturnPolicy returning,
                              Destination summaryTo,
                              Destination rowsTo) {

    public BulkLoadRequest {
        Objects.requireNonNull(database, "database");
        pragmas = pragmas == null ? Pragmas.none() : pragmas;
        records = records == null ? TypedSource.message("payload") : records;
        mappings = mappings == null ? List.of() : List.copyOf(mappings);
        conflict = conflict == null ? ConflictPolicy.none() : conflict;
        transaction = transaction == null ? TransactionPolicy.single(false) : transaction;
        returning = returning == null ? ReturnPolicy.none() : returning;
        summaryTo = summaryTo == null ? Destination.message("bulkload") : summaryTo;
        rowsTo = rowsTo == null ? Destination.message("bulkload.rows") : rowsTo;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private TypedSource database;
        private Pragmas pragmas;
        private TypedSource records;
        private String table;
        private boolean autoMap;
        private final List<ColumnMapping> mappings = new ArrayList<>();
        private ConflictPolicy conflict;
        private TransactionPolicy transaction;
        private String preSql;
        private String postSql;
        private ReturnPolicy returning;
        private Destination summaryTo;
        private Destination rowsTo;

        private Builder() {}

        public Builder database(TypedSource database) {
            this.database = database;
            return this;
        }

        public Builder database(String location) {
            return database(TypedSource.literal(location));
        }

        public Builder pragmas(Pragmas pragmas) {
            this.pragmas = pragmas;
            return this;
        }

        public Builder records(TypedSource records) {
            this.records = records;
            return this;
        }

        public Builder records(SourceKind kind, String spec) {
            return records(new TypedSource(kind, spec));
        }

        public Builder table(String table) {
            this.table = table;
            return this;
        }

        public Builder autoMap(boolean autoMap) {
            this.autoMap = autoMap;
            return this;
        }

        public Builder map(ColumnMapping mapping) {
            this.mappings.add(mapping);
            return this;
        }

        public Builder mappings(List<ColumnMapping> mappings) {
            this.mappings.addAll(mappings);
            return this;
        }

        public Builder conflict(ConflictPolicy conflict) {
            this.conflict = conflict;
            return this;
        }

        public Builder transaction(TransactionPolicy transaction) {
            this.transaction = transaction;
            return this;
        }

        public Builder preSql(String preSql) {
            this.preSql = preSql;
            return this;
        }

        public Builder postSql(String postSql) {
            this.postSql = postSql;
            return this;
        }

        public Builder returning(ReturnPolicy returning) {
            this.returning = returning;
            return this;
        }

        public Builder summaryTo(Destination summaryTo) {
            this.summaryTo = summaryTo;
            return this;
        }

        public Builder rowsTo(Destination rowsTo) {
            this.rowsTo = rowsTo;
            return this;
        }

        public BulkLoadRequest build() {
            return new BulkLoadRequest(database, pragmas, records, table, autoMap, mappings,
                    conflict, transaction, preSql, postSql, returning, summaryTo, rowsTo);
        }
    }
}
