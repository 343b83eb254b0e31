package com.enterprise.bulkload.load.application;

import com.enterprise.bulkload.load.domain.ConflictPolicy;
import com.enterprise.bulkload.load.domain.ReturnMode;
import com.enterprise.bulkload.load.domain.ReturnPolicy;
import com.enterprise.bulkload.load.domain.RowAction;
import com.enterprise.bulkload.load.domain.RowOutcome;
import com.enterprise.bulkload.sql.builder.InsertStatement;
import com.enterprise.bulkload.sql.core.SqlDialect;
import com.enterprise.bulkload.sql.param.ParameterBinder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

import static com.enterprise.bulkload.sql.validation.IdentifierValidator.quote;

/**
 * Path for engines without RETURNING: the update count tells written from
 * skipped, and a moved last-insert row id tells an insert from an update.
 *
 * <p>In {@link ReturnMode#AFFECTED} mode an updated upsert row has its id looked
 * up by conflict key. A failed lookup leaves the row without an id.
 */
public class FallbackExecutionPath implements ExecutionPath {

    private static final Logger log = LoggerFactory.getLogger(FallbackExecutionPath.class);

    private final InsertStatement statement;
    private final ParameterBinder binder;
    private final ResultReconciler reconciler;
    private final SqlDialect dialect;
    private final String table;
    private final ConflictPolicy conflict;
    private final ReturnPolicy returning;

    public FallbackExecutionPath(InsertStatement statement,
                                 ParameterBinder binder,
                                 ResultReconciler reconciler,
                                 SqlDialect dialect,
                                 String table,
                                 ConflictPolicy conflict,
                                 ReturnPolicy returning) {
        this.statement = statement;
        this.binder = binder;
        this.reconciler = reconciler;
        this.dialect = dialect;
        this.table = table;
        this.conflict = conflict;
        this.returning = returning;
    }

    @Override
    public String name() {
        return "fallback";
    }

    @Override
    public boolean reports(RowOutcome outcome) {
        return switch (outcome.action()) {
            case INSERTED -> returning.enabled();
            case UPDATED -> returning.mode() == ReturnMode.AFFECTED && outcome.id() != null;
            default -> false;
        };
    }

    String lookupSql() {
        String idSel = returning.idColumn() != null ? quote(returning.idColumn()) : dialect.implicitRowId();
        String where = conflict.keys().stream()
                .map(k -> quote(k) + "=?")
                .collect(Collectors.joining(" AND "));
        return "SELECT " + idSel + " AS id FROM " + quote(table) + " WHERE " + where + " LIMIT 1";
    }

    private boolean looksUpUpdates() {
        return conflict.isUpsert() && returning.mode() == ReturnMode.AFFECTED;
    }

    @Override
    public RowExecution open(Connection connection) throws SQLException {
        PreparedStatement insert = connection.prepareStatement(statement.sql());
        PreparedStatement lastId = null;
        PreparedStatement lookup = null;
        try {
            lastId = connection.prepareStatement(dialect.lastInsertIdQuery());
            lookup = looksUpUpdates() ? connection.prepareStatement(lookupSql()) : null;
            return new FallbackRowExecution(insert, lastId, lookup);
        } catch (SQLException e) {
            closeQuietly(lookup, e);
            closeQuietly(lastId, e);
            closeQuietly(insert, e);
            throw e;
        }
    }

    private static void closeQuietly(PreparedStatement ps, SQLException failure) {
        if (ps == null) {
            return;
        }
        try {
            ps.close();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private final class FallbackRowExecution implements RowExecution {

        private final PreparedStatement insert;
        private final PreparedStatement lastId;
        private final PreparedStatement lookup;
        private long previousRowId;

        FallbackRowExecution(PreparedStatement insert, PreparedStatement lastId, PreparedStatement lookup)
                throws SQLException {
            this.insert = insert;
            this.lastId = lastId;
            this.lookup = lookup;
            this.previousRowId = readLastRowId();
        }

        @Override
        public RowOutcome execute(Object[] params) throws SQLException {
            binder.bind(insert, params);
            int changes = insert.executeUpdate();
            long current = readLastRowId();
            boolean moved = current != previousRowId;
            previousRowId = current;

            RowOutcome outcome = reconciler.reconcile(
                    new PathResult.Changed(changes, moved, current == 0 ? null : current), params);
            if (outcome.action() == RowAction.UPDATED && lookup != null) {
                return outcome.withId(lookupId(params));
            }
            return outcome;
        }

        private long readLastRowId() throws SQLException {
            try (ResultSet rs = lastId.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }

        private Object lookupId(Object[] params) {
            List<String> columns = statement.columns();
            Object[] keyValues = new Object[conflict.keys().size()];
            for (int i = 0; i < keyValues.length; i++) {
                int idx = columns.indexOf(conflict.keys().get(i));
                keyValues[i] = idx >= 0 ? params[idx] : null;
            }
            try {
                binder.bind(lookup, keyValues);
                try (ResultSet rs = lookup.executeQuery()) {
                    return rs.next() ? ResultReconciler.widen(rs.getObject(1)) : null;
                }
            } catch (SQLException e) {
                log.warn("Id lookup after upsert on {} failed: {}", table, e.getMessage());
                return null;
            }
        }

        @Override
        public void close() throws SQLException {
            try {
                insert.close();
                lastId.close();
            } finally {
                if (lookup != null) {
                    lookup.close();
                }
            }
        }
    }
}
