package com.enterprise.bulkload.load.application;

import com.enterprise.bulkload.load.domain.RowAction;
import com.enterprise.bulkload.load.domain.RowOutcome;
import com.enterprise.bulkload.sql.builder.InsertStatement;
import com.enterprise.bulkload.sql.param.ParameterBinder;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Runs {@code INSERT ... RETURNING} as a query: one echoed row means the row
 * was written, no row means the conflict policy skipped it.
 */
public class ReturningExecutionPath implements ExecutionPath {

    private final InsertStatement statement;
    private final ParameterBinder binder;
    private final ResultReconciler reconciler;

    public ReturningExecutionPath(InsertStatement statement, ParameterBinder binder, ResultReconciler reconciler) {
        if (!statement.returning()) {
            throw new IllegalArgumentException("Statement has no RETURNING clause: " + statement.sql());
        }
        this.statement = statement;
        this.binder = binder;
        this.reconciler = reconciler;
    }

    @Override
    public String name() {
        return "returning";
    }

    @Override
    public boolean reports(RowOutcome outcome) {
        return outcome.action() == RowAction.INSERTED || outcome.action() == RowAction.UPDATED;
    }

    @Override
    public RowExecution open(Connection connection) throws SQLException {
        PreparedStatement ps = connection.prepareStatement(statement.sql());
        int width = statement.columns().size();
        return new RowExecution() {
            @Override
            public RowOutcome execute(Object[] params) throws SQLException {
                binder.bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return reconciler.reconcile(new PathResult.NotEchoed(), params);
                    }
                    Object id = rs.getObject(1);
                    Object[] values = new Object[width];
                    for (int i = 0; i < width; i++) {
                        values[i] = rs.getObject(i + 2);
                    }
                    return reconciler.reconcile(new PathResult.Echoed(id, values), params);
                }
            }

            @Override
            public void close() throws SQLException {
                ps.close();
            }
        };
    }
}
