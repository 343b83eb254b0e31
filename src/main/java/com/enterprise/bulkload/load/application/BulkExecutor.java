package com.enterprise.bulkload.load.application;

import com.enterprise.bulkload.load.domain.ExecutionSummary;
import com.enterprise.bulkload.load.domain.RowOutcome;
import com.enterprise.bulkload.load.domain.RunPhase;
import com.enterprise.bulkload.load.domain.Timings;
import com.enterprise.bulkload.load.domain.TransactionMode;
import com.enterprise.bulkload.load.domain.TransactionPolicy;
import com.enterprise.bulkload.load.domain.exception.BracketStatementException;
import com.enterprise.bulkload.load.domain.exception.ChunkAbortException;
import com.enterprise.bulkload.load.domain.exception.LoadConnectionException;
import com.enterprise.bulkload.load.domain.exception.RowExecutionException;
import com.enterprise.bulkload.sql.builder.InsertStatement;
import com.enterprise.bulkload.sql.core.SqlDialect;
import com.enterprise.bulkload.sql.debug.QueryDebugger;
import com.enterprise.bulkload.sql.param.ParameterBinder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.transaction.TransactionException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Runs a {@link LoadPlan} over an open session:
 * pre-run statement, rows in their transaction scopes, post-run statement.
 *
 * <p>Scopes by {@link TransactionMode}:
 * <ul>
 *   <li>{@code NONE}: every row autocommits</li>
 *   <li>{@code SINGLE}: one transaction around all rows</li>
 *   <li>{@code CHUNKED}: one transaction per {@code chunkSize} consecutive rows</li>
 * </ul>
 *
 * <p>Counts, ids and returned rows of a scope reach the summary only once the
 * scope is durable. A scope that fails for good rolls back and the run ends in
 * {@link ChunkAbortException}; later rows are not attempted. A statement the
 * engine cannot prepare ends the run in {@link LoadConnectionException}.
 */
public class BulkExecutor {

    private static final Logger log = LoggerFactory.getLogger(BulkExecutor.class);

    private final SqlDialect dialect;
    private final ParameterBinder binder;

    public BulkExecutor(SqlDialect dialect, ParameterBinder binder) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.binder = Objects.requireNonNull(binder, "binder");
    }

    public ExecutionSummary execute(ConnectionSession session, LoadPlan plan, List<?> rows) {
        long startedAt = System.currentTimeMillis();

        runBracket(session, RunPhase.PRE_HOOK, plan.preSql());

        boolean useReturning = plan.returning().enabled() && session.supportsReturning();
        InsertStatement statement = plan.statement(dialect, useReturning);
        ExecutionPath path = choosePath(plan, statement, useReturning);
        log.debug("Loading {} rows into {} via {} path ({}): {}",
                rows.size(), plan.table(), path.name(), plan.transaction().mode(), statement.sql());

        Run run = new Run(session, plan, rows, statement, path, startedAt);
        runRows(run);
        long msExec = System.currentTimeMillis() - run.execStartedAt;

        runBracket(session, RunPhase.POST_HOOK, plan.postSql());

        Timings timings = new Timings(0, msExec, System.currentTimeMillis() - startedAt);
        return run.durable.toSummary(plan.table(), rows.size(), timings, false);
    }

    private ExecutionPath choosePath(LoadPlan plan, InsertStatement statement, boolean useReturning) {
        ResultReconciler reconciler = new ResultReconciler(statement.columns(), plan.conflict().strategy());
        if (useReturning) {
            return new ReturningExecutionPath(statement, binder, reconciler);
        }
        return new FallbackExecutionPath(statement, binder, reconciler, dialect,
                plan.table(), plan.conflict(), plan.returning());
    }

    private void runBracket(ConnectionSession session, RunPhase phase, String sql) {
        if (sql == null || sql.isBlank()) {
            return;
        }
        try {
            log.debug("{}: {}", phase, sql);
            session.jdbc().execute(sql);
        } catch (DataAccessException e) {
            throw new BracketStatementException(phase, e);
        }
    }

    private void runRows(Run run) {
        int total = run.rows.size();
        if (total == 0) {
            return;
        }
        TransactionPolicy tx = run.plan.transaction();
        if (tx.mode() == TransactionMode.CHUNKED) {
            int chunk = 0;
            for (int from = 0; from < total; from += tx.chunkSize()) {
                runScope(run, chunk++, from, Math.min(total, from + tx.chunkSize()));
            }
        } else {
            runScope(run, 0, 0, total);
        }
    }

    private void runScope(Run run, int chunkIndex, int from, int to) {
        TransactionPolicy tx = run.plan.transaction();
        RunTally scope = new RunTally();
        try {
            if (tx.mode() == TransactionMode.NONE) {
                executeRows(run, from, to, scope);
            } else {
                run.session.transactions().executeWithoutResult(status -> executeRows(run, from, to, scope));
            }
            run.durable.absorb(scope);
        } catch (RowExecutionException e) {
            keepDurablePart(run, scope);
            throw abort(run, chunkIndex, e);
        } catch (LoadConnectionException | DataAccessException | TransactionException e) {
            if (tx.mode() == TransactionMode.CHUNKED && tx.continueOnError()) {
                run.durable.errors(to - from);
                log.warn("Chunk {} into {} rolled back, {} rows counted as errors: {}",
                        chunkIndex, run.plan.table(), to - from, e.getMessage());
                return;
            }
            if (e instanceof LoadConnectionException prepareFailure) {
                throw prepareFailure;
            }
            keepDurablePart(run, scope);
            throw abort(run, chunkIndex, e);
        }
    }

    // autocommitted rows stay written; a rolled-back scope keeps only its error count
    private void keepDurablePart(Run run, RunTally scope) {
        if (run.plan.transaction().mode() == TransactionMode.NONE) {
            run.durable.absorb(scope);
        } else {
            run.durable.errors(scope.errors());
        }
    }

    private void executeRows(Run run, int from, int to, RunTally scope) {
        run.session.jdbc().execute((ConnectionCallback<Void>) con -> {
            try (RowExecution execution = prepare(run, con)) {
                for (int i = from; i < to; i++) {
                    executeRow(run, execution, i, scope);
                }
            }
            return null;
        });
    }

    // a statement the engine refuses to prepare is fatal, not a row error
    private RowExecution prepare(Run run, Connection con) {
        try {
            return run.path.open(con);
        } catch (SQLException e) {
            throw new LoadConnectionException("Could not prepare statement for " + run.plan.table()
                    + ": " + e.getMessage(), translate(run, e));
        }
    }

    private void executeRow(Run run, RowExecution execution, int index, RunTally scope) {
        Object[] params = run.plan.mapper().toParameters(run.rows.get(index));
        try {
            RowOutcome outcome = execution.execute(params);
            scope.record(outcome, run.path.reports(outcome));
        } catch (SQLException | RuntimeException e) {
            scope.error();
            if (log.isDebugEnabled()) {
                log.debug("Row {} failed\n{}", index, QueryDebugger.format(run.statement, params));
            }
            if (!run.plan.transaction().continueOnError()) {
                throw new RowExecutionException(index, translate(run, e));
            }
            log.warn("Row {} into {} failed, continuing: {}", index, run.plan.table(), e.getMessage());
        }
    }

    private Throwable translate(Run run, Exception e) {
        if (e instanceof SQLException sqlEx) {
            DataAccessException translated = run.session.jdbc().getExceptionTranslator()
                    .translate("bulk insert", run.statement.sql(), sqlEx);
            return translated != null
                    ? translated
                    : new UncategorizedSQLException("bulk insert", run.statement.sql(), sqlEx);
        }
        return e;
    }

    private ChunkAbortException abort(Run run, int chunkIndex, Throwable cause) {
        long now = System.currentTimeMillis();
        Timings timings = new Timings(0, now - run.execStartedAt, now - run.startedAt);
        ExecutionSummary partial = run.durable.toSummary(run.plan.table(), run.rows.size(), timings, true);
        log.error("Bulk load into {} aborted in chunk {} ({}): {}",
                run.plan.table(), chunkIndex, partial.counts(), cause.getMessage());
        return new ChunkAbortException(chunkIndex, partial, cause);
    }

    private static final class Run {

        final ConnectionSession session;
        final LoadPlan plan;
        final List<?> rows;
        final InsertStatement statement;
        final ExecutionPath path;
        final long startedAt;
        final long execStartedAt = System.currentTimeMillis();
        final RunTally durable = new RunTally();

        Run(ConnectionSession session, LoadPlan plan, List<?> rows,
            InsertStatement statement, ExecutionPath path, long startedAt) {
            this.session = session;
            this.plan = plan;
            this.rows = rows;
            this.statement = statement;
            this.path = path;
            this.startedAt = startedAt;
        }
    }
}
