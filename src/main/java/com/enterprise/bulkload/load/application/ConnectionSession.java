package com.enterprise.bulkload.load.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * One open connection, exclusively owned by one run.
 *
 * <p>The connection sits behind a close-suppressing {@link SingleConnectionDataSource}
 * so the {@link JdbcTemplate} and the {@link TransactionTemplate} work on it and
 * nothing else. The RETURNING capability is detected at most once per session
 * and forgotten on {@link #close()}.
 */
public class ConnectionSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSession.class);

    private final Connection connection;
    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final CapabilityDetector detector;

    private Boolean supportsReturning;
    private boolean closed;

    public ConnectionSession(Connection connection, CapabilityDetector detector) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.detector = Objects.requireNonNull(detector, "detector");
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource(connection, true);
        this.jdbc = new JdbcTemplate(dataSource);
        this.transactions = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    public JdbcTemplate jdbc() {
        return jdbc;
    }

    public TransactionTemplate transactions() {
        return transactions;
    }

    /** Memoized for the lifetime of this session. */
    public boolean supportsReturning() {
        if (closed) {
            throw new IllegalStateException("Session closed");
        }
        if (supportsReturning == null) {
            supportsReturning = detector.detect(jdbc);
        }
        return supportsReturning;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        supportsReturning = null;
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Could not close database connection: {}", e.getMessage());
        }
    }
}
