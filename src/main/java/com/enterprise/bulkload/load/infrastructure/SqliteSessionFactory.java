package com.enterprise.bulkload.load.infrastructure;

import com.enterprise.bulkload.load.application.CapabilityDetector;
import com.enterprise.bulkload.load.application.ConnectionSession;
import com.enterprise.bulkload.load.application.ConnectionSessionFactory;
import com.enterprise.bulkload.load.domain.exception.LoadConnectionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteDataSource;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens SQLite databases through the xerial driver. A plain location is a file
 * path; a location starting with {@code jdbc:} is used as the URL as is.
 */
public class SqliteSessionFactory implements ConnectionSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(SqliteSessionFactory.class);

    private final CapabilityDetector detector;

    public SqliteSessionFactory(CapabilityDetector detector) {
        this.detector = detector;
    }

    @Override
    public ConnectionSession open(String location) {
        String url = location.startsWith("jdbc:") ? location : "jdbc:sqlite:" + location;
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl(url);
        try {
            Connection connection = dataSource.getConnection();
            log.debug("Opened {}", url);
            return new ConnectionSession(connection, detector);
        } catch (SQLException e) {
            throw new LoadConnectionException("Could not open database " + location, e);
        }
    }
}
