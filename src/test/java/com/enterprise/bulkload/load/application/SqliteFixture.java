package com.enterprise.bulkload.load.application;

import com.enterprise.bulkload.load.infrastructure.SqliteSessionFactory;
import com.enterprise.bulkload.shared.valueresolver.adapter.DefaultTypedValueResolver;
import com.enterprise.bulkload.shared.valueresolver.adapter.DefaultTypedValueWriter;
import com.enterprise.bulkload.shared.valueresolver.adapter.SpelExpressionEvaluator;
import com.enterprise.bulkload.sql.core.Dialects;
import com.enterprise.bulkload.sql.core.EngineVersion;
import com.enterprise.bulkload.sql.core.SqlDialect;
import com.enterprise.bulkload.sql.param.ParameterBinder;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires a {@link BulkLoadService} against SQLite files for tests.
 */
final class SqliteFixture {

    /** Threshold no real engine reaches: always takes the fallback path. */
    static final SqlDialect FALLBACK_ONLY = Dialects.sqlite(new EngineVersion(99, 0, 0));

    final SqlDialect dialect;
    final List<ConnectionSession> openedSessions = new ArrayList<>();
    final BulkLoadService service;

    SqliteFixture(SqlDialect dialect) {
        this.dialect = dialect;
        ObjectMapper objectMapper = new ObjectMapper();
        SqliteSessionFactory sqlite = new SqliteSessionFactory(new CapabilityDetector(dialect));
        ConnectionSessionFactory recording = location -> {
            ConnectionSession session = sqlite.open(location);
            openedSessions.add(session);
            return session;
        };
        this.service = new BulkLoadService(
                recording,
                new BulkExecutor(dialect, new ParameterBinder(objectMapper)),
                new DefaultTypedValueResolver(new MockEnvironment(), objectMapper, new SpelExpressionEvaluator()),
                new DefaultTypedValueWriter());
    }

    static SqliteFixture returning() {
        return new SqliteFixture(Dialects.SQLITE);
    }

    static SqliteFixture fallback() {
        return new SqliteFixture(FALLBACK_ONLY);
    }

    static JdbcTemplate jdbc(Path db) {
        return new JdbcTemplate(new DriverManagerDataSource("jdbc:sqlite:" + db));
    }

    static Path customersDb(Path dir, String name) {
        Path db = dir.resolve(name);
        jdbc(db).execute("CREATE TABLE customers ("
                + "id INTEGER PRIMARY KEY, "
                + "email TEXT NOT NULL UNIQUE, "
                + "name TEXT, "
                + "qty INTEGER)");
        return db;
    }

    /** Mutable row; allows null values. */
    static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
