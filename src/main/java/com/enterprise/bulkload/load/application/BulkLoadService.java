package com.enterprise.bulkload.load.application;

import com.enterprise.bulkload.load.domain.BulkLoadRequest;
import com.enterprise.bulkload.load.domain.ColumnMapping;
import com.enterprise.bulkload.load.domain.Destination;
import com.enterprise.bulkload.load.domain.ExecutionSummary;
import com.enterprise.bulkload.load.domain.Pragmas;
import com.enterprise.bulkload.load.domain.Timings;
import com.enterprise.bulkload.load.domain.TypedSource;
import com.enterprise.bulkload.load.domain.exception.LoadConfigurationException;
import com.enterprise.bulkload.load.domain.exception.LoadConnectionException;
import com.enterprise.bulkload.shared.valueresolver.port.InvocationContext;
import com.enterprise.bulkload.shared.valueresolver.port.SourceKind;
import com.enterprise.bulkload.shared.valueresolver.port.TypedValueResolver;
import com.enterprise.bulkload.shared.valueresolver.port.TypedValueWriter;
import com.enterprise.bulkload.sql.validation.IdentifierValidator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point of a bulk run: resolves a {@link BulkLoadRequest} against an
 * invocation, opens the database, executes, and publishes the summary.
 *
 * <p>All configuration problems surface before the database is opened. The
 * session is closed on every exit path.
 */
public class BulkLoadService {

    private static final Logger log = LoggerFactory.getLogger(BulkLoadService.class);

    private final ConnectionSessionFactory sessionFactory;
    private final BulkExecutor executor;
    private final TypedValueResolver resolver;
    private final TypedValueWriter writer;
    private final RowResolver rowResolver;

    public BulkLoadService(ConnectionSessionFactory sessionFactory,
                           BulkExecutor executor,
                           TypedValueResolver resolver,
                           TypedValueWriter writer) {
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.rowResolver = new RowResolver(resolver);
    }

    public ExecutionSummary load(BulkLoadRequest request, InvocationContext context) {
        String location = resolveLocation(request.database(), context);
        List<Object> rows = resolveRows(request.records(), context);
        LoadPlan plan = plan(request, rows, context);

        long openedAt = System.currentTimeMillis();
        try (ConnectionSession session = sessionFactory.open(location)) {
            applyPragmas(session, request.pragmas());
            ExecutionSummary summary = executor.execute(session, plan, rows);
            summary = summary.withTimings(new Timings(
                    System.currentTimeMillis() - openedAt,
                    summary.timings().msExec(),
                    summary.timings().msTotal()));

            publish(request.summaryTo(), summary.toMap(), context);
            if (request.returning().enabled()) {
                publish(request.rowsTo(), summary.returnedRowMaps(), context);
            }
            log.info("Bulk load into {} done: {} in {} ms", plan.table(), summary.counts(),
                    summary.timings().msTotal());
            return summary;
        }
    }

    /**
     * Validates the request against the resolved rows and fixes the column list.
     * Throws before any connection exists.
     */
    LoadPlan plan(BulkLoadRequest request, List<Object> rows, InvocationContext context) {
        String table = request.table();
        if (table == null || table.isBlank()) {
            throw new LoadConfigurationException("Table name is required");
        }
        IdentifierValidator.requireIdentifier(table);

        List<ColumnMapping> mappings = request.autoMap() ? autoMappings(rows) : request.mappings();
        if (mappings.isEmpty()) {
            throw new LoadConfigurationException("No columns configured");
        }
        Set<String> seen = new HashSet<>();
        for (ColumnMapping m : mappings) {
            if (!seen.add(m.column())) {
                throw new LoadConfigurationException("Duplicate column: " + m.column());
            }
        }

        RowParameterMapper mapper = new RowParameterMapper(mappings, rowResolver, context);
        return new LoadPlan(table, mapper, request.conflict(), request.transaction(),
                request.returning(), request.preSql(), request.postSql());
    }

    private String resolveLocation(TypedSource database, InvocationContext context) {
        Object value = resolver.resolve(database.kind(), database.spec(), context);
        if (!(value instanceof String location) || location.isBlank()) {
            throw new LoadConfigurationException("Invalid database path");
        }
        return location;
    }

    List<Object> resolveRows(TypedSource records, InvocationContext context) {
        Object value = resolver.resolve(records.kind(), records.spec(), context);
        if (value == null && records.kind() == SourceKind.MESSAGE) {
            value = context.message().get("payload");
        }
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> c) {
            return new ArrayList<>(c);
        }
        if (value instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return List.of(value);
    }

    private static List<ColumnMapping> autoMappings(List<Object> rows) {
        List<ColumnMapping> mappings = new ArrayList<>();
        rows.stream()
                .filter(Map.class::isInstance)
                .findFirst()
                .ifPresent(first -> ((Map<?, ?>) first).keySet()
                        .forEach(k -> mappings.add(ColumnMapping.of(String.valueOf(k)))));
        return mappings;
    }

    private static void applyPragmas(ConnectionSession session, Pragmas pragmas) {
        for (String pragma : pragmas.statements()) {
            try {
                session.jdbc().execute(pragma);
            } catch (DataAccessException e) {
                throw new LoadConnectionException("Could not apply '" + pragma + "'", e);
            }
        }
    }

    private void publish(Destination destination, Object value, InvocationContext context) {
        writer.write(destination.scope(), destination.path(), value, context);
    }
}
