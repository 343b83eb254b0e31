package com.enterprise.bulkload.load.application;

import com.enterprise.bulkload.load.domain.RowAction;
import com.enterprise.bulkload.load.domain.RowOutcome;
import com.enterprise.bulkload.sql.core.ConflictStrategy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies what a path observed into a {@link RowOutcome}.
 *
 * <p>Integral numbers are widened to {@code Long} and floats to {@code Double},
 * so ids and row data compare equal whichever path produced them.
 */
public class ResultReconciler {

    private final List<String> columns;
    private final ConflictStrategy strategy;

    public ResultReconciler(List<String> columns, ConflictStrategy strategy) {
        this.columns = List.copyOf(columns);
        this.strategy = strategy;
    }

    public RowOutcome reconcile(PathResult result, Object[] params) {
        if (result instanceof PathResult.Echoed echoed) {
            // the echo does not say whether the upsert inserted or updated
            RowAction action = strategy == ConflictStrategy.UPSERT ? RowAction.UPDATED : RowAction.INSERTED;
            return new RowOutcome(action, widen(echoed.id()), data(echoed.values()));
        }
        if (result instanceof PathResult.Changed changed) {
            if (changed.changes() <= 0) {
                return skipped(params);
            }
            if (strategy == ConflictStrategy.UPSERT && !changed.newRowId()) {
                return new RowOutcome(RowAction.UPDATED, null, data(params));
            }
            return new RowOutcome(RowAction.INSERTED, changed.lastRowId(), data(params));
        }
        return skipped(params);
    }

    public RowOutcome skipped(Object[] params) {
        return new RowOutcome(RowAction.SKIPPED, null, data(params));
    }

    private Map<String, Object> data(Object[] values) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            data.put(columns.get(i), i < values.length ? widen(values[i]) : null);
        }
        return data;
    }

    static Object widen(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }
}
