package com.enterprise.bulkload.load.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate result of one bulk run.
 *
 * @param firstId      first non-null id observed, in processing order
 * @param lastId       most recent non-null id observed
 * @param returnedRows reported rows, in processing order; empty unless a return mode was set
 * @param aborted      the run stopped before every row was attempted
 */
public record ExecutionSummary(String table,
                               LoadCounts counts,
                               Object firstId,
                               Object lastId,
                               List<RowOutcome> returnedRows,
                               Timings timings,
                               boolean aborted) {

    public ExecutionSummary {
        returnedRows = List.copyOf(returnedRows);
    }

    public boolean ok() {
        return counts.errors() == 0 && !aborted;
    }

    public ExecutionSummary withTimings(Timings newTimings) {
        return new ExecutionSummary(table, counts, firstId, lastId, returnedRows, newTimings, aborted);
    }

    /**
     * Plain map form written to output destinations. Returned rows are not
     * included; they go to their own destination.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ok", ok());
        m.put("table", table);
        m.put("counts", counts.toMap());
        m.put("firstInsertId", firstId);
        m.put("lastInsertId", lastId);
        m.put("timings", timings.toMap());
        if (aborted) {
            m.put("aborted", true);
        }
        return m;
    }

    public List<Map<String, Object>> returnedRowMaps() {
        List<Map<String, Object>> rows = new ArrayList<>(returnedRows.size());
        for (RowOutcome r : returnedRows) {
            rows.add(r.toMap());
        }
        return rows;
    }
}
