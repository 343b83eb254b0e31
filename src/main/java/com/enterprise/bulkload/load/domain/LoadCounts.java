package com.enterprise.bulkload.load.domain;

import java.util.LinkedHashMap;
import java.util.Map;

public record LoadCounts(long inserted, long updated, long skipped, long errors, long total) {

    /** Every row accounted for; false only after an aborted run. */
    public boolean isBalanced() {
        return inserted + updated + skipped + errors == total;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("inserted", inserted);
        m.put("updated", updated);
        m.put("skipped", skipped);
        m.put("errors", errors);
        m.put("total", total);
        return m;
    }

    @Override
    public String toString() {
        return "I:" + inserted + " U:" + updated + " S:" + skipped + " E:" + errors;
    }
}
