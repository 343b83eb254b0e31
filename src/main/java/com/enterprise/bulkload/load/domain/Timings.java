package com.enterprise.bulkload.load.domain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param msOpen from connection open to the end of the run, bracket statements included
 * @param msExec row execution only
 * @param msTotal from the pre-run statement to the end of the post-run statement
 */
public record Timings(long msOpen, long msExec, long msTotal) {

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("msOpen", msOpen);
        m.put("msExec", msExec);
        m.put("msTotal", msTotal);
        return m;
    }
}
