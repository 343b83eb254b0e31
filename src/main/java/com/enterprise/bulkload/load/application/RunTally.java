package com.enterprise.bulkload.load.application;

import com.enterprise.bulkload.load.domain.ExecutionSummary;
import com.enterprise.bulkload.load.domain.LoadCounts;
import com.enterprise.bulkload.load.domain.RowOutcome;
import com.enterprise.bulkload.load.domain.Timings;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable counters for one run, or for one transaction scope until it commits.
 * Not thread-safe; a run owns its tallies.
 */
final class RunTally {

    private long inserted;
    private long updated;
    private long skipped;
    private long errors;
    private Object firstId;
    private Object lastId;
    private final List<RowOutcome> returned = new ArrayList<>();

    void record(RowOutcome outcome, boolean report) {
        switch (outcome.action()) {
            case INSERTED -> inserted++;
            case UPDATED -> updated++;
            case SKIPPED -> skipped++;
            case ERRORED -> errors++;
        }
        if (outcome.id() != null) {
            if (firstId == null) {
                firstId = outcome.id();
            }
            lastId = outcome.id();
        }
        if (report) {
            returned.add(outcome);
        }
    }

    void error() {
        errors++;
    }

    void errors(long count) {
        errors += count;
    }

    long errors() {
        return errors;
    }

    /** Folds a committed scope into this tally. */
    void absorb(RunTally scope) {
        inserted += scope.inserted;
        updated += scope.updated;
        skipped += scope.skipped;
        errors += scope.errors;
        if (scope.firstId != null && firstId == null) {
            firstId = scope.firstId;
        }
        if (scope.lastId != null) {
            lastId = scope.lastId;
        }
        returned.addAll(scope.returned);
    }

    ExecutionSummary toSummary(String table, long total, Timings timings, boolean aborted) {
        LoadCounts counts = new LoadCounts(inserted, updated, skipped, errors, total);
        return new ExecutionSummary(table, counts, firstId, lastId, returned, timings, aborted);
    }
}
