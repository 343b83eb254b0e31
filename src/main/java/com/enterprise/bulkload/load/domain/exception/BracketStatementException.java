package com.enterprise.bulkload.load.domain.exception;

import com.enterprise.bulkload.load.domain.RunPhase;

/**
 * Failure of the pre- or post-run statement. Kept apart from row failures:
 * nothing is counted for it.
 */
public class BracketStatementException extends BulkLoadException {

    private final RunPhase phase;

    public BracketStatementException(RunPhase phase, Throwable cause) {
        super(phase + " statement failed: " + cause.getMessage(), cause);
        this.phase = phase;
    }

    public RunPhase phase() {
        return phase;
    }
}
