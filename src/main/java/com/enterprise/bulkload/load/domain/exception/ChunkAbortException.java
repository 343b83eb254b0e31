package com.enterprise.bulkload.load.domain.exception;

import com.enterprise.bulkload.load.domain.ExecutionSummary;

/**
 * A transaction scope was rolled back and the run halted. Carries the summary
 * of what was durable when the run stopped; its counts do not add up to the
 * total, since the remaining rows were never attempted.
 */
public class ChunkAbortException extends BulkLoadException {

    private final int chunkIndex;
    private final ExecutionSummary partialSummary;

    public ChunkAbortException(int chunkIndex, ExecutionSummary partialSummary, Throwable cause) {
        super("Chunk " + chunkIndex + " rolled back, run aborted: " + cause.getMessage(), cause);
        this.chunkIndex = chunkIndex;
        this.partialSummary = partialSummary;
    }

    public int chunkIndex() {
        return chunkIndex;
    }

    public ExecutionSummary partialSummary() {
        return partialSummary;
    }
}
