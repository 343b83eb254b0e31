package com.enterprise.bulkload.load.domain.exception;

/**
 * One row's statement failed. Tolerated when the transaction policy allows it,
 * otherwise promoted to {@link ChunkAbortException}.
 */
public class RowExecutionException extends BulkLoadException {

    private final int rowIndex;

    public RowExecutionException(int rowIndex, Throwable cause) {
        super("Row " + rowIndex + " failed: " + cause.getMessage(), cause);
        this.rowIndex = rowIndex;
    }

    /** Zero-based position of the row in the run input. */
    public int rowIndex() {
        return rowIndex;
    }
}
