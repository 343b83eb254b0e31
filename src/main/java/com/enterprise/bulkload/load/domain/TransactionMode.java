package com.enterprise.bulkload.load.domain;

public enum TransactionMode {
    /** One transaction around the whole run. */
    SINGLE,
    /** One transaction per consecutive run of {@code chunkSize} rows. */
    CHUNKED,
    /** Every row autocommits. */
    NONE
}
