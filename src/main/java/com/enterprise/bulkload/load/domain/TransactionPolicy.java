package com.enterprise.bulkload.load.domain;

import com.enterprise.bulkload.load.domain.exception.LoadConfigurationException;

import java.util.Objects;

/**
 * @param chunkSize       rows per transaction, only read in {@link TransactionMode#CHUNKED}
 * @param continueOnError tolerate and count row failures instead of aborting
 */
public record TransactionPolicy(TransactionMode mode, int chunkSize, boolean continueOnError) {

    public static final int DEFAULT_CHUNK_SIZE = 500;

    public TransactionPolicy {
        Objects.requireNonNull(mode, "mode");
        if (mode == TransactionMode.CHUNKED && chunkSize <= 0) {
            throw new LoadConfigurationException("Chunk size must be positive, got " + chunkSize);
        }
    }

    public static TransactionPolicy single(boolean continueOnError) {
        return new TransactionPolicy(TransactionMode.SINGLE, DEFAULT_CHUNK_SIZE, continueOnError);
    }

    public static TransactionPolicy chunked(int chunkSize, boolean continueOnError) {
        return new TransactionPolicy(TransactionMode.CHUNKED, chunkSize, continueOnError);
    }

    public static TransactionPolicy none(boolean continueOnError) {
        return new TransactionPolicy(TransactionMode.NONE, DEFAULT_CHUNK_SIZE, continueOnError);
    }
}
