package com.koni.energy.domain.exception;

import lombok.Getter;

/**
 * Exception thrown when at least one record of a batch could not be persisted.
 * The whole batch is reported as failed so that the platform re-delivers it;
 * records already written are rewritten identically on the next attempt.
 */
@Getter
public class BatchWriteException extends BatchProcessingException {

    private final int failedRecords;

    public BatchWriteException(String batchLocator, int failedRecords, String firstError) {
        super(batchLocator, String.format("%d record(s) failed to persist for batch %s: %s",
                failedRecords, batchLocator, firstError));
        this.failedRecords = failedRecords;
    }
}
