package com.koni.energy.domain.exception;

import lombok.Getter;

/**
 * Base exception for failures that settle a whole batch as failed.
 * Carries the opaque locator of the batch so that error handlers and the
 * dead-letter capture can refer to the original batch.
 */
@Getter
public class BatchProcessingException extends RuntimeException {

    private final String batchLocator;

    public BatchProcessingException(String batchLocator, String message) {
        super(message);
        this.batchLocator = batchLocator;
    }

    public BatchProcessingException(String batchLocator, String message, Throwable cause) {
        super(message, cause);
        this.batchLocator = batchLocator;
    }
}
