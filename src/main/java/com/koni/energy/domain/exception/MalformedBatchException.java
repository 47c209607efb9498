package com.koni.energy.domain.exception;

/**
 * Exception thrown when batch contents are not a JSON array of readings.
 * Re-delivering the same bytes cannot succeed, so this failure is not retried
 * and the batch goes straight to dead-letter capture.
 */
public class MalformedBatchException extends BatchProcessingException {

    public MalformedBatchException(String batchLocator, String message) {
        super(batchLocator, message);
    }

    public MalformedBatchException(String batchLocator, String message, Throwable cause) {
        super(batchLocator, message, cause);
    }
}
