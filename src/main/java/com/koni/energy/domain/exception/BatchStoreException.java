package com.koni.energy.domain.exception;

/**
 * Exception thrown when new batch contents cannot be written to the hand-off storage.
 */
public class BatchStoreException extends BatchProcessingException {

    public BatchStoreException(String batchLocator, String message, Throwable cause) {
        super(batchLocator, message, cause);
    }
}
