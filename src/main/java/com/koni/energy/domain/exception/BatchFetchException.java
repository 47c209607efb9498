package com.koni.energy.domain.exception;

/**
 * Exception thrown when the contents of a batch cannot be read from the
 * hand-off storage. Retryable: the content may appear or become readable later.
 */
public class BatchFetchException extends BatchProcessingException {

    public BatchFetchException(String batchLocator, String message) {
        super(batchLocator, message);
    }

    public BatchFetchException(String batchLocator, String message, Throwable cause) {
        super(batchLocator, message, cause);
    }
}
