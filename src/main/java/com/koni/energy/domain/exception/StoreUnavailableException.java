package com.koni.energy.domain.exception;

/**
 * Exception thrown when the record store is unavailable or fails to execute a read.
 * The query API answers with 503 so clients can retry later.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
