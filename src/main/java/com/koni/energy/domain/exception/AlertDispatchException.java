package com.koni.energy.domain.exception;

/**
 * Exception thrown when an anomaly alert cannot be handed to the notification channel.
 * A lost alert degrades observability only; callers log it and carry on.
 */
public class AlertDispatchException extends RuntimeException {

    public AlertDispatchException(String message) {
        super(message);
    }

    public AlertDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
