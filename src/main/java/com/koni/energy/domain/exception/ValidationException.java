package com.koni.energy.domain.exception;

/**
 * Exception thrown when validation of incoming data fails.
 * Raised for malformed batch entries (caught per entry by the validator)
 * and for malformed query parameters on the read path.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
