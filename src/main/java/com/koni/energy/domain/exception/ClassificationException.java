package com.koni.energy.domain.exception;

/**
 * Exception thrown when the anomaly classifier receives inputs that a validated
 * reading can never carry. It signals a programming error and is fatal to the
 * affected record only.
 */
public class ClassificationException extends RuntimeException {

    public ClassificationException(String message) {
        super(message);
    }
}
