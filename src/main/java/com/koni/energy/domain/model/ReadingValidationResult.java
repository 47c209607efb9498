package com.koni.energy.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Outcome of validating a single batch entry: either a typed candidate
 * or the reason the entry was rejected.
 */
@Getter
@ToString
public final class ReadingValidationResult {

    private final int index;
    private final ValidatedReading reading;
    private final String error;

    private ReadingValidationResult(int index, ValidatedReading reading, String error) {
        this.index = index;
        this.reading = reading;
        this.error = error;
    }

    public static ReadingValidationResult valid(int index, ValidatedReading reading) {
        return new ReadingValidationResult(index, reading, null);
    }

    public static ReadingValidationResult invalid(int index, String error) {
        return new ReadingValidationResult(index, null, error);
    }

    public boolean isValid() {
        return reading != null;
    }

    public Optional<ValidatedReading> asReading() {
        return Optional.ofNullable(reading);
    }
}
