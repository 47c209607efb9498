package com.koni.energy.domain.model;

import com.koni.energy.domain.exception.ValidationException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Parsing of ISO-8601 timestamps used across intake and query.
 * Only timestamps carrying an explicit zone designator ({@code Z} or {@code ±hh:mm}) are
 * accepted; the result is always normalised to UTC and truncated to microseconds, the
 * finest precision the record store keeps.
 */
public final class Timestamps {

    private Timestamps() {
    }

    /**
     * @param value the text to parse
     * @param field field name used in the error message
     * @return the parsed instant, truncated to microseconds
     * @throws ValidationException if the value is missing or not an ISO-8601 timestamp with an offset
     */
    public static Instant parse(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        try {
            return OffsetDateTime.parse(value.trim()).toInstant().truncatedTo(ChronoUnit.MICROS);
        } catch (DateTimeParseException e) {
            throw new ValidationException(
                    field + " must be an ISO-8601 timestamp with zone offset, got '" + value + "'", e);
        }
    }
}
