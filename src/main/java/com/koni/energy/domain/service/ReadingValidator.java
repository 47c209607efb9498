package com.koni.energy.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.koni.energy.domain.exception.ValidationException;
import com.koni.energy.domain.model.RawReading;
import com.koni.energy.domain.model.ReadingValidationResult;
import com.koni.energy.domain.model.Timestamps;
import com.koni.energy.domain.model.ValidatedReading;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates raw batch entries into typed readings.
 * A malformed entry only fails itself: every entry yields exactly one result and the
 * order of the input is preserved.
 */
@Slf4j
public class ReadingValidator {

    /**
     * Decimal places kept by the record store. Finer values are rounded half-up before
     * classification, so the stored record is the one that was classified.
     */
    public static final int ENERGY_SCALE = 6;

    /**
     * Integer digits the record store can hold at {@link #ENERGY_SCALE}.
     */
    public static final int MAX_ENERGY_INTEGER_DIGITS = 13;

    /**
     * Validates every entry of a batch.
     *
     * @param readings raw entries in batch order
     * @return one result per entry, in the same order
     */
    public List<ReadingValidationResult> validate(List<RawReading> readings) {
        List<ReadingValidationResult> results = new ArrayList<>(readings.size());
        for (RawReading reading : readings) {
            results.add(validate(reading));
        }
        return results;
    }

    /**
     * Validates a single entry. Only the first failing rule is reported.
     */
    public ReadingValidationResult validate(RawReading reading) {
        try {
            ValidatedReading validated = new ValidatedReading(
                    requireSiteId(reading.getSiteId()),
                    requireTimestamp(reading.getTimestamp()),
                    requireEnergy(reading.getEnergyGeneratedKwh(), RawReading.ENERGY_GENERATED_KWH),
                    requireEnergy(reading.getEnergyConsumedKwh(), RawReading.ENERGY_CONSUMED_KWH)
            );
            return ReadingValidationResult.valid(reading.getIndex(), validated);
        } catch (ValidationException e) {
            log.debug("Entry rejected: index={}, reason={}", reading.getIndex(), e.getMessage());
            return ReadingValidationResult.invalid(reading.getIndex(), e.getMessage());
        }
    }

    private String requireSiteId(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            throw new ValidationException(RawReading.SITE_ID + " is required");
        }
        if (!node.isTextual()) {
            throw new ValidationException(RawReading.SITE_ID + " must be a string");
        }
        if (node.textValue().isBlank()) {
            throw new ValidationException(RawReading.SITE_ID + " must not be blank");
        }
        return node.textValue();
    }

    private Instant requireTimestamp(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            throw new ValidationException(RawReading.TIMESTAMP + " is required");
        }
        if (!node.isTextual()) {
            throw new ValidationException(RawReading.TIMESTAMP + " must be a string");
        }
        return Timestamps.parse(node.textValue(), RawReading.TIMESTAMP);
    }

    private BigDecimal requireEnergy(JsonNode node, String field) {
        if (node.isMissingNode() || node.isNull()) {
            throw new ValidationException(field + " is required");
        }
        BigDecimal value;
        if (node.isNumber()) {
            if (!node.isBigDecimal() && !node.isIntegralNumber() && !Double.isFinite(node.doubleValue())) {
                throw new ValidationException(field + " must be a finite number");
            }
            value = node.decimalValue();
        } else if (node.isTextual()) {
            value = parseNumericText(node.textValue(), field);
        } else {
            throw new ValidationException(field + " must be a number");
        }
        if (value.signum() < 0) {
            throw new ValidationException(field + " must not be negative, got " + value.toPlainString());
        }
        if (value.scale() > ENERGY_SCALE) {
            value = value.setScale(ENERGY_SCALE, RoundingMode.HALF_UP);
        }
        if (value.signum() != 0 && value.precision() - value.scale() > MAX_ENERGY_INTEGER_DIGITS) {
            throw new ValidationException(field + " is out of the storable range, got " + value.toPlainString());
        }
        return value;
    }

    private BigDecimal parseNumericText(String text, String field) {
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(field + " must be a number, got '" + text + "'", e);
        }
    }
}
