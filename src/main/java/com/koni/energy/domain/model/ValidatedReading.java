package com.koni.energy.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A reading that passed validation: typed, non-blank site, UTC instant and
 * non-negative energy values. Not yet classified.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ValidatedReading {

    private final String siteId;
    private final Instant timestamp;
    private final BigDecimal energyGeneratedKwh;
    private final BigDecimal energyConsumedKwh;

    public ValidatedReading(String siteId, Instant timestamp,
                            BigDecimal energyGeneratedKwh, BigDecimal energyConsumedKwh) {
        this.siteId = siteId;
        this.timestamp = timestamp;
        this.energyGeneratedKwh = energyGeneratedKwh;
        this.energyConsumedKwh = energyConsumedKwh;
    }
}
