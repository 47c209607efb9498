package com.koni.energy.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * EnergyRecord value object: a validated and classified reading for one site at one instant.
 * The pair (siteId, timestamp) is its natural key; storing a record with an existing key
 * replaces the previous one.
 *
 * Net energy and the anomaly flag are derived by the classifier and cannot be set
 * independently when a record is built from a reading.
 */
@Getter
@EqualsAndHashCode
public final class EnergyRecord {

    private final String siteId;
    private final Instant timestamp;
    private final BigDecimal energyGeneratedKwh;
    private final BigDecimal energyConsumedKwh;
    private final BigDecimal netEnergyKwh;
    private final boolean anomaly;

    private EnergyRecord(String siteId, Instant timestamp, BigDecimal energyGeneratedKwh,
                         BigDecimal energyConsumedKwh, BigDecimal netEnergyKwh, boolean anomaly) {
        this.siteId = siteId;
        this.timestamp = timestamp;
        this.energyGeneratedKwh = energyGeneratedKwh;
        this.energyConsumedKwh = energyConsumedKwh;
        this.netEnergyKwh = netEnergyKwh;
        this.anomaly = anomaly;
    }

    /**
     * Builds a record from a validated reading and its classification.
     *
     * @param reading the validated reading
     * @param classification the classifier's verdict for that reading
     * @return the classified record
     */
    public static EnergyRecord classified(ValidatedReading reading, Classification classification) {
        return new EnergyRecord(
                reading.getSiteId(),
                reading.getTimestamp(),
                reading.getEnergyGeneratedKwh(),
                reading.getEnergyConsumedKwh(),
                classification.getNetEnergyKwh(),
                classification.isAnomaly()
        );
    }

    /**
     * Rebuilds a record that was previously classified and stored.
     * Only persistence adapters should call this.
     */
    public static EnergyRecord restore(String siteId, Instant timestamp, BigDecimal energyGeneratedKwh,
                                       BigDecimal energyConsumedKwh, BigDecimal netEnergyKwh, boolean anomaly) {
        return new EnergyRecord(siteId, timestamp, energyGeneratedKwh, energyConsumedKwh, netEnergyKwh, anomaly);
    }

    @Override
    public String toString() {
        return "EnergyRecord{" +
                "siteId='" + siteId + '\'' +
                ", timestamp=" + timestamp +
                ", energyGeneratedKwh=" + energyGeneratedKwh +
                ", energyConsumedKwh=" + energyConsumedKwh +
                ", netEnergyKwh=" + netEnergyKwh +
                ", anomaly=" + anomaly +
                '}';
    }
}
