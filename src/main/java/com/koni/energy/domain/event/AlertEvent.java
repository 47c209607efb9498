package com.koni.energy.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.energy.domain.model.Classification;
import com.koni.energy.domain.model.EnergyRecord;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * AlertEvent notification.
 * Published once per anomalous record after that record has been stored.
 * Delivery is at-least-once: a re-delivered batch may publish the same alert again.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class AlertEvent {

    private final String siteId;
    private final Instant timestamp;
    private final BigDecimal energyGeneratedKwh;
    private final BigDecimal energyConsumedKwh;
    private final BigDecimal netEnergyKwh;
    private final String reason;
    private final String batchLocator;

    @JsonCreator
    public AlertEvent(
            @JsonProperty("site_id") String siteId,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("energy_generated_kwh") BigDecimal energyGeneratedKwh,
            @JsonProperty("energy_consumed_kwh") BigDecimal energyConsumedKwh,
            @JsonProperty("net_energy_kwh") BigDecimal netEnergyKwh,
            @JsonProperty("reason") String reason,
            @JsonProperty("batch_locator") String batchLocator) {
        this.siteId = siteId;
        this.timestamp = timestamp;
        this.energyGeneratedKwh = energyGeneratedKwh;
        this.energyConsumedKwh = energyConsumedKwh;
        this.netEnergyKwh = netEnergyKwh;
        this.reason = reason;
        this.batchLocator = batchLocator;
    }

    /**
     * Builds the alert for a stored anomalous record.
     *
     * @param record the stored record
     * @param classification the classification that flagged it
     * @param batchLocator the batch the record came from
     * @return the alert event
     */
    public static AlertEvent forRecord(EnergyRecord record, Classification classification, String batchLocator) {
        return new AlertEvent(
                record.getSiteId(),
                record.getTimestamp(),
                record.getEnergyGeneratedKwh(),
                record.getEnergyConsumedKwh(),
                record.getNetEnergyKwh(),
                classification.reasonText(),
                batchLocator
        );
    }

    @JsonProperty("site_id")
    public String getSiteId() {
        return siteId;
    }

    @JsonProperty("energy_generated_kwh")
    public BigDecimal getEnergyGeneratedKwh() {
        return energyGeneratedKwh;
    }

    @JsonProperty("energy_consumed_kwh")
    public BigDecimal getEnergyConsumedKwh() {
        return energyConsumedKwh;
    }

    @JsonProperty("net_energy_kwh")
    public BigDecimal getNetEnergyKwh() {
        return netEnergyKwh;
    }

    @JsonProperty("batch_locator")
    public String getBatchLocator() {
        return batchLocator;
    }
}
