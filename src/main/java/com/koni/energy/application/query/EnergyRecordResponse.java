package com.koni.energy.application.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.energy.domain.model.EnergyRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Data Transfer Object representing one stored energy record.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class EnergyRecordResponse {

    @JsonProperty("site_id")
    private String siteId;

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("energy_generated_kwh")
    private BigDecimal energyGeneratedKwh;

    @JsonProperty("energy_consumed_kwh")
    private BigDecimal energyConsumedKwh;

    @JsonProperty("net_energy_kwh")
    private BigDecimal netEnergyKwh;

    @JsonProperty("anomaly")
    private boolean anomaly;

    public static EnergyRecordResponse from(EnergyRecord record) {
        return new EnergyRecordResponse(
                record.getSiteId(),
                record.getTimestamp(),
                record.getEnergyGeneratedKwh(),
                record.getEnergyConsumedKwh(),
                record.getNetEnergyKwh(),
                record.isAnomaly()
        );
    }
}
