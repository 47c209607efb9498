package com.koni.energy.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Tunable limits used by the anomaly classifier.
 *
 * <ul>
 *   <li>{@code netEnergyFloorKwh}: net energy strictly below this value is anomalous.</li>
 *   <li>{@code maxReadingKwh}: a generated or consumed value at or above this ceiling is anomalous.</li>
 * </ul>
 */
@Getter
@EqualsAndHashCode
@ToString
public final class AnomalyThresholds {

    public static final BigDecimal DEFAULT_NET_ENERGY_FLOOR_KWH = BigDecimal.ZERO;
    public static final BigDecimal DEFAULT_MAX_READING_KWH = new BigDecimal("10000");

    private final BigDecimal netEnergyFloorKwh;
    private final BigDecimal maxReadingKwh;

    public AnomalyThresholds(BigDecimal netEnergyFloorKwh, BigDecimal maxReadingKwh) {
        Objects.requireNonNull(netEnergyFloorKwh, "netEnergyFloorKwh is required");
        Objects.requireNonNull(maxReadingKwh, "maxReadingKwh is required");
        if (maxReadingKwh.signum() <= 0) {
            throw new IllegalArgumentException("maxReadingKwh must be positive, got " + maxReadingKwh);
        }
        this.netEnergyFloorKwh = netEnergyFloorKwh;
        this.maxReadingKwh = maxReadingKwh;
    }

    public static AnomalyThresholds defaults() {
        return new AnomalyThresholds(DEFAULT_NET_ENERGY_FLOOR_KWH, DEFAULT_MAX_READING_KWH);
    }
}
