package com.koni.energy.infrastructure.persistence.entity;

import com.koni.energy.domain.service.ReadingValidator;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for persisting classified energy records.
 * The primary key is the natural key (site_id, reading_timestamp), so writing the same
 * reading twice updates the existing row instead of adding a new one.
 */
@Entity
@IdClass(EnergyRecordId.class)
@Table(
    name = "energy_records",
    indexes = {
        @Index(
            name = "idx_energy_records_site_anomaly",
            columnList = "site_id, anomaly"
        )
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class EnergyRecordEntity {

    private static final int ENERGY_PRECISION =
            ReadingValidator.MAX_ENERGY_INTEGER_DIGITS + ReadingValidator.ENERGY_SCALE;

    @Id
    @Column(name = "site_id", nullable = false)
    private String siteId;

    @Id
    @Column(name = "reading_timestamp", nullable = false)
    private Instant readingTime;

    @Column(name = "energy_generated_kwh", nullable = false, precision = ENERGY_PRECISION, scale = ReadingValidator.ENERGY_SCALE)
    private BigDecimal energyGeneratedKwh;

    @Column(name = "energy_consumed_kwh", nullable = false, precision = ENERGY_PRECISION, scale = ReadingValidator.ENERGY_SCALE)
    private BigDecimal energyConsumedKwh;

    @Column(name = "net_energy_kwh", nullable = false, precision = ENERGY_PRECISION, scale = ReadingValidator.ENERGY_SCALE)
    private BigDecimal netEnergyKwh;

    @Column(name = "anomaly", nullable = false)
    private boolean anomaly;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        processedAt = Instant.now();
    }
}
