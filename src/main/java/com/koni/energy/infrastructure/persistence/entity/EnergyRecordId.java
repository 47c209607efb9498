package com.koni.energy.infrastructure.persistence.entity;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Composite primary key of {@link EnergyRecordEntity}: one record per site and instant.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class EnergyRecordId implements Serializable {

    private String siteId;
    private Instant readingTime;
}
