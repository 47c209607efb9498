package com.koni.energy.domain.repository;

import com.koni.energy.domain.model.EnergyRecord;
import com.koni.energy.domain.model.EnergySummary;
import com.koni.energy.domain.model.WriteOutcome;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for EnergyRecord persistence operations.
 * Records are keyed by (siteId, timestamp); writing an existing key replaces the stored record,
 * which is what makes re-processing a batch safe.
 *
 * Following Hexagonal Architecture principles, this interface is implemented
 * by infrastructure adapters (e.g., JPA repositories).
 */
public interface EnergyRecordRepository {

    /**
     * Inserts or overwrites a single record.
     * Storage failures are reported in the outcome instead of being thrown.
     *
     * @param record the record to store
     * @return the outcome of the write
     */
    WriteOutcome upsert(EnergyRecord record);

    /**
     * Stores each record independently.
     *
     * @param records the records to store
     * @return one outcome per record, in input order
     */
    List<WriteOutcome> upsertAll(List<EnergyRecord> records);

    /**
     * Finds the records of a site, ordered by timestamp ascending.
     *
     * @param siteId the site identifier
     * @param start inclusive lower bound, or null for unbounded
     * @param end exclusive upper bound, or null for unbounded
     * @return matching records, empty if none
     * @throws com.koni.energy.domain.exception.StoreUnavailableException if the store cannot be read
     */
    List<EnergyRecord> findBySite(String siteId, Instant start, Instant end);

    /**
     * Finds the anomalous records of a site, ordered by timestamp ascending.
     *
     * @throws com.koni.energy.domain.exception.StoreUnavailableException if the store cannot be read
     */
    List<EnergyRecord> findAnomaliesBySite(String siteId);

    /**
     * @return totals over all stored records
     * @throws com.koni.energy.domain.exception.StoreUnavailableException if the store cannot be read
     */
    EnergySummary summarize();
}
