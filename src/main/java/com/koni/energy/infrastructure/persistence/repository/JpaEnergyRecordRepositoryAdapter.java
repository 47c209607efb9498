package com.koni.energy.infrastructure.persistence.repository;

import com.koni.energy.domain.exception.StoreUnavailableException;
import com.koni.energy.domain.model.EnergyRecord;
import com.koni.energy.domain.model.EnergySummary;
import com.koni.energy.domain.model.WriteOutcome;
import com.koni.energy.domain.repository.EnergyRecordRepository;
import com.koni.energy.infrastructure.config.EnergyPipelineProperties;
import com.koni.energy.infrastructure.persistence.entity.EnergyRecordEntity;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JPA adapter for EnergyRecordRepository that adapts the domain interface
 * to the JPA infrastructure layer.
 *
 * Every record is written in its own transaction, bounded by the configured write timeout,
 * so one failing record never rolls back its neighbours. Writes go through
 * {@code save}, which merges onto an existing row with the same (site_id, reading_timestamp).
 */
@Slf4j
@Component
public class JpaEnergyRecordRepositoryAdapter implements EnergyRecordRepository {

    private final EnergyRecordJpaRepository jpaRepository;
    private final TransactionTemplate writeTransaction;

    public JpaEnergyRecordRepositoryAdapter(EnergyRecordJpaRepository jpaRepository,
                                            PlatformTransactionManager transactionManager,
                                            EnergyPipelineProperties properties) {
        this.jpaRepository = jpaRepository;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setTimeout(toTimeoutSeconds(properties.getPipeline().getWriteTimeout().toMillis()));
        this.writeTransaction.setPropagationBehavior(TransactionTemplate.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Inserts or overwrites one record. Storage failures are reported in the outcome.
     *
     * @param record the record to store
     * @return the outcome of the write
     * @throws IllegalArgumentException if record is null
     */
    @Override
    public WriteOutcome upsert(EnergyRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("EnergyRecord cannot be null");
        }

        try {
            writeTransaction.executeWithoutResult(status -> jpaRepository.save(toEntity(record)));
            log.debug("Energy record upserted: siteId={}, timestamp={}", record.getSiteId(), record.getTimestamp());
            return WriteOutcome.succeeded(record);
        } catch (DataAccessException | TransactionException e) {
            log.error("Energy record write failed: siteId={}, timestamp={}, error={}",
                    record.getSiteId(), record.getTimestamp(), e.getMessage());
            return WriteOutcome.failed(record, e.getMessage());
        }
    }

    @Override
    @Observed(name = "repository.upsertAll", contextualName = "energy-record-upsert-all")
    public List<WriteOutcome> upsertAll(List<EnergyRecord> records) {
        List<WriteOutcome> outcomes = new ArrayList<>(records.size());
        for (EnergyRecord record : records) {
            outcomes.add(upsert(record));
        }
        return outcomes;
    }

    @Override
    @Observed(name = "repository.findBySite", contextualName = "energy-record-find-by-site")
    public List<EnergyRecord> findBySite(String siteId, Instant start, Instant end) {
        try {
            List<EnergyRecordEntity> entities;
            if (start != null && end != null) {
                entities = jpaRepository
                        .findBySiteIdAndReadingTimeGreaterThanEqualAndReadingTimeLessThanOrderByReadingTimeAsc(siteId, start, end);
            } else if (start != null) {
                entities = jpaRepository.findBySiteIdAndReadingTimeGreaterThanEqualOrderByReadingTimeAsc(siteId, start);
            } else if (end != null) {
                entities = jpaRepository.findBySiteIdAndReadingTimeLessThanOrderByReadingTimeAsc(siteId, end);
            } else {
                entities = jpaRepository.findBySiteIdOrderByReadingTimeAsc(siteId);
            }
            return entities.stream().map(this::toDomain).collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Energy records could not be read for site " + siteId, e);
        }
    }

    @Override
    @Observed(name = "repository.findAnomaliesBySite", contextualName = "energy-record-find-anomalies")
    public List<EnergyRecord> findAnomaliesBySite(String siteId) {
        try {
            return jpaRepository.findBySiteIdAndAnomalyTrueOrderByReadingTimeAsc(siteId).stream()
                    .map(this::toDomain)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Anomalies could not be read for site " + siteId, e);
        }
    }

    @Override
    @Observed(name = "repository.summarize", contextualName = "energy-record-summarize")
    public EnergySummary summarize() {
        try {
            long totalRecords = jpaRepository.count();
            long anomalyCount = jpaRepository.countByAnomalyTrue();
            List<String> siteIds = jpaRepository.findDistinctSiteIds();

            Map<String, Long> distribution = new LinkedHashMap<>();
            for (Object[] row : jpaRepository.countAnomaliesBySite()) {
                distribution.put((String) row[0], ((Number) row[1]).longValue());
            }
            return new EnergySummary(totalRecords, anomalyCount, siteIds, distribution);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Energy summary could not be computed", e);
        }
    }

    private EnergyRecordEntity toEntity(EnergyRecord record) {
        return new EnergyRecordEntity(
                record.getSiteId(),
                record.getTimestamp(),
                record.getEnergyGeneratedKwh(),
                record.getEnergyConsumedKwh(),
                record.getNetEnergyKwh(),
                record.isAnomaly(),
                Instant.now()
        );
    }

    private EnergyRecord toDomain(EnergyRecordEntity entity) {
        return EnergyRecord.restore(
                entity.getSiteId(),
                entity.getReadingTime(),
                entity.getEnergyGeneratedKwh(),
                entity.getEnergyConsumedKwh(),
                entity.getNetEnergyKwh(),
                entity.isAnomaly()
        );
    }

    private static int toTimeoutSeconds(long millis) {
        return (int) Math.max(1, (millis + 999) / 1000);
    }
}
