package com.koni.energy.infrastructure.persistence.repository;

import com.koni.energy.infrastructure.persistence.entity.EnergyRecordEntity;
import com.koni.energy.infrastructure.persistence.entity.EnergyRecordId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * JPA repository for EnergyRecordEntity persistence operations.
 *
 * Spring Data JPA implements this interface at runtime. Range lookups are half-open:
 * the lower bound is inclusive and the upper bound exclusive.
 */
@Repository
public interface EnergyRecordJpaRepository extends JpaRepository<EnergyRecordEntity, EnergyRecordId> {

    List<EnergyRecordEntity> findBySiteIdOrderByReadingTimeAsc(String siteId);

    List<EnergyRecordEntity> findBySiteIdAndReadingTimeGreaterThanEqualOrderByReadingTimeAsc(
            String siteId, Instant start);

    List<EnergyRecordEntity> findBySiteIdAndReadingTimeLessThanOrderByReadingTimeAsc(
            String siteId, Instant end);

    List<EnergyRecordEntity> findBySiteIdAndReadingTimeGreaterThanEqualAndReadingTimeLessThanOrderByReadingTimeAsc(
            String siteId, Instant start, Instant end);

    List<EnergyRecordEntity> findBySiteIdAndAnomalyTrueOrderByReadingTimeAsc(String siteId);

    long countByAnomalyTrue();

    @Query("select distinct e.siteId from EnergyRecordEntity e order by e.siteId")
    List<String> findDistinctSiteIds();

    /**
     * @return rows of (siteId, anomaly count) for every site with at least one anomaly
     */
    @Query("select e.siteId, count(e) from EnergyRecordEntity e where e.anomaly = true group by e.siteId")
    List<Object[]> countAnomaliesBySite();
}
