package com.koni.energy.integration;

import com.koni.energy.domain.model.EnergyRecord;
import com.koni.energy.domain.model.EnergySummary;
import com.koni.energy.domain.repository.EnergyRecordRepository;
import com.koni.energy.infrastructure.config.EnergyPipelineProperties;
import com.koni.energy.infrastructure.persistence.repository.EnergyRecordJpaRepository;
import com.koni.energy.infrastructure.persistence.repository.JpaEnergyRecordRepositoryAdapter;
import com.koni.energy.tags.IntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the record store against a real PostgreSQL instance.
 * Skipped when no Docker daemon is available.
 */
@IntegrationTest
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({JpaEnergyRecordRepositoryAdapter.class, EnergyPipelineProperties.class})
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
class PostgresEnergyRecordStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(
            DockerImageName.parse("postgres:16")
    )
            .withDatabaseName("energy_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private EnergyRecordRepository repository;

    @Autowired
    private EnergyRecordJpaRepository jpaRepository;

    @BeforeEach
    void cleanUp() {
        jpaRepository.deleteAll();
    }

    @Test
    void shouldOverwriteRecordWithSameKey() {
        Instant timestamp = Instant.parse("2024-01-01T00:00:00Z");
        repository.upsert(record("alpha", timestamp, "10", "15", "-5", true));
        repository.upsert(record("alpha", timestamp, "12.345678", "2", "10.345678", false));

        List<EnergyRecord> stored = repository.findBySite("alpha", null, null);
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).getEnergyGeneratedKwh()).isEqualByComparingTo("12.345678");
        assertThat(stored.get(0).isAnomaly()).isFalse();
    }

    @Test
    void shouldStoreInstantsWithoutShiftingThem() {
        Instant timestamp = Instant.parse("2024-06-30T23:30:00.123456Z");
        repository.upsert(record("beta", timestamp, "1", "2", "-1", true));

        assertThat(repository.findBySite("beta", timestamp, timestamp.plusNanos(1000)))
                .extracting(EnergyRecord::getTimestamp)
                .containsExactly(timestamp);
    }

    @Test
    void shouldSummarizeWithGroupedAnomalies() {
        Instant timestamp = Instant.parse("2024-01-01T00:00:00Z");
        repository.upsert(record("alpha", timestamp, "1", "2", "-1", true));
        repository.upsert(record("alpha", timestamp.plusSeconds(60), "1", "3", "-2", true));
        repository.upsert(record("beta", timestamp, "3", "1", "2", false));

        EnergySummary summary = repository.summarize();

        assertThat(summary.getTotalRecords()).isEqualTo(3);
        assertThat(summary.getAnomalyCount()).isEqualTo(2);
        assertThat(summary.getSiteIds()).containsExactly("alpha", "beta");
        assertThat(summary.getSiteAnomalyDistribution()).containsOnlyKeys("alpha").containsEntry("alpha", 2L);
    }

    private static EnergyRecord record(String siteId, Instant timestamp, String generated,
                                       String consumed, String net, boolean anomaly) {
        return EnergyRecord.restore(siteId, timestamp, new BigDecimal(generated),
                new BigDecimal(consumed), new BigDecimal(net), anomaly);
    }
}
