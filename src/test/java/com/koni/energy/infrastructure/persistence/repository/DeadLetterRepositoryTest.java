package com.koni.energy.infrastructure.persistence.repository;

import com.koni.energy.domain.model.DeadLetterEnvelope;
import com.koni.energy.domain.repository.DeadLetterRepository;
import com.koni.energy.tags.IntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@IntegrationTest
@DataJpaTest
@Import(JpaDeadLetterRepositoryAdapter.class)
@ActiveProfiles("test")
class DeadLetterRepositoryTest {

    @Autowired
    private DeadLetterRepository repository;

    @Test
    void shouldStoreAndListOldestFirst() {
        DeadLetterEnvelope newer = envelope("batch-0002.json", Instant.parse("2024-01-02T00:00:00Z"));
        DeadLetterEnvelope older = envelope("batch-0001.json", Instant.parse("2024-01-01T00:00:00Z"));

        repository.save(newer);
        repository.save(older);

        assertThat(repository.findAll())
                .extracting(DeadLetterEnvelope::getOriginalBatchLocator)
                .containsExactly("batch-0001.json", "batch-0002.json");
    }

    @Test
    void shouldKeepLocatorVerbatim() {
        String locator = "file:///data/batches/2024 01 01/ünïcode-batch.json?v=1";
        DeadLetterEnvelope envelope = envelope(locator, Instant.parse("2024-01-01T00:00:00Z"));

        repository.save(envelope);

        DeadLetterEnvelope stored = repository.findById(envelope.getId()).orElseThrow();
        assertThat(stored.getOriginalBatchLocator()).isEqualTo(locator);
        assertThat(stored.getAttemptCount()).isEqualTo(4);
        assertThat(stored.getLastError()).isEqualTo("BatchFetchException: batch not found");
    }

    @Test
    void shouldStoreEnvelopeWithoutLocator() {
        DeadLetterEnvelope envelope = envelope(null, Instant.parse("2024-01-01T00:00:00Z"));

        repository.save(envelope);

        assertThat(repository.findById(envelope.getId()).orElseThrow().getOriginalBatchLocator()).isNull();
    }

    @Test
    void shouldKeepVeryLongLocatorUntruncated() {
        String locator = "raw/" + "a".repeat(5000) + ".json";
        DeadLetterEnvelope envelope = envelope(locator, Instant.parse("2024-01-01T00:00:00Z"));

        repository.save(envelope);

        assertThat(repository.findById(envelope.getId()).orElseThrow().getOriginalBatchLocator()).isEqualTo(locator);
    }

    @Test
    void shouldDeleteEnvelope() {
        DeadLetterEnvelope envelope = envelope("batch-0003.json", Instant.parse("2024-01-01T00:00:00Z"));
        repository.save(envelope);

        repository.delete(envelope.getId());

        assertThat(repository.findById(envelope.getId())).isEmpty();
    }

    @Test
    void shouldTruncateVeryLongErrors() {
        DeadLetterEnvelope envelope = new DeadLetterEnvelope(UUID.randomUUID(), "batch-0004.json", 1, 4,
                "x".repeat(5000), Instant.parse("2024-01-01T00:00:00Z"));

        repository.save(envelope);

        assertThat(repository.findById(envelope.getId()).orElseThrow().getLastError()).hasSize(4096);
    }

    private static DeadLetterEnvelope envelope(String locator, Instant failedAt) {
        return new DeadLetterEnvelope(UUID.randomUUID(), locator, 1, 4,
                "BatchFetchException: batch not found", failedAt);
    }
}
