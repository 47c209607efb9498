package com.koni.energy.infrastructure.persistence.repository;

import com.koni.energy.domain.model.DeadLetterEnvelope;
import com.koni.energy.domain.repository.DeadLetterRepository;
import com.koni.energy.infrastructure.persistence.entity.DeadLetterEnvelopeEntity;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JPA adapter for DeadLetterRepository.
 * Maps between the DeadLetterEnvelope domain model and DeadLetterEnvelopeEntity.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaDeadLetterRepositoryAdapter implements DeadLetterRepository {

    private final DeadLetterEnvelopeJpaRepository jpaRepository;

    /**
     * Persists a dead-letter envelope.
     *
     * @param envelope the envelope to save
     * @throws IllegalArgumentException if envelope is null
     */
    @Override
    @Observed(name = "repository.save", contextualName = "dead-letter-save")
    public void save(DeadLetterEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("DeadLetterEnvelope cannot be null");
        }

        log.debug("Saving dead letter with id: {}", envelope.getId());
        jpaRepository.save(toEntity(envelope));
        log.info("Dead letter saved successfully: id={}, batchLocator={}",
                envelope.getId(), envelope.getOriginalBatchLocator());
    }

    @Override
    @Observed(name = "repository.findAll", contextualName = "dead-letter-find-all")
    public List<DeadLetterEnvelope> findAll() {
        log.debug("Retrieving all dead letters");
        List<DeadLetterEnvelope> envelopes = jpaRepository.findAllByOrderByFailedAtAsc().stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
        log.info("Retrieved {} dead letters", envelopes.size());
        return envelopes;
    }

    @Override
    public Optional<DeadLetterEnvelope> findById(UUID id) {
        if (id == null) {
            throw new IllegalArgumentException("Id cannot be null");
        }
        return jpaRepository.findById(id).map(this::toDomain);
    }

    /**
     * Deletes a dead-letter envelope after it was replayed.
     *
     * @param id the envelope id
     * @throws IllegalArgumentException if id is null
     */
    @Override
    @Observed(name = "repository.delete", contextualName = "dead-letter-delete")
    public void delete(UUID id) {
        if (id == null) {
            throw new IllegalArgumentException("Id cannot be null");
        }

        log.debug("Deleting dead letter with id: {}", id);
        jpaRepository.deleteById(id);
        log.info("Dead letter deleted successfully: id={}", id);
    }

    private DeadLetterEnvelopeEntity toEntity(DeadLetterEnvelope envelope) {
        return new DeadLetterEnvelopeEntity(
                envelope.getId(),
                envelope.getOriginalBatchLocator(),
                envelope.getOriginalDeliveryAttempt(),
                envelope.getAttemptCount(),
                truncate(envelope.getLastError()),
                envelope.getFailedAt()
        );
    }

    private DeadLetterEnvelope toDomain(DeadLetterEnvelopeEntity entity) {
        return new DeadLetterEnvelope(
                entity.getId(),
                entity.getOriginalBatchLocator(),
                entity.getOriginalDeliveryAttempt(),
                entity.getAttemptCount(),
                entity.getLastError(),
                entity.getFailedAt()
        );
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= 4096) {
            return error;
        }
        return error.substring(0, 4096);
    }
}
