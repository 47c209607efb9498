package com.koni.energy.domain.repository;

import com.koni.energy.domain.model.DeadLetterEnvelope;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for dead-lettered batches.
 * Envelopes stay here until an operator replays them.
 */
public interface DeadLetterRepository {

    void save(DeadLetterEnvelope envelope);

    /**
     * @return every envelope ordered by failedAt ascending (oldest first)
     */
    List<DeadLetterEnvelope> findAll();

    Optional<DeadLetterEnvelope> findById(UUID id);

    void delete(UUID id);
}
