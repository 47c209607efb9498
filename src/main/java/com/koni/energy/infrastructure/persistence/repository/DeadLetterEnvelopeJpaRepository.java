package com.koni.energy.infrastructure.persistence.repository;

import com.koni.energy.infrastructure.persistence.entity.DeadLetterEnvelopeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * JPA repository for dead-lettered batches.
 */
@Repository
public interface DeadLetterEnvelopeJpaRepository extends JpaRepository<DeadLetterEnvelopeEntity, UUID> {

    /**
     * @return all envelopes ordered by failed_at ascending (oldest first)
     */
    List<DeadLetterEnvelopeEntity> findAllByOrderByFailedAtAsc();
}
