package com.koni.energy.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.Length;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for batches that exhausted their retries.
 * Rows stay until an operator replays them. The locator column is unbounded and nullable so
 * that any intake event, including one without a locator, can be captured verbatim.
 */
@Entity
@Table(
    name = "dead_letter_envelopes",
    indexes = {
        @Index(
            name = "idx_dead_letter_envelopes_failed_at",
            columnList = "failed_at"
        )
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterEnvelopeEntity {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "original_batch_locator", length = Length.LONG32)
    private String originalBatchLocator;

    @Column(name = "original_delivery_attempt", nullable = false)
    private int originalDeliveryAttempt;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "last_error", length = 4096)
    private String lastError;

    @Column(name = "failed_at", nullable = false, updatable = false)
    private Instant failedAt;

    @PrePersist
    protected void onCreate() {
        if (failedAt == null) {
            failedAt = Instant.now();
        }
    }
}
