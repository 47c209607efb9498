package com.koni.energy.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * A batch that exhausted its retry budget, captured for manual inspection and replay.
 * The original batch locator is kept verbatim so a replay refers to exactly the same batch.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class DeadLetterEnvelope {

    private final UUID id;
    private final String originalBatchLocator;
    private final int originalDeliveryAttempt;
    private final int attemptCount;
    private final String lastError;
    private final Instant failedAt;

    public DeadLetterEnvelope(UUID id, String originalBatchLocator, int originalDeliveryAttempt,
                              int attemptCount, String lastError, Instant failedAt) {
        this.id = id;
        this.originalBatchLocator = originalBatchLocator;
        this.originalDeliveryAttempt = originalDeliveryAttempt;
        this.attemptCount = attemptCount;
        this.lastError = lastError;
        this.failedAt = failedAt;
    }
}
