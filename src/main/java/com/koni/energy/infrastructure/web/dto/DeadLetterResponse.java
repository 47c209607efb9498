package com.koni.energy.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.energy.domain.model.DeadLetterEnvelope;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * DTO describing one dead-lettered batch.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterResponse {

    @JsonProperty("id")
    private UUID id;

    @JsonProperty("original_batch_locator")
    private String originalBatchLocator;

    @JsonProperty("original_delivery_attempt")
    private int originalDeliveryAttempt;

    @JsonProperty("attempt_count")
    private int attemptCount;

    @JsonProperty("last_error")
    private String lastError;

    @JsonProperty("failed_at")
    private Instant failedAt;

    public static DeadLetterResponse from(DeadLetterEnvelope envelope) {
        return new DeadLetterResponse(
                envelope.getId(),
                envelope.getOriginalBatchLocator(),
                envelope.getOriginalDeliveryAttempt(),
                envelope.getAttemptCount(),
                envelope.getLastError(),
                envelope.getFailedAt()
        );
    }
}
