package com.koni.energy.application.service;

import com.koni.energy.application.port.BatchIntakePublisher;
import com.koni.energy.domain.event.BatchIntakeEvent;
import com.koni.energy.domain.exception.ValidationException;
import com.koni.energy.domain.model.BatchState;
import com.koni.energy.domain.model.DeadLetterEnvelope;
import com.koni.energy.domain.repository.DeadLetterRepository;
import com.koni.energy.infrastructure.observability.EnergyPipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for capturing and replaying dead-lettered batches.
 *
 * A batch lands here once the platform gave up on it. Envelopes keep the original batch
 * locator verbatim so a replay re-announces exactly the same batch. Replay republishes the
 * locator as a fresh intake event and deletes the envelope once the republish succeeded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeadLetterService {

    private final DeadLetterRepository deadLetterRepository;
    private final BatchIntakePublisher batchIntakePublisher;
    private final EnergyPipelineMetrics metrics;
    private final Clock clock;

    /**
     * Captures a batch that exhausted its retries.
     * Failures are propagated to the caller so the intake event is not committed.
     *
     * @param batchLocator the locator exactly as carried by the intake event
     * @param originalDeliveryAttempt delivery attempt carried by the intake event
     * @param attemptCount processing attempts made before giving up
     * @param lastError message of the error that ended the last attempt
     * @return the stored envelope
     */
    public DeadLetterEnvelope capture(String batchLocator, int originalDeliveryAttempt,
                                      int attemptCount, String lastError) {
        DeadLetterEnvelope envelope = new DeadLetterEnvelope(
                UUID.randomUUID(),
                batchLocator,
                originalDeliveryAttempt,
                attemptCount,
                lastError,
                Instant.now(clock)
        );
        deadLetterRepository.save(envelope);
        metrics.recordDeadLetterCaptured();

        log.error("Batch state transition: batchLocator={}, state={}, envelopeId={}, attempts={}, lastError={}",
                batchLocator, BatchState.DEAD_LETTERED, envelope.getId(), attemptCount, lastError);
        return envelope;
    }

    /**
     * @return every captured envelope, oldest first
     */
    public List<DeadLetterEnvelope> list() {
        return deadLetterRepository.findAll();
    }

    /**
     * Replays every captured envelope. Envelopes whose republish fails stay in place.
     *
     * @return the number of envelopes successfully replayed
     */
    public int replayAll() {
        List<DeadLetterEnvelope> envelopes = deadLetterRepository.findAll();

        if (envelopes.isEmpty()) {
            log.info("No dead letters to replay");
            return 0;
        }

        log.info("Found {} dead letters to replay", envelopes.size());

        int successCount = 0;
        int failureCount = 0;

        for (DeadLetterEnvelope envelope : envelopes) {
            try {
                replayEnvelope(envelope);
                successCount++;
            } catch (RuntimeException e) {
                failureCount++;
                log.error("Failed to replay dead letter: envelopeId={}, batchLocator={}. Envelope will remain captured.",
                        envelope.getId(), envelope.getOriginalBatchLocator(), e);
                // Continue with next envelope - don't fail the entire replay
            }
        }

        log.info("Dead letter replay completed: {} succeeded, {} failed", successCount, failureCount);

        return successCount;
    }

    /**
     * Replays a single envelope.
     *
     * @param id the envelope id
     * @return the replayed envelope, or empty if no envelope has that id
     * @throws ValidationException if the envelope was captured without a batch locator
     */
    public Optional<DeadLetterEnvelope> replay(UUID id) {
        Optional<DeadLetterEnvelope> envelope = deadLetterRepository.findById(id);
        envelope.ifPresent(this::replayEnvelope);
        return envelope;
    }

    private void replayEnvelope(DeadLetterEnvelope envelope) {
        if (envelope.getOriginalBatchLocator() == null) {
            throw new ValidationException("Dead letter " + envelope.getId() + " has no batch locator to replay");
        }
        batchIntakePublisher.publish(BatchIntakeEvent.firstDelivery(envelope.getOriginalBatchLocator()));
        deadLetterRepository.delete(envelope.getId());
        metrics.recordDeadLetterReplayed();

        log.info("Dead letter replayed and removed: envelopeId={}, batchLocator={}",
                envelope.getId(), envelope.getOriginalBatchLocator());
    }
}
