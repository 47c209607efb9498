package com.koni.energy.infrastructure.messaging;

import com.koni.energy.application.service.DeadLetterService;
import com.koni.energy.domain.event.BatchIntakeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.kafka.listener.ConsumerRecordRecoverer;
import org.springframework.kafka.listener.ListenerExecutionFailedException;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.kafka.support.serializer.DeserializationException;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Recoverer invoked by the error handler once a batch exhausted its retries.
 *
 * Instead of forwarding the record to a DLQ topic, the batch is captured as a
 * dead-letter envelope so operators can list and replay it. If the capture itself fails the
 * exception propagates, the error handler does not commit the offset and the intake event
 * is delivered again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeadLetterRecoverer implements ConsumerRecordRecoverer {

    private final DeadLetterService deadLetterService;
    private final BatchRetryPolicy retryPolicy;

    @Override
    public void accept(ConsumerRecord<?, ?> record, Exception exception) {
        Throwable failure = unwrap(exception);
        String batchLocator;
        int originalDeliveryAttempt;

        if (record.value() instanceof BatchIntakeEvent) {
            BatchIntakeEvent event = (BatchIntakeEvent) record.value();
            batchLocator = event.getBatchLocator();
            originalDeliveryAttempt = event.getDeliveryAttempt();
        } else {
            batchLocator = rawPayload(record, exception);
            originalDeliveryAttempt = 1;
        }

        int attempts = attemptsMade(record, failure);
        String lastError = failure.getClass().getSimpleName() + ": " + failure.getMessage();

        log.error("Batch retries exhausted, capturing dead letter: topic={}, partition={}, offset={}, batchLocator={}, attempts={}, error={}",
                record.topic(), record.partition(), record.offset(), batchLocator, attempts, lastError);

        try {
            deadLetterService.capture(batchLocator, originalDeliveryAttempt, attempts, lastError);
        } catch (RuntimeException e) {
            log.error("CRITICAL: Failed to capture dead letter, intake event will be re-delivered: batchLocator={}",
                    batchLocator, e);
            throw e;
        }
    }

    /**
     * Processing attempts as counted by the container's delivery attempt header. Records
     * handed over without the header fall back to the retry budget.
     */
    private int attemptsMade(ConsumerRecord<?, ?> record, Throwable failure) {
        Header header = record.headers().lastHeader(KafkaHeaders.DELIVERY_ATTEMPT);
        if (header != null && header.value() != null && header.value().length == Integer.BYTES) {
            return ByteBuffer.wrap(header.value()).getInt();
        }
        return retryPolicy.attemptsFor(failure);
    }

    /**
     * Strips the listener wrappers the container adds around the handler's exception.
     */
    static Throwable unwrap(Throwable exception) {
        Throwable current = exception;
        while (current instanceof ListenerExecutionFailedException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String rawPayload(ConsumerRecord<?, ?> record, Exception exception) {
        for (Throwable t = exception; t != null; t = t.getCause()) {
            if (t instanceof DeserializationException) {
                byte[] data = ((DeserializationException) t).getData();
                if (data != null) {
                    return new String(data, StandardCharsets.UTF_8);
                }
            }
        }
        return String.valueOf(record.value());
    }
}
