package com.koni.energy.infrastructure.messaging;

import com.koni.energy.application.service.DeadLetterService;
import com.koni.energy.domain.event.BatchIntakeEvent;
import com.koni.energy.domain.exception.BatchFetchException;
import com.koni.energy.domain.exception.MalformedBatchException;
import com.koni.energy.infrastructure.config.EnergyPipelineProperties;
import com.koni.energy.tags.UnitTest;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.listener.ListenerExecutionFailedException;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.kafka.support.serializer.DeserializationException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DeadLetterRecoverer.
 */
@UnitTest
@ExtendWith(MockitoExtension.class)
class DeadLetterRecovererTest {

    private static final String TOPIC = "energy.batches.intake";

    @Mock
    private DeadLetterService deadLetterService;

    private DeadLetterRecoverer recoverer;

    @BeforeEach
    void setUp() {
        EnergyPipelineProperties properties = new EnergyPipelineProperties();
        properties.getPipeline().getRetry().setMaxRetries(3);
        recoverer = new DeadLetterRecoverer(deadLetterService, new BatchRetryPolicy(properties));
    }

    @Test
    void shouldCaptureLocatorVerbatimAfterRetriesExhausted() {
        // Given
        String locator = "s3://energy-batches/2024/01/01/batch 0001 ünïcode.json";
        BatchIntakeEvent event = new BatchIntakeEvent(locator, 2);
        ConsumerRecord<String, Object> record = new ConsumerRecord<>(TOPIC, 0, 42L, locator, event);
        Exception failure = new ListenerExecutionFailedException("Listener failed",
                new BatchFetchException(locator, "batch not found: " + locator));

        // When
        recoverer.accept(record, failure);

        // Then
        verify(deadLetterService).capture(locator, 2, 4, "BatchFetchException: batch not found: " + locator);
    }

    @Test
    void shouldCaptureMalformedBatchAfterSingleAttempt() {
        BatchIntakeEvent event = BatchIntakeEvent.firstDelivery("batch-0009.json");
        ConsumerRecord<String, Object> record = new ConsumerRecord<>(TOPIC, 1, 7L, "batch-0009.json", event);
        Exception failure = new ListenerExecutionFailedException("Listener failed",
                new MalformedBatchException("batch-0009.json", "batch payload is not a JSON array"));

        recoverer.accept(record, failure);

        verify(deadLetterService).capture(eq("batch-0009.json"), eq(1), eq(1),
                eq("MalformedBatchException: batch payload is not a JSON array"));
    }

    @Test
    void shouldCaptureRawPayloadWhenEventCannotBeDeserialized() {
        byte[] payload = "{not json".getBytes(StandardCharsets.UTF_8);
        ConsumerRecord<String, Object> record = new ConsumerRecord<>(TOPIC, 0, 3L, null, null);
        Exception failure = new ListenerExecutionFailedException("Listener failed",
                new DeserializationException("failed to deserialize", payload, false, null));

        recoverer.accept(record, failure);

        verify(deadLetterService).capture(eq("{not json"), eq(1), eq(1), anyString());
    }

    @Test
    void shouldTakeAttemptCountFromDeliveryAttemptHeader() {
        BatchIntakeEvent event = BatchIntakeEvent.firstDelivery("batch-0011.json");
        ConsumerRecord<String, Object> record = new ConsumerRecord<>(TOPIC, 0, 12L, "batch-0011.json", event);
        record.headers().add(KafkaHeaders.DELIVERY_ATTEMPT, ByteBuffer.allocate(Integer.BYTES).putInt(2).array());

        recoverer.accept(record, new ListenerExecutionFailedException("Listener failed",
                new ClassCastException("unexpected payload")));

        verify(deadLetterService).capture(eq("batch-0011.json"), eq(1), eq(2), eq("ClassCastException: unexpected payload"));
    }

    @Test
    void shouldCaptureEventWithoutLocator() {
        ConsumerRecord<String, Object> record = new ConsumerRecord<>(TOPIC, 0, 13L, null, new BatchIntakeEvent(null, 1));
        record.headers().add(KafkaHeaders.DELIVERY_ATTEMPT, ByteBuffer.allocate(Integer.BYTES).putInt(1).array());

        recoverer.accept(record, new ListenerExecutionFailedException("Listener failed",
                new MalformedBatchException(null, "batch_locator is required")));

        verify(deadLetterService).capture(isNull(), eq(1), eq(1), eq("MalformedBatchException: batch_locator is required"));
    }

    @Test
    void shouldCaptureVeryLongLocatorVerbatim() {
        String locator = "raw/" + "b".repeat(5000) + ".json";
        ConsumerRecord<String, Object> record = new ConsumerRecord<>(TOPIC, 0, 14L, locator,
                BatchIntakeEvent.firstDelivery(locator));

        recoverer.accept(record, new BatchFetchException(locator, "batch not found"));

        verify(deadLetterService).capture(eq(locator), eq(1), eq(4), eq("BatchFetchException: batch not found"));
    }

    @Test
    void shouldPropagateWhenCaptureFails() {
        BatchIntakeEvent event = BatchIntakeEvent.firstDelivery("batch-0010.json");
        ConsumerRecord<String, Object> record = new ConsumerRecord<>(TOPIC, 0, 11L, "batch-0010.json", event);
        doThrow(new IllegalStateException("database unavailable"))
                .when(deadLetterService).capture(anyString(), anyInt(), anyInt(), anyString());

        assertThatThrownBy(() -> recoverer.accept(record, new BatchFetchException("batch-0010.json", "io error")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("database unavailable");
    }

    @Test
    void shouldUnwrapNestedListenerExceptions() {
        BatchFetchException cause = new BatchFetchException("b", "gone");
        Exception wrapped = new ListenerExecutionFailedException("outer",
                new ListenerExecutionFailedException("inner", cause));

        assertThat(DeadLetterRecoverer.unwrap(wrapped)).isSameAs(cause);
    }
}
