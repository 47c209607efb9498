package com.koni.energy.application.service;

import com.koni.energy.application.port.BatchIntakePublisher;
import com.koni.energy.domain.event.BatchIntakeEvent;
import com.koni.energy.domain.exception.ValidationException;
import com.koni.energy.domain.model.DeadLetterEnvelope;
import com.koni.energy.domain.repository.DeadLetterRepository;
import com.koni.energy.infrastructure.observability.EnergyPipelineMetrics;
import com.koni.energy.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@UnitTest
@ExtendWith(MockitoExtension.class)
class DeadLetterServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private DeadLetterRepository deadLetterRepository;

    @Mock
    private BatchIntakePublisher batchIntakePublisher;

    @Mock
    private EnergyPipelineMetrics metrics;

    private DeadLetterService service;

    @BeforeEach
    void setUp() {
        service = new DeadLetterService(deadLetterRepository, batchIntakePublisher, metrics,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldCaptureEnvelopeWithLocatorVerbatim() {
        String locator = "s3://bucket/2024-01-01/batch ä 0001.json";

        DeadLetterEnvelope envelope = service.capture(locator, 1, 4, "BatchFetchException: batch not found");

        ArgumentCaptor<DeadLetterEnvelope> captor = ArgumentCaptor.forClass(DeadLetterEnvelope.class);
        verify(deadLetterRepository).save(captor.capture());
        assertThat(captor.getValue()).isEqualTo(envelope);
        assertThat(envelope.getId()).isNotNull();
        assertThat(envelope.getOriginalBatchLocator()).isEqualTo(locator);
        assertThat(envelope.getOriginalDeliveryAttempt()).isEqualTo(1);
        assertThat(envelope.getAttemptCount()).isEqualTo(4);
        assertThat(envelope.getLastError()).isEqualTo("BatchFetchException: batch not found");
        assertThat(envelope.getFailedAt()).isEqualTo(NOW);
        verify(metrics).recordDeadLetterCaptured();
    }

    @Test
    void shouldReplayEnvelopeAsFreshIntakeEvent() {
        DeadLetterEnvelope envelope = envelope("batch-0007.json");
        when(deadLetterRepository.findById(envelope.getId())).thenReturn(Optional.of(envelope));

        Optional<DeadLetterEnvelope> replayed = service.replay(envelope.getId());

        assertThat(replayed).contains(envelope);
        verify(batchIntakePublisher).publish(BatchIntakeEvent.firstDelivery("batch-0007.json"));
        verify(deadLetterRepository).delete(envelope.getId());
        verify(metrics).recordDeadLetterReplayed();
    }

    @Test
    void shouldReturnEmptyWhenReplayingUnknownEnvelope() {
        UUID id = UUID.randomUUID();
        when(deadLetterRepository.findById(id)).thenReturn(Optional.empty());

        assertThat(service.replay(id)).isEmpty();
        verifyNoInteractions(batchIntakePublisher);
        verify(deadLetterRepository, never()).delete(any());
    }

    @Test
    void shouldKeepEnvelopeWhenRepublishFails() {
        DeadLetterEnvelope first = envelope("batch-0001.json");
        DeadLetterEnvelope second = envelope("batch-0002.json");
        when(deadLetterRepository.findAll()).thenReturn(List.of(first, second));
        doAnswer(invocation -> {
            BatchIntakeEvent event = invocation.getArgument(0);
            if (event.getBatchLocator().equals("batch-0001.json")) {
                throw new RuntimeException("broker unavailable");
            }
            return null;
        }).when(batchIntakePublisher).publish(any(BatchIntakeEvent.class));

        int replayed = service.replayAll();

        assertThat(replayed).isEqualTo(1);
        verify(deadLetterRepository, never()).delete(first.getId());
        verify(deadLetterRepository).delete(second.getId());
    }

    @Test
    void shouldCaptureEventThatCarriedNoLocator() {
        DeadLetterEnvelope envelope = service.capture(null, 1, 1, "MalformedBatchException: batch_locator is required");

        assertThat(envelope.getOriginalBatchLocator()).isNull();
        verify(deadLetterRepository).save(envelope);
    }

    @Test
    void shouldRefuseToReplayEnvelopeWithoutLocator() {
        DeadLetterEnvelope envelope = envelope(null);
        when(deadLetterRepository.findById(envelope.getId())).thenReturn(Optional.of(envelope));

        assertThatThrownBy(() -> service.replay(envelope.getId()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("has no batch locator");

        verifyNoInteractions(batchIntakePublisher);
        verify(deadLetterRepository, never()).delete(any());
    }

    @Test
    void shouldSkipEnvelopeWithoutLocatorDuringReplayAll() {
        DeadLetterEnvelope withoutLocator = envelope(null);
        DeadLetterEnvelope replayable = envelope("batch-0003.json");
        when(deadLetterRepository.findAll()).thenReturn(List.of(withoutLocator, replayable));

        int replayed = service.replayAll();

        assertThat(replayed).isEqualTo(1);
        verify(batchIntakePublisher).publish(BatchIntakeEvent.firstDelivery("batch-0003.json"));
        verify(deadLetterRepository, never()).delete(withoutLocator.getId());
        verify(deadLetterRepository).delete(replayable.getId());
    }

    @Test
    void shouldReplayNothingWhenNoEnvelopes() {
        when(deadLetterRepository.findAll()).thenReturn(List.of());

        assertThat(service.replayAll()).isZero();
        verifyNoInteractions(batchIntakePublisher);
    }

    private DeadLetterEnvelope envelope(String locator) {
        return new DeadLetterEnvelope(UUID.randomUUID(), locator, 1, 4, "boom", NOW);
    }
}
