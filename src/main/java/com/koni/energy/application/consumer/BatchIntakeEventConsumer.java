package com.koni.energy.application.consumer;

import com.koni.energy.application.command.BatchResult;
import com.koni.energy.application.command.ProcessBatchCommand;
import com.koni.energy.application.command.ProcessBatchCommandHandler;
import com.koni.energy.domain.event.BatchIntakeEvent;
import com.koni.energy.domain.exception.MalformedBatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

/**
 * BatchIntakeEventConsumer processes BatchIntakeEvent notifications from Kafka.
 *
 * Each event is handled by an independent handler invocation. The offset is committed
 * only after the batch settled; any failure is rethrown so the container's error handler
 * re-delivers the event or, once the retry budget is spent, dead-letters it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchIntakeEventConsumer {

    private final ProcessBatchCommandHandler commandHandler;

    /**
     * Consumes BatchIntakeEvent notifications from the intake topic.
     *
     * @param event the intake event
     * @param acknowledgment the Kafka acknowledgment for manual offset commit
     */
    @KafkaListener(
            topics = "${energy.kafka.intake-topic}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "batchIntakeListenerContainerFactory"
    )
    public void consume(BatchIntakeEvent event, Acknowledgment acknowledgment) {
        log.debug("Received BatchIntakeEvent: {}", event);

        try {
            if (event.getBatchLocator() == null || event.getBatchLocator().isBlank()) {
                throw new MalformedBatchException(event.getBatchLocator(), "intake event carries no batch locator");
            }

            BatchResult result = commandHandler.handle(
                    new ProcessBatchCommand(event.getBatchLocator(), event.getDeliveryAttempt()));

            log.debug("Batch settled, committing offset: batchLocator={}, persisted={}",
                    result.getBatchLocator(), result.getPersisted());
            acknowledgment.acknowledge();

        } catch (Exception e) {
            log.error("Error processing BatchIntakeEvent: {}", event, e);
            // Don't acknowledge - let the error handler retry
            throw e;
        }
    }
}
