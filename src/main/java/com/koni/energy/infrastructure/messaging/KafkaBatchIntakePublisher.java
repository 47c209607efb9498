package com.koni.energy.infrastructure.messaging;

import com.koni.energy.application.port.BatchIntakePublisher;
import com.koni.energy.domain.event.BatchIntakeEvent;
import com.koni.energy.infrastructure.config.EnergyPipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Kafka implementation of the BatchIntakePublisher port.
 * Intake events are keyed by batch locator.
 */
@Slf4j
@Service
public class KafkaBatchIntakePublisher implements BatchIntakePublisher {

    private static final int TIMEOUT_SECONDS = 10;

    private final KafkaTemplate<String, BatchIntakeEvent> kafkaTemplate;
    private final String topic;

    public KafkaBatchIntakePublisher(KafkaTemplate<String, BatchIntakeEvent> batchIntakeKafkaTemplate,
                                     EnergyPipelineProperties properties) {
        this.kafkaTemplate = batchIntakeKafkaTemplate;
        this.topic = properties.getKafka().getIntakeTopic();
    }

    /**
     * Publishes an intake event and waits for the broker acknowledgement.
     *
     * @param event the event to publish
     * @throws IllegalArgumentException if event is null
     * @throws RuntimeException if Kafka publish fails
     */
    @Override
    public void publish(BatchIntakeEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }

        try {
            CompletableFuture<SendResult<String, BatchIntakeEvent>> future =
                    kafkaTemplate.send(topic, event.getBatchLocator(), event);

            SendResult<String, BatchIntakeEvent> result = future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

            log.info("Batch intake event published: topic={}, partition={}, offset={}, batchLocator={}",
                    topic,
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getBatchLocator());

        } catch (Exception e) {
            log.error("Failed to publish batch intake event: batchLocator={}", event.getBatchLocator(), e);
            throw new RuntimeException("Failed to publish batch intake event to Kafka: " + e.getMessage(), e);
        }
    }
}
