package com.koni.energy.infrastructure.messaging;

import com.koni.energy.application.port.AlertPublisher;
import com.koni.energy.domain.event.AlertEvent;
import com.koni.energy.domain.exception.AlertDispatchException;
import com.koni.energy.infrastructure.config.EnergyPipelineProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Kafka implementation of the AlertPublisher port, guarded by a circuit breaker.
 *
 * Alerts are keyed by site id. Each publish waits for the broker acknowledgement at most
 * {@code energy.alerts.publish-timeout}; while the circuit is open publishes fail fast.
 * Every failure surfaces as {@link AlertDispatchException}, which callers log and count.
 */
@Slf4j
@Service
public class KafkaAlertPublisher implements AlertPublisher {

    private final KafkaTemplate<String, AlertEvent> kafkaTemplate;
    private final CircuitBreaker circuitBreaker;
    private final String topic;
    private final long timeoutMillis;

    public KafkaAlertPublisher(KafkaTemplate<String, AlertEvent> alertKafkaTemplate,
                               CircuitBreaker alertCircuitBreaker,
                               EnergyPipelineProperties properties) {
        this.kafkaTemplate = alertKafkaTemplate;
        this.circuitBreaker = alertCircuitBreaker;
        this.topic = properties.getKafka().getAlertTopic();
        this.timeoutMillis = properties.getAlerts().getPublishTimeout().toMillis();
    }

    /**
     * Publishes an alert to the alert topic.
     *
     * @param event the alert to publish
     * @throws IllegalArgumentException if event is null
     * @throws AlertDispatchException if the circuit is open or the broker did not acknowledge in time
     */
    @Override
    @Observed(name = "alert.publish", contextualName = "alert-publish")
    public void publish(AlertEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }

        log.debug("Publishing AlertEvent with circuit breaker: siteId={}, timestamp={}",
                event.getSiteId(), event.getTimestamp());

        try {
            circuitBreaker.executeRunnable(() -> publishToKafka(event));
        } catch (CallNotPermittedException e) {
            throw new AlertDispatchException(
                    "Alert dispatch circuit is open, alert not published for site " + event.getSiteId(), e);
        }
    }

    private void publishToKafka(AlertEvent event) {
        try {
            CompletableFuture<SendResult<String, AlertEvent>> future =
                    kafkaTemplate.send(topic, event.getSiteId(), event);

            SendResult<String, AlertEvent> result = future.get(timeoutMillis, TimeUnit.MILLISECONDS);

            log.info("Successfully published alert to Kafka: topic={}, partition={}, offset={}, siteId={}",
                    topic,
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getSiteId());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlertDispatchException("Interrupted while publishing alert for site " + event.getSiteId(), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new AlertDispatchException("Failed to publish alert to Kafka: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new AlertDispatchException("Failed to publish alert to Kafka: " + e.getMessage(), e);
        }
    }
}
