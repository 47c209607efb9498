package com.koni.energy.infrastructure.messaging;

import com.koni.energy.domain.exception.MalformedBatchException;
import com.koni.energy.infrastructure.config.EnergyPipelineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

/**
 * Kafka error handling configuration for batch re-delivery and dead-letter capture.
 *
 * With the defaults (1s initial interval, multiplier 2.0, 3 retries) a failing batch is
 * processed at most four times, waiting 1s, 2s and 4s in between, before the
 * {@link DeadLetterRecoverer} captures it. Content errors skip the retries.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class KafkaErrorHandlingConfig {

    private final EnergyPipelineProperties properties;

    @Bean
    public CommonErrorHandler batchErrorHandler(DeadLetterRecoverer deadLetterRecoverer) {
        EnergyPipelineProperties.Retry retry = properties.getPipeline().getRetry();

        ExponentialBackOff backOff = new ExponentialBackOff(retry.getInitialInterval().toMillis(), retry.getMultiplier());
        backOff.setMaxAttempts(retry.getMaxRetries());

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(deadLetterRecoverer, backOff);
        errorHandler.addNotRetryableExceptions(MalformedBatchException.class);

        errorHandler.setRetryListeners((consumerRecord, exception, deliveryAttempt) ->
                log.warn("Batch delivery failed, retrying: attempt={}, topic={}, key={}, value={}, error={}",
                        deliveryAttempt,
                        consumerRecord.topic(),
                        consumerRecord.key(),
                        consumerRecord.value(),
                        DeadLetterRecoverer.unwrap(exception).getMessage()));

        return errorHandler;
    }
}
