package com.koni.energy.infrastructure.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.energy.domain.event.BatchIntakeEvent;
import com.koni.energy.infrastructure.config.EnergyPipelineProperties;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka consumer configuration for consuming BatchIntakeEvent notifications.
 *
 * Configuration features:
 * - JSON deserialization through Spring Boot's ObjectMapper
 * - Undecodable payloads are handed to the error handler instead of blocking the partition
 * - Manual acknowledgment mode for offset control
 * - Delivery attempt header, read back when a batch is dead-lettered
 * - Listener observations for trace propagation
 */
@Configuration
@EnableKafka
public class KafkaConsumerConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${spring.kafka.consumer.group-id}")
    private String groupId;

    @Value("${spring.kafka.consumer.auto-offset-reset:earliest}")
    private String autoOffsetReset;

    /**
     * Creates a ConsumerFactory for BatchIntakeEvent notifications.
     */
    @Bean
    public ConsumerFactory<String, BatchIntakeEvent> batchIntakeConsumerFactory(ObjectMapper objectMapper) {
        Map<String, Object> configProps = new HashMap<>();

        configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);

        // Offset management
        configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, autoOffsetReset);
        configProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false); // Manual commit

        JsonDeserializer<BatchIntakeEvent> jsonDeserializer =
                new JsonDeserializer<>(BatchIntakeEvent.class, objectMapper, false);
        jsonDeserializer.addTrustedPackages("*");

        return new DefaultKafkaConsumerFactory<>(
                configProps,
                new StringDeserializer(),
                new ErrorHandlingDeserializer<>(jsonDeserializer)
        );
    }

    /**
     * Creates the listener container factory used by the intake consumer.
     * Offsets are committed manually after a batch settled or was dead-lettered.
     */
    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, BatchIntakeEvent> batchIntakeListenerContainerFactory(
            ConsumerFactory<String, BatchIntakeEvent> batchIntakeConsumerFactory,
            CommonErrorHandler batchErrorHandler,
            EnergyPipelineProperties properties) {
        ConcurrentKafkaListenerContainerFactory<String, BatchIntakeEvent> factory =
                new ConcurrentKafkaListenerContainerFactory<>();

        factory.setConsumerFactory(batchIntakeConsumerFactory);
        factory.setCommonErrorHandler(batchErrorHandler);
        factory.setConcurrency(properties.getKafka().getConcurrency());
        factory.setAutoStartup(properties.getKafka().getListener().isAutoStartup());

        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);
        factory.getContainerProperties().setDeliveryAttemptHeader(true);
        factory.getContainerProperties().setObservationEnabled(true);

        return factory;
    }
}
