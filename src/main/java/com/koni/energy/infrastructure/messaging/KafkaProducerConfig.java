package com.koni.energy.infrastructure.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.energy.domain.event.AlertEvent;
import com.koni.energy.domain.event.BatchIntakeEvent;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer configuration for intake notifications and anomaly alerts.
 *
 * Configuration features:
 * - JSON serialization through Spring Boot's ObjectMapper, without type headers
 * - Idempotence enabled, acks=all for durability
 * - Template observations for trace propagation
 */
@Configuration
public class KafkaProducerConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${spring.kafka.producer.acks:all}")
    private String acks;

    @Value("${spring.kafka.producer.retries:3}")
    private Integer retries;

    @Bean
    public ProducerFactory<String, BatchIntakeEvent> batchIntakeProducerFactory(ObjectMapper objectMapper) {
        return new DefaultKafkaProducerFactory<>(producerProps(), new StringSerializer(), jsonSerializer(objectMapper));
    }

    @Bean
    public ProducerFactory<String, AlertEvent> alertProducerFactory(ObjectMapper objectMapper) {
        return new DefaultKafkaProducerFactory<>(producerProps(), new StringSerializer(), jsonSerializer(objectMapper));
    }

    /**
     * Creates a KafkaTemplate for publishing BatchIntakeEvent notifications.
     */
    @Bean
    public KafkaTemplate<String, BatchIntakeEvent> batchIntakeKafkaTemplate(
            ProducerFactory<String, BatchIntakeEvent> batchIntakeProducerFactory) {
        KafkaTemplate<String, BatchIntakeEvent> template = new KafkaTemplate<>(batchIntakeProducerFactory);
        template.setObservationEnabled(true);
        return template;
    }

    /**
     * Creates a KafkaTemplate for publishing AlertEvent notifications.
     */
    @Bean
    public KafkaTemplate<String, AlertEvent> alertKafkaTemplate(
            ProducerFactory<String, AlertEvent> alertProducerFactory) {
        KafkaTemplate<String, AlertEvent> template = new KafkaTemplate<>(alertProducerFactory);
        template.setObservationEnabled(true);
        return template;
    }

    private Map<String, Object> producerProps() {
        Map<String, Object> configProps = new HashMap<>();

        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);

        // Reliability settings
        configProps.put(ProducerConfig.ACKS_CONFIG, acks);
        configProps.put(ProducerConfig.RETRIES_CONFIG, retries);
        configProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);

        return configProps;
    }

    private static <T> JsonSerializer<T> jsonSerializer(ObjectMapper objectMapper) {
        JsonSerializer<T> serializer = new JsonSerializer<>(objectMapper);
        serializer.setAddTypeInfo(false);
        return serializer;
    }
}
