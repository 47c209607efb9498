package com.koni.energy.infrastructure.messaging;

import com.koni.energy.infrastructure.config.EnergyPipelineProperties;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic configuration for the pipeline.
 *
 * Intake notifications are keyed by batch locator and alerts by site id, so per-site
 * alerts keep their order within a partition. Creation can be switched off with
 * {@code energy.kafka.create-topics=false} where topics are provisioned externally.
 */
@Configuration
@ConditionalOnProperty(prefix = "energy.kafka", name = "create-topics", havingValue = "true", matchIfMissing = true)
public class KafkaTopicConfig {

    @Bean
    public NewTopic batchIntakeTopic(EnergyPipelineProperties properties) {
        return TopicBuilder.name(properties.getKafka().getIntakeTopic())
                .partitions(properties.getKafka().getPartitions())
                .replicas(properties.getKafka().getReplicationFactor())
                .build();
    }

    @Bean
    public NewTopic alertTopic(EnergyPipelineProperties properties) {
        return TopicBuilder.name(properties.getKafka().getAlertTopic())
                .partitions(properties.getKafka().getPartitions())
                .replicas(properties.getKafka().getReplicationFactor())
                .build();
    }
}
