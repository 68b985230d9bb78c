package com.flagship.pos_core.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the sale events topic. Partitioned by sale id so events of
 * one sale stay ordered.
 */
@Configuration
public class KafkaConfig {

    @Bean
    public NewTopic saleEventsTopic(PosProperties properties) {
        return TopicBuilder.name(properties.getKafka().getTopic())
                .partitions(3)
                .replicas(1)
                .build();
    }
}
