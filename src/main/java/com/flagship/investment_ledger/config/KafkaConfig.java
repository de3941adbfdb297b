package com.flagship.investment_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic configuration for investment lifecycle events.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.investments:investment-events}")
    private String investmentsTopic;

    /**
     * Creates the investment events topic if it doesn't exist.
     * Events are keyed by aggregate ID, so three partitions keep per-investment ordering.
     */
    @Bean
    public NewTopic investmentsTopic() {
        return TopicBuilder.name(investmentsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
