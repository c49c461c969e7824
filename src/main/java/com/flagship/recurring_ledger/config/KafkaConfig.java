package com.flagship.recurring_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${kafka.topic.ledger-events-partitions:3}")
    private int partitions;

    /**
     * Ledger events are keyed by account id, so the partition count bounds consumer parallelism.
     */
    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
            .partitions(partitions)
            .replicas(1)
            .build();
    }
}
