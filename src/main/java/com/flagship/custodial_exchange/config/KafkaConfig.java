package com.flagship.custodial_exchange.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics for escrow events relayed from the outbox.
 *
 * One topic per aggregate; records are keyed by aggregate id so every order or
 * lobby keeps its event order within a partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.orders:exchange.orders}")
    private String ordersTopic;

    @Value("${kafka.topic.lobbies:exchange.lobbies}")
    private String lobbiesTopic;

    @Bean
    public NewTopic ordersTopic() {
        return TopicBuilder.name(ordersTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic lobbiesTopic() {
        return TopicBuilder.name(lobbiesTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
