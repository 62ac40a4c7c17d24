package com.flagship.property_acquisition.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the acquisition events topic. Property id is the record key, so three
 * partitions keep per-property ordering while spreading load.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.acquisition-events:acquisition-events}")
    private String acquisitionEventsTopic;

    @Bean
    public NewTopic acquisitionEventsTopic() {
        return TopicBuilder.name(acquisitionEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
