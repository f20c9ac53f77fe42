package com.asvarishch.raffle.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${topic.name}")
    private String raffleEventsTopic;

    /** One partition: consumers read entries, draw requests and winners of the raffle in order. */
    @Bean
    public NewTopic raffleEventsTopic() {
        log.info("Declaring raffle event topic '{}' (partitions=1, replicas=1)", raffleEventsTopic);
        return TopicBuilder.name(raffleEventsTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
