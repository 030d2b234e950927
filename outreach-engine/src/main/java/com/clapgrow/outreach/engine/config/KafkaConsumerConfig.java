package com.clapgrow.outreach.engine.config;

import com.clapgrow.outreach.common.kafka.KafkaConsumerConfigHelper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;

import java.util.Map;

@Configuration
public class KafkaConsumerConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${kafka.consumer.group-id:outreach-engine-runs}")
    private String baseGroupId;

    @Value("${kafka.consumer.environment-prefix:}")
    private String environmentPrefix;

    /** Number of campaign runs (on distinct sending accounts) processed at once. */
    @Value("${kafka.consumer.concurrency:3}")
    private int concurrency;

    @Value("${kafka.consumer.max-poll-interval-ms:" + KafkaConsumerConfigHelper.DEFAULT_MAX_POLL_INTERVAL_MS + "}")
    private int maxPollIntervalMs;

    @Bean
    public ConsumerFactory<String, String> consumerFactory() {
        String groupId = KafkaConsumerConfigHelper.buildGroupId(baseGroupId, environmentPrefix);
        Map<String, Object> configProps = KafkaConsumerConfigHelper.createRunConsumerProperties(
            bootstrapServers, groupId, maxPollIntervalMs);
        return new DefaultKafkaConsumerFactory<>(configProps);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
            new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory());
        factory.setConcurrency(concurrency);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        return factory;
    }
}
