package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.engine.model.CampaignRunRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Publishes campaign run requests. Records are keyed by sending account id so that all
 * runs of one account land on one partition and are consumed one after another.
 */
@Service
@Slf4j
public class CampaignRunRequestPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;

    public CampaignRunRequestPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                       ObjectMapper objectMapper,
                                       @Value("${outreach.kafka.topics.campaign-runs:campaign-runs}") String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
    }

    public void publish(Long sendingAccountId, CampaignRunRequest request) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize run request for campaign " + request.getCampaignId(), e);
        }

        kafkaTemplate.send(topic, String.valueOf(sendingAccountId), payload)
            .whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish run request for campaign {} to topic {}",
                        request.getCampaignId(), topic, ex);
                } else {
                    log.info("Published run request for campaign {} (retryFailed={}) to topic {}",
                        request.getCampaignId(), request.isRetryFailed(), topic);
                }
            });
    }
}
