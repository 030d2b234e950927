package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.engine.exception.CampaignPreconditionException;
import com.clapgrow.outreach.engine.model.CampaignRunRequest;
import com.clapgrow.outreach.engine.model.RunResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

/**
 * Executes run requests from Kafka. The listener thread stays busy for the whole run.
 *
 * Every record is acknowledged: a request that cannot run now (precondition error) or that
 * failed mid-run leaves the campaign in its last committed state, from which the scheduler
 * or an operator can start it again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignRunConsumer {

    private final CampaignRunService campaignRunService;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = "${outreach.kafka.topics.campaign-runs:campaign-runs}",
        containerFactory = "kafkaListenerContainerFactory")
    public void onRunRequest(
            @Payload String payload,
            @Header(name = KafkaHeaders.RECEIVED_KEY, required = false) String sendingAccountKey,
            Acknowledgment acknowledgment) {
        try {
            CampaignRunRequest request = objectMapper.readValue(payload, CampaignRunRequest.class);
            if (request.getCampaignId() == null) {
                log.error("Discarding run request without campaign id (key={}): {}", sendingAccountKey, payload);
                return;
            }
            log.info("Processing run request for campaign {} from {} (account key {})",
                request.getCampaignId(), request.getRequestedBy(), sendingAccountKey);

            RunResult result = request.isRetryFailed()
                ? campaignRunService.retryFailed(request.getCampaignId(), request.getTargetIds())
                : campaignRunService.startRun(request.getCampaignId());

            log.info("Run request for campaign {} finished: {} sent, {} failed, stop reason {}",
                request.getCampaignId(), result.sentCount(), result.failedCount(), result.stopReason());
        } catch (JsonProcessingException e) {
            log.error("Discarding malformed run request (key={}): {}", sendingAccountKey, e.getOriginalMessage());
        } catch (CampaignPreconditionException e) {
            log.warn("Run request rejected ({}): {}", e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Run request failed (key={}); campaign keeps its committed state", sendingAccountKey, e);
        } finally {
            acknowledgment.acknowledge();
        }
    }
}
