package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.engine.entity.Campaign;
import com.clapgrow.outreach.engine.enums.CampaignStatus;
import com.clapgrow.outreach.engine.exception.NoEligibleTargetsException;
import com.clapgrow.outreach.engine.exception.SendingIdentityBusyException;
import com.clapgrow.outreach.engine.model.CampaignRunRequest;
import com.clapgrow.outreach.engine.model.ProgressSnapshot;
import com.clapgrow.outreach.engine.model.RunResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run control entry point used by the REST API, the Kafka consumer and the scheduler.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignRunService {

    private final BulkSendOrchestrator orchestrator;
    private final CampaignStore campaignStore;
    private final CampaignStateMachine campaignStateMachine;
    private final ProgressTracker progressTracker;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final CampaignRunRequestPublisher runRequestPublisher;

    /**
     * Runs the campaign on the calling thread. Blocks for as long as the run lasts.
     */
    public RunResult startRun(Long campaignId) {
        return orchestrator.run(campaignId);
    }

    /**
     * Pauses an ACTIVE campaign. A running send loop stops before its next target.
     *
     * @return true if the campaign was paused by this call; false if it was not ACTIVE
     */
    public boolean pause(Long campaignId) {
        AtomicBoolean paused = new AtomicBoolean();
        campaignStore.updateCampaign(campaignId, campaign -> {
            paused.set(false);
            if (campaign.getStatus() != CampaignStatus.ACTIVE) {
                log.info("Pause ignored for campaign {} in status {}", campaignId, campaign.getStatus());
                return;
            }
            campaignStateMachine.pause(campaign);
            paused.set(true);
        });
        return paused.get();
    }

    public Optional<ProgressSnapshot> getProgress(Long campaignId) {
        return progressTracker.get(campaignId);
    }

    /**
     * Resets FAILED targets to PENDING and runs the campaign again. A finished campaign is
     * reopened first. The account and template checks of a run happen before anything is
     * reset, so a refused retry keeps each failed target's error.
     *
     * @param targetIds targets to reset; null or empty means every failed target
     */
    public RunResult retryFailed(Long campaignId, List<Long> targetIds) {
        Campaign campaign = campaignStore.getCampaign(campaignId);
        if (rateLimiterRegistry.isRunInProgress(campaign.getSendingAccountId())) {
            throw new SendingIdentityBusyException(campaign.getSendingAccountId());
        }
        orchestrator.verifySendingReady(campaign);

        int reset = campaignStore.resetFailedTargets(campaignId, targetIds);
        if (reset == 0 && campaignStore.countPendingTargets(campaignId) == 0) {
            throw new NoEligibleTargetsException(campaignId);
        }

        if (campaign.getStatus() == CampaignStatus.COMPLETED || campaign.getStatus() == CampaignStatus.FAILED) {
            campaignStore.updateCampaign(campaignId, current -> {
                if (current.getStatus() == CampaignStatus.COMPLETED || current.getStatus() == CampaignStatus.FAILED) {
                    campaignStateMachine.reopen(current);
                }
            });
        }
        log.info("Retrying campaign {} with {} reset targets", campaignId, reset);
        return orchestrator.run(campaignId);
    }

    /**
     * Queues a run through Kafka and returns immediately.
     */
    public void requestRun(Long campaignId, boolean retryFailed, List<Long> targetIds, String requestedBy) {
        Campaign campaign = campaignStore.getCampaign(campaignId);
        runRequestPublisher.publish(campaign.getSendingAccountId(),
            new CampaignRunRequest(campaignId, requestedBy, retryFailed, targetIds));
    }
}
