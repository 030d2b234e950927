package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.common.ratelimit.RateLimiter;
import com.clapgrow.outreach.engine.entity.Campaign;
import com.clapgrow.outreach.engine.enums.CampaignStatus;
import com.clapgrow.outreach.engine.model.CampaignRunRequest;
import com.clapgrow.outreach.engine.repository.CampaignRepository;
import com.clapgrow.outreach.engine.repository.CampaignTargetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks up ACTIVE campaigns that still have eligible pending targets but no running send
 * loop, typically campaigns stopped by the daily quota, and queues a run for each one whose
 * account has quota left.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "outreach.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CampaignRunScheduler {

    static final String REQUESTED_BY = "scheduler";

    private final CampaignRepository campaignRepository;
    private final CampaignTargetRepository targetRepository;
    private final ProgressTracker progressTracker;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final CampaignRunRequestPublisher runRequestPublisher;

    @Scheduled(fixedDelayString = "${outreach.scheduler.interval-ms:300000}",
        initialDelayString = "${outreach.scheduler.initial-delay-ms:60000}")
    public void resumeActiveCampaigns() {
        List<Campaign> activeCampaigns = campaignRepository.findByStatusOrderByCreatedAtDesc(CampaignStatus.ACTIVE);
        int queued = 0;
        for (Campaign campaign : activeCampaigns) {
            if (shouldQueue(campaign)) {
                runRequestPublisher.publish(campaign.getSendingAccountId(),
                    new CampaignRunRequest(campaign.getId(), REQUESTED_BY, false, null));
                queued++;
            }
        }
        if (queued > 0) {
            log.info("Queued {} of {} active campaigns for another run", queued, activeCampaigns.size());
        }
    }

    private boolean shouldQueue(Campaign campaign) {
        Long accountId = campaign.getSendingAccountId();
        if (progressTracker.isRunning(campaign.getId()) || rateLimiterRegistry.isRunInProgress(accountId)) {
            return false;
        }
        boolean quotaExhausted = rateLimiterRegistry.find(accountId)
            .map(RateLimiter::isQuotaExhausted)
            .orElse(false);
        if (quotaExhausted) {
            log.debug("Campaign {} waits for account {} quota reset", campaign.getId(), accountId);
            return false;
        }
        return targetRepository.countEligiblePending(campaign.getId()) > 0;
    }
}
