package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.common.ratelimit.RateLimiter;
import com.clapgrow.outreach.engine.entity.Campaign;
import com.clapgrow.outreach.engine.enums.CampaignStatus;
import com.clapgrow.outreach.engine.model.CampaignRunRequest;
import com.clapgrow.outreach.engine.repository.CampaignRepository;
import com.clapgrow.outreach.engine.repository.CampaignTargetRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CampaignRunSchedulerTest {

    @Mock
    private CampaignRepository campaignRepository;

    @Mock
    private CampaignTargetRepository targetRepository;

    @Mock
    private CampaignRunRequestPublisher publisher;

    private ProgressTracker progressTracker;
    private RateLimiterRegistry rateLimiterRegistry;
    private CampaignRunScheduler scheduler;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-11T10:00:00Z"), ZoneOffset.UTC);
        progressTracker = new ProgressTracker(clock);
        rateLimiterRegistry = new RateLimiterRegistry(clock);
        scheduler = new CampaignRunScheduler(campaignRepository, targetRepository, progressTracker,
            rateLimiterRegistry, publisher);
    }

    @Test
    void testResumeActiveCampaigns_IdleWithPendingTargets_Queued() {
        when(campaignRepository.findByStatusOrderByCreatedAtDesc(CampaignStatus.ACTIVE))
            .thenReturn(List.of(campaign(7L, 3L)));
        when(targetRepository.countEligiblePending(7L)).thenReturn(5L);

        scheduler.resumeActiveCampaigns();

        ArgumentCaptor<CampaignRunRequest> captor = ArgumentCaptor.forClass(CampaignRunRequest.class);
        verify(publisher).publish(eq(3L), captor.capture());
        assertEquals(7L, captor.getValue().getCampaignId());
        assertEquals(CampaignRunScheduler.REQUESTED_BY, captor.getValue().getRequestedBy());
        assertFalse(captor.getValue().isRetryFailed());
    }

    @Test
    void testResumeActiveCampaigns_RunningExhaustedOrDrained_Skipped() {
        Campaign running = campaign(1L, 10L);
        Campaign exhausted = campaign(2L, 20L);
        Campaign drained = campaign(3L, 30L);
        when(campaignRepository.findByStatusOrderByCreatedAtDesc(CampaignStatus.ACTIVE))
            .thenReturn(List.of(running, exhausted, drained));
        progressTracker.start(1L, 4);
        RateLimiter limiter = rateLimiterRegistry.limiterFor(20L, 1, 0);
        limiter.recordSend();
        when(targetRepository.countEligiblePending(3L)).thenReturn(0L);

        scheduler.resumeActiveCampaigns();

        verify(publisher, never()).publish(anyLong(), any());
        verify(targetRepository, never()).countEligiblePending(1L);
        verify(targetRepository, never()).countEligiblePending(2L);
    }

    private static Campaign campaign(Long id, Long accountId) {
        Campaign campaign = new Campaign();
        campaign.setId(id);
        campaign.setSendingAccountId(accountId);
        campaign.setStatus(CampaignStatus.ACTIVE);
        return campaign;
    }
}
