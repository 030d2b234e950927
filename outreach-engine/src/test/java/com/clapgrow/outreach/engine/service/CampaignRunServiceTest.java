package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.engine.entity.Campaign;
import com.clapgrow.outreach.engine.enums.CampaignStatus;
import com.clapgrow.outreach.engine.exception.CampaignNotFoundException;
import com.clapgrow.outreach.engine.exception.NoEligibleTargetsException;
import com.clapgrow.outreach.engine.exception.SendingIdentityBusyException;
import com.clapgrow.outreach.engine.exception.SendingIdentityException;
import com.clapgrow.outreach.engine.model.CampaignRunRequest;
import com.clapgrow.outreach.engine.model.RunResult;
import com.clapgrow.outreach.engine.model.RunStopReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CampaignRunServiceTest {

    @Mock
    private BulkSendOrchestrator orchestrator;

    @Mock
    private CampaignStore campaignStore;

    @Mock
    private CampaignStateMachine campaignStateMachine;

    @Mock
    private ProgressTracker progressTracker;

    @Mock
    private RateLimiterRegistry rateLimiterRegistry;

    @Mock
    private CampaignRunRequestPublisher runRequestPublisher;

    @InjectMocks
    private CampaignRunService campaignRunService;

    private Campaign campaign;
    private RunResult runResult;

    @BeforeEach
    void setUp() {
        campaign = new Campaign();
        campaign.setId(7L);
        campaign.setSendingAccountId(3L);
        runResult = new RunResult(7L, 2, 2, 0, List.of(), RunStopReason.COMPLETED, 15L, null);
    }

    private void applyUpdatesToCampaign() {
        when(campaignStore.updateCampaign(eq(7L), any())).thenAnswer(inv -> {
            Consumer<Campaign> change = inv.getArgument(1);
            change.accept(campaign);
            return campaign;
        });
    }

    @Test
    void testPause_WhenActive_PausesAndPersists() {
        campaign.setStatus(CampaignStatus.ACTIVE);
        applyUpdatesToCampaign();

        assertTrue(campaignRunService.pause(7L));

        verify(campaignStateMachine).pause(campaign);
        verify(campaignStore).updateCampaign(eq(7L), any());
    }

    @Test
    void testPause_WhenNotActive_ReturnsFalse() {
        campaign.setStatus(CampaignStatus.PAUSED);
        applyUpdatesToCampaign();

        assertFalse(campaignRunService.pause(7L));

        verifyNoInteractions(campaignStateMachine);
    }

    @Test
    void testPause_WhenMissing_Throws() {
        when(campaignStore.updateCampaign(eq(99L), any())).thenThrow(CampaignNotFoundException.campaign(99L));

        assertThrows(CampaignNotFoundException.class, () -> campaignRunService.pause(99L));
    }

    @Test
    void testRetryFailed_WhenAccountBusy_ThrowsBeforeReset() {
        campaign.setStatus(CampaignStatus.FAILED);
        when(campaignStore.getCampaign(7L)).thenReturn(campaign);
        when(rateLimiterRegistry.isRunInProgress(3L)).thenReturn(true);

        assertThrows(SendingIdentityBusyException.class, () -> campaignRunService.retryFailed(7L, null));

        verify(campaignStore, never()).resetFailedTargets(anyLong(), any());
        verifyNoInteractions(orchestrator);
    }

    @Test
    void testRetryFailed_WhenNothingToRetry_Throws() {
        campaign.setStatus(CampaignStatus.COMPLETED);
        when(campaignStore.getCampaign(7L)).thenReturn(campaign);
        when(campaignStore.resetFailedTargets(7L, null)).thenReturn(0);
        when(campaignStore.countPendingTargets(7L)).thenReturn(0L);

        assertThrows(NoEligibleTargetsException.class, () -> campaignRunService.retryFailed(7L, null));

        verifyNoInteractions(campaignStateMachine);
        verify(campaignStore, never()).updateCampaign(anyLong(), any());
        verify(orchestrator, never()).run(anyLong());
    }

    @Test
    void testRetryFailed_WhenSendingNotReady_NoResetOrReopen() {
        campaign.setStatus(CampaignStatus.COMPLETED);
        when(campaignStore.getCampaign(7L)).thenReturn(campaign);
        doThrow(new SendingIdentityException("Sending account 3 is deactivated"))
            .when(orchestrator).verifySendingReady(campaign);

        assertThrows(SendingIdentityException.class, () -> campaignRunService.retryFailed(7L, null));

        verify(campaignStore, never()).resetFailedTargets(anyLong(), any());
        verify(campaignStore, never()).updateCampaign(anyLong(), any());
        verify(orchestrator, never()).run(anyLong());
        verifyNoInteractions(campaignStateMachine);
    }

    @Test
    void testRetryFailed_WhenFinished_ReopensAndRuns() {
        campaign.setStatus(CampaignStatus.FAILED);
        List<Long> targetIds = List.of(11L, 12L);
        when(campaignStore.getCampaign(7L)).thenReturn(campaign);
        when(campaignStore.resetFailedTargets(7L, targetIds)).thenReturn(2);
        applyUpdatesToCampaign();
        when(orchestrator.run(7L)).thenReturn(runResult);

        RunResult result = campaignRunService.retryFailed(7L, targetIds);

        assertSame(runResult, result);
        InOrder order = inOrder(orchestrator, campaignStore, campaignStateMachine);
        order.verify(orchestrator).verifySendingReady(campaign);
        order.verify(campaignStore).resetFailedTargets(7L, targetIds);
        order.verify(campaignStateMachine).reopen(campaign);
        order.verify(orchestrator).run(7L);
    }

    @Test
    void testRetryFailed_WhenActiveWithPendingTargets_RunsWithoutReopen() {
        campaign.setStatus(CampaignStatus.ACTIVE);
        when(campaignStore.getCampaign(7L)).thenReturn(campaign);
        when(campaignStore.resetFailedTargets(7L, null)).thenReturn(0);
        when(campaignStore.countPendingTargets(7L)).thenReturn(4L);
        when(orchestrator.run(7L)).thenReturn(runResult);

        campaignRunService.retryFailed(7L, null);

        verifyNoInteractions(campaignStateMachine);
        verify(orchestrator).run(7L);
    }

    @Test
    void testRequestRun_PublishesKeyedByAccount() {
        when(campaignStore.getCampaign(7L)).thenReturn(campaign);

        campaignRunService.requestRun(7L, true, List.of(11L), "ops");

        ArgumentCaptor<CampaignRunRequest> captor = ArgumentCaptor.forClass(CampaignRunRequest.class);
        verify(runRequestPublisher).publish(eq(3L), captor.capture());
        CampaignRunRequest request = captor.getValue();
        assertEquals(7L, request.getCampaignId());
        assertEquals("ops", request.getRequestedBy());
        assertTrue(request.isRetryFailed());
        assertEquals(List.of(11L), request.getTargetIds());
        verifyNoInteractions(orchestrator);
    }

    @Test
    void testStartRun_DelegatesToOrchestrator() {
        when(orchestrator.run(7L)).thenReturn(runResult);

        assertSame(runResult, campaignRunService.startRun(7L));
    }
}
