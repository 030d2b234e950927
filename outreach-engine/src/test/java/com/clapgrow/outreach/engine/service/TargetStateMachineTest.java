package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.engine.entity.CampaignTarget;
import com.clapgrow.outreach.engine.enums.TargetStatus;
import com.clapgrow.outreach.engine.exception.CampaignStateException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TargetStateMachineTest {

    private final TargetStateMachine stateMachine = new TargetStateMachine(
        new MutableClock(Instant.parse("2024-03-11T10:00:00Z"), ZoneOffset.UTC));

    @Test
    void testMarkSent_FromPending_StampsSentAt() {
        CampaignTarget target = target(TargetStatus.PENDING);
        target.setErrorMessage("previous failure");

        stateMachine.markSent(target);

        assertEquals(TargetStatus.SENT, target.getStatus());
        assertNull(target.getErrorMessage());
        assertEquals(LocalDateTime.of(2024, 3, 11, 10, 0), target.getMessageSentAt());
    }

    @Test
    void testMarkFailed_FromPending_KeepsError() {
        CampaignTarget target = target(TargetStatus.PENDING);

        stateMachine.markFailed(target, "User not found");

        assertEquals(TargetStatus.FAILED, target.getStatus());
        assertEquals("User not found", target.getErrorMessage());
    }

    @Test
    void testMarkReplied_FromSent_StampsRepliedAt() {
        CampaignTarget target = target(TargetStatus.SENT);

        stateMachine.markReplied(target);

        assertEquals(TargetStatus.REPLIED, target.getStatus());
        assertNotNull(target.getRepliedAt());
    }

    @Test
    void testResetForRetry_FromFailed_ClearsError() {
        CampaignTarget target = target(TargetStatus.FAILED);
        target.setErrorMessage("timeout");

        stateMachine.resetForRetry(target);

        assertEquals(TargetStatus.PENDING, target.getStatus());
        assertNull(target.getErrorMessage());
    }

    @Test
    void testTransitions_OutsideTable_Rejected() {
        assertThrows(CampaignStateException.class, () -> stateMachine.markSent(target(TargetStatus.SENT)));
        assertThrows(CampaignStateException.class, () -> stateMachine.markFailed(target(TargetStatus.REPLIED), "x"));
        assertThrows(CampaignStateException.class, () -> stateMachine.markReplied(target(TargetStatus.PENDING)));
        assertThrows(CampaignStateException.class, () -> stateMachine.resetForRetry(target(TargetStatus.SENT)));
    }

    private static CampaignTarget target(TargetStatus status) {
        CampaignTarget target = new CampaignTarget();
        target.setId(11L);
        target.setCampaignId(7L);
        target.setUsername("alice");
        target.setStatus(status);
        return target;
    }
}
