package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.engine.entity.CampaignTarget;
import com.clapgrow.outreach.engine.enums.TargetStatus;
import com.clapgrow.outreach.engine.exception.CampaignStateException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Target transitions: PENDING → SENT | FAILED, SENT → REPLIED, FAILED → PENDING (operator reset).
 */
@Component
@RequiredArgsConstructor
public class TargetStateMachine {

    private final Clock clock;

    public void markSent(CampaignTarget target) {
        require(target, TargetStatus.PENDING, TargetStatus.SENT);
        target.setStatus(TargetStatus.SENT);
        target.setErrorMessage(null);
        target.setMessageSentAt(LocalDateTime.now(clock));
    }

    public void markFailed(CampaignTarget target, String errorMessage) {
        require(target, TargetStatus.PENDING, TargetStatus.FAILED);
        target.setStatus(TargetStatus.FAILED);
        target.setErrorMessage(errorMessage);
    }

    public void markReplied(CampaignTarget target) {
        require(target, TargetStatus.SENT, TargetStatus.REPLIED);
        target.setStatus(TargetStatus.REPLIED);
        target.setRepliedAt(LocalDateTime.now(clock));
    }

    public void resetForRetry(CampaignTarget target) {
        require(target, TargetStatus.FAILED, TargetStatus.PENDING);
        target.setStatus(TargetStatus.PENDING);
        target.setErrorMessage(null);
    }

    private static void require(CampaignTarget target, TargetStatus expected, TargetStatus toStatus) {
        if (target.getStatus() != expected) {
            throw new CampaignStateException(String.format("Target %d cannot move from %s to %s",
                target.getId(), target.getStatus(), toStatus));
        }
    }
}
