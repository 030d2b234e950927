package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.common.personalization.MessagePersonalizer;
import com.clapgrow.outreach.common.personalization.TemplateValidationResult;
import com.clapgrow.outreach.engine.entity.Campaign;
import com.clapgrow.outreach.engine.enums.CampaignStatus;
import com.clapgrow.outreach.engine.exception.CampaignStateException;
import com.clapgrow.outreach.engine.exception.CampaignValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Guarded campaign lifecycle transitions.
 *
 * Valid transitions:
 * - DRAFT → ACTIVE (needs at least one target and a valid template), FAILED
 * - ACTIVE → PAUSED, COMPLETED, FAILED
 * - PAUSED → ACTIVE, FAILED
 * - COMPLETED, FAILED → PAUSED (reopen for an operator retry of failed targets)
 *
 * Every guard runs before the entity is touched: a rejected transition leaves it unchanged.
 * Callers persist the entity.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CampaignStateMachine {

    private static final Map<CampaignStatus, Set<CampaignStatus>> VALID_TRANSITIONS = Map.of(
        CampaignStatus.DRAFT, EnumSet.of(CampaignStatus.ACTIVE, CampaignStatus.FAILED),
        CampaignStatus.ACTIVE, EnumSet.of(CampaignStatus.PAUSED, CampaignStatus.COMPLETED, CampaignStatus.FAILED),
        CampaignStatus.PAUSED, EnumSet.of(CampaignStatus.ACTIVE, CampaignStatus.FAILED),
        CampaignStatus.COMPLETED, EnumSet.of(CampaignStatus.PAUSED),
        CampaignStatus.FAILED, EnumSet.of(CampaignStatus.PAUSED)
    );

    private final MessagePersonalizer messagePersonalizer;
    private final Clock clock;

    public boolean isValidTransition(CampaignStatus fromStatus, CampaignStatus toStatus) {
        Set<CampaignStatus> allowed = VALID_TRANSITIONS.get(fromStatus);
        return allowed != null && allowed.contains(toStatus);
    }

    public void assertValidTransition(Campaign campaign, CampaignStatus toStatus) {
        if (!isValidTransition(campaign.getStatus(), toStatus)) {
            log.warn("Invalid campaign transition attempted for {}: {} → {}",
                campaign.getId(), campaign.getStatus(), toStatus);
            throw new CampaignStateException(String.format(
                "Campaign %d cannot move from %s to %s", campaign.getId(), campaign.getStatus(), toStatus));
        }
    }

    /**
     * DRAFT → ACTIVE. Stamps {@code startedAt}.
     *
     * @param targetCount number of targets currently attached to the campaign
     */
    public void activate(Campaign campaign, long targetCount) {
        if (campaign.getStatus() != CampaignStatus.DRAFT) {
            throw new CampaignStateException(String.format(
                "Campaign %d can only be activated from DRAFT (current: %s)", campaign.getId(), campaign.getStatus()));
        }
        if (targetCount < 1) {
            throw new CampaignStateException("Campaign " + campaign.getId() + " cannot be activated without targets");
        }
        TemplateValidationResult validation = messagePersonalizer.validate(
            campaign.getMessageTemplate(), campaign.isPersonalizationEnabled());
        if (!validation.valid()) {
            throw new CampaignValidationException("Invalid message template: " + validation.errorSummary(),
                validation.errors());
        }
        moveTo(campaign, CampaignStatus.ACTIVE);
        campaign.setStartedAt(now());
    }

    public void pause(Campaign campaign) {
        moveTo(campaign, CampaignStatus.PAUSED);
    }

    /**
     * PAUSED → ACTIVE. Counters are kept.
     */
    public void resume(Campaign campaign) {
        if (campaign.getStatus() != CampaignStatus.PAUSED) {
            throw new CampaignStateException(String.format(
                "Campaign %d can only be resumed from PAUSED (current: %s)", campaign.getId(), campaign.getStatus()));
        }
        moveTo(campaign, CampaignStatus.ACTIVE);
        if (campaign.getStartedAt() == null) {
            campaign.setStartedAt(now());
        }
    }

    public void complete(Campaign campaign) {
        moveTo(campaign, CampaignStatus.COMPLETED);
        campaign.setCompletedAt(now());
    }

    public void fail(Campaign campaign) {
        moveTo(campaign, CampaignStatus.FAILED);
        campaign.setCompletedAt(now());
    }

    /**
     * COMPLETED or FAILED → PAUSED, so failed targets can be retried.
     */
    public void reopen(Campaign campaign) {
        if (campaign.getStatus() != CampaignStatus.COMPLETED && campaign.getStatus() != CampaignStatus.FAILED) {
            throw new CampaignStateException(String.format(
                "Campaign %d can only be reopened when finished (current: %s)", campaign.getId(), campaign.getStatus()));
        }
        moveTo(campaign, CampaignStatus.PAUSED);
        campaign.setCompletedAt(null);
    }

    private void moveTo(Campaign campaign, CampaignStatus toStatus) {
        assertValidTransition(campaign, toStatus);
        log.info("Campaign {} status {} → {}", campaign.getId(), campaign.getStatus(), toStatus);
        campaign.setStatus(toStatus);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
