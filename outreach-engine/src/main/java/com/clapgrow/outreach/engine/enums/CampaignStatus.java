package com.clapgrow.outreach.engine.enums;

/**
 * Campaign lifecycle status.
 * Allowed transitions are enforced by {@code CampaignStateMachine}.
 */
public enum CampaignStatus {
    DRAFT,
    ACTIVE,
    PAUSED,
    COMPLETED,
    FAILED
}
