package com.clapgrow.outreach.engine.exception;

/**
 * The campaign kept changing underneath an update; nothing from the update was saved.
 */
public class ConcurrentCampaignUpdateException extends CampaignPreconditionException {

    public ConcurrentCampaignUpdateException(Long campaignId, int attempts, Throwable cause) {
        super("Campaign " + campaignId + " was modified concurrently " + attempts + " times. Please retry.");
        initCause(cause);
    }

    @Override
    public String getErrorCode() {
        return "CONCURRENT_MODIFICATION";
    }
}
