package com.clapgrow.outreach.engine.exception;

public class NoEligibleTargetsException extends CampaignPreconditionException {

    public NoEligibleTargetsException(Long campaignId) {
        super("Campaign " + campaignId + " has no pending DM-eligible targets");
    }

    @Override
    public String getErrorCode() {
        return "NO_ELIGIBLE_TARGETS";
    }
}
