package com.clapgrow.outreach.engine.exception;

public class CampaignNotFoundException extends CampaignPreconditionException {

    public CampaignNotFoundException(String message) {
        super(message);
    }

    public static CampaignNotFoundException campaign(Long campaignId) {
        return new CampaignNotFoundException("Campaign not found: " + campaignId);
    }

    public static CampaignNotFoundException target(Long campaignId, Long targetId) {
        return new CampaignNotFoundException("Target " + targetId + " not found in campaign " + campaignId);
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }
}
