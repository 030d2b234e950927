package com.clapgrow.outreach.engine.exception;

/**
 * Requested transition or operation is not allowed in the entity's current status.
 */
public class CampaignStateException extends CampaignPreconditionException {

    public CampaignStateException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_STATE";
    }
}
