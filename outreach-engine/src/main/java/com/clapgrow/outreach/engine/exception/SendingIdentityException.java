package com.clapgrow.outreach.engine.exception;

/**
 * Sending account is missing, deactivated or has no authenticated channel.
 */
public class SendingIdentityException extends CampaignPreconditionException {

    public SendingIdentityException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "SENDING_IDENTITY_UNAVAILABLE";
    }
}
