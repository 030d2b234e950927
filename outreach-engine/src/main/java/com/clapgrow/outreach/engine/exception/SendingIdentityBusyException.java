package com.clapgrow.outreach.engine.exception;

public class SendingIdentityBusyException extends CampaignPreconditionException {

    public SendingIdentityBusyException(Long sendingAccountId) {
        super("Another campaign run is already in progress for sending account " + sendingAccountId);
    }

    @Override
    public String getErrorCode() {
        return "SENDING_IDENTITY_BUSY";
    }
}
