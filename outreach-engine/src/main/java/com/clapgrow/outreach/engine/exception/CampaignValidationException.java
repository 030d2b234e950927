package com.clapgrow.outreach.engine.exception;

import java.util.List;

public class CampaignValidationException extends CampaignPreconditionException {

    private final List<String> errors;

    public CampaignValidationException(String message) {
        this(message, List.of(message));
    }

    public CampaignValidationException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String getErrorCode() {
        return "VALIDATION_ERROR";
    }
}
