package com.clapgrow.outreach.engine.exception;

/**
 * Base type for errors raised before a campaign operation mutates anything.
 * Handled by GlobalExceptionHandler; each subtype maps to its own HTTP status.
 */
public abstract class CampaignPreconditionException extends RuntimeException {

    protected CampaignPreconditionException(String message) {
        super(message);
    }

    /**
     * Stable machine-readable code used in error responses.
     */
    public abstract String getErrorCode();
}
