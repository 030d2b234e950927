package com.clapgrow.outreach.engine.exception;

/**
 * Persistence failure while a campaign operation is in progress.
 * Aborts the current run; everything committed before it stays committed.
 */
public class CampaignStoreException extends RuntimeException {

    public CampaignStoreException(String message) {
        super(message);
    }

    public CampaignStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
