package com.clapgrow.outreach.engine.model;

/**
 * Why a campaign run's send loop ended.
 */
public enum RunStopReason {
    /** No eligible pending target left to attempt. */
    COMPLETED,
    /** Campaign status was switched to PAUSED while running. */
    PAUSED,
    /** Sending account hit its daily limit; resumable after the day boundary. */
    QUOTA_EXHAUSTED,
    /** Worker thread was interrupted, typically on shutdown. */
    INTERRUPTED
}
