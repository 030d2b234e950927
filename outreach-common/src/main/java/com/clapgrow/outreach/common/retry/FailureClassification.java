package com.clapgrow.outreach.common.retry;

/**
 * Classification of delivery failures.
 *
 * Used to determine retry strategy and behavior:
 * - PERMANENT: Should not be retried (authorization, not found, blocked recipient, invalid input)
 * - TRANSIENT: Should be retried (timeouts, connection failures, server errors)
 * - RATE_LIMIT: Should be retried with a longer backoff (e.g., 429 Too Many Requests)
 *
 * The classification is decided once, where the delivery client's error is interpreted,
 * and then travels with the failed attempt. Retry code only reads the tag.
 */
public enum FailureClassification {
    PERMANENT,   // Permanent failure - do not retry
    TRANSIENT,   // Transient failure - retry with standard strategy
    RATE_LIMIT;  // Rate limit - retry with exponential backoff

    public boolean isRetryable() {
        return this != PERMANENT;
    }
}
