package com.clapgrow.outreach.common.ratelimit;

import java.time.Instant;

/**
 * Point-in-time view of a {@link RateLimiter}.
 *
 * @param dayBoundary instant at which {@code sentToday} resets
 * @param lastSentAt  time of the last recorded send, or null if none today or before
 */
public record RateLimiterState(
    String identity,
    int dailyLimit,
    long delayMinSeconds,
    int sentToday,
    Instant dayBoundary,
    Instant lastSentAt
) {

    public int remainingToday() {
        return Math.max(0, dailyLimit - sentToday);
    }
}
