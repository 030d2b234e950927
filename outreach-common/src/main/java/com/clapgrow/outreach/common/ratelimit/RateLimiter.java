package com.clapgrow.outreach.common.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Daily quota and minimum inter-send delay for one sending identity.
 *
 * <p>Rules (must not be violated):
 * <ul>
 *   <li>{@code sentToday} never exceeds {@code dailyLimit} before the day boundary passes</li>
 *   <li>Consecutive recorded sends are at least {@code delayMinSeconds} apart when callers
 *       only send after {@link #canSend()} returned true</li>
 *   <li>The day counter resets lazily, on the first call made at or after the stored
 *       boundary (start of the next day in the clock's zone)</li>
 * </ul>
 *
 * <p>All state access is synchronized; status reads from other threads are safe.
 * A {@code dailyLimit} of 0 blocks permanently and a {@code delayMinSeconds} of 0 disables
 * the delay check.
 */
@Slf4j
public class RateLimiter {

    private final String identity;
    private final Clock clock;

    private int dailyLimit;
    private long delayMinSeconds;
    private int sentToday;
    private Instant dayBoundary;
    private Instant lastSentAt;

    public RateLimiter(String identity, int dailyLimit, long delayMinSeconds, Clock clock) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.clock = Objects.requireNonNull(clock, "clock");
        applyLimits(dailyLimit, delayMinSeconds);
        this.dayBoundary = nextDayStart(clock.instant());
    }

    /**
     * @return true if both the daily quota and the delay window allow a send right now
     */
    public synchronized boolean canSend() {
        Instant now = clock.instant();
        rollOverIfNeeded(now);
        if (sentToday >= dailyLimit) {
            return false;
        }
        return delayRemaining(now).isZero();
    }

    /**
     * @return true if today's quota is used up; no send is possible before the day boundary
     */
    public synchronized boolean isQuotaExhausted() {
        rollOverIfNeeded(clock.instant());
        return sentToday >= dailyLimit;
    }

    /**
     * Seconds until a send may be allowed, rounded up. Zero when {@link #canSend()} is true.
     * While the quota is exhausted this is the time left until the day boundary.
     */
    public synchronized long waitSeconds() {
        Instant now = clock.instant();
        rollOverIfNeeded(now);
        if (sentToday >= dailyLimit) {
            return ceilSeconds(Duration.between(now, dayBoundary));
        }
        return ceilSeconds(delayRemaining(now));
    }

    /**
     * Record a successful send. Refused, leaving the state unchanged, when the send would
     * exceed today's quota.
     *
     * @return true if the send was counted
     */
    public synchronized boolean recordSend() {
        Instant now = clock.instant();
        rollOverIfNeeded(now);
        if (sentToday >= dailyLimit) {
            log.warn("Refusing to record send for {}: daily limit {} already reached", identity, dailyLimit);
            return false;
        }
        sentToday++;
        lastSentAt = now;
        log.debug("Recorded send for {} ({}/{} today)", identity, sentToday, dailyLimit);
        return true;
    }

    /**
     * Apply new limits (e.g. the limits of the campaign about to run). Counters are kept.
     */
    public synchronized void reconfigure(int dailyLimit, long delayMinSeconds) {
        applyLimits(dailyLimit, delayMinSeconds);
    }

    public synchronized RateLimiterState snapshot() {
        rollOverIfNeeded(clock.instant());
        return new RateLimiterState(identity, dailyLimit, delayMinSeconds, sentToday, dayBoundary, lastSentAt);
    }

    public String getIdentity() {
        return identity;
    }

    private void applyLimits(int dailyLimit, long delayMinSeconds) {
        if (dailyLimit < 0) {
            throw new IllegalArgumentException("dailyLimit must not be negative");
        }
        if (delayMinSeconds < 0) {
            throw new IllegalArgumentException("delayMinSeconds must not be negative");
        }
        this.dailyLimit = dailyLimit;
        this.delayMinSeconds = delayMinSeconds;
    }

    private void rollOverIfNeeded(Instant now) {
        if (!now.isBefore(dayBoundary)) {
            if (sentToday > 0) {
                log.info("Day boundary passed for {}, resetting daily counter (was {})", identity, sentToday);
            }
            sentToday = 0;
            dayBoundary = nextDayStart(now);
        }
    }

    private Duration delayRemaining(Instant now) {
        if (lastSentAt == null || delayMinSeconds == 0) {
            return Duration.ZERO;
        }
        Duration window = Duration.ofSeconds(delayMinSeconds);
        Duration elapsed = Duration.between(lastSentAt, now);
        if (elapsed.compareTo(window) >= 0) {
            return Duration.ZERO;
        }
        return window.minus(elapsed);
    }

    private Instant nextDayStart(Instant now) {
        ZoneId zone = clock.getZone();
        return now.atZone(zone).toLocalDate().plusDays(1).atStartOfDay(zone).toInstant();
    }

    private static long ceilSeconds(Duration duration) {
        if (duration.isNegative() || duration.isZero()) {
            return 0;
        }
        long seconds = duration.getSeconds();
        return duration.getNano() > 0 ? seconds + 1 : seconds;
    }
}
