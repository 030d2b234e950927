package com.clapgrow.outreach.common.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        // 10:00 UTC, 14 hours before the day boundary
        clock = new MutableClock(Instant.parse("2024-03-10T10:00:00Z"), ZoneOffset.UTC);
    }

    @Test
    void testCanSend_WhenFresh_ReturnsTrue() {
        RateLimiter limiter = new RateLimiter("acct-1", 5, 30, clock);

        assertTrue(limiter.canSend());
        assertEquals(0, limiter.waitSeconds());
    }

    @Test
    void testCanSend_WithinDelayWindow_ReturnsFalseAndRemainingSeconds() {
        RateLimiter limiter = new RateLimiter("acct-1", 5, 30, clock);
        assertTrue(limiter.recordSend());

        clock.advance(Duration.ofMillis(10_500));

        assertFalse(limiter.canSend());
        assertFalse(limiter.isQuotaExhausted());
        assertEquals(20, limiter.waitSeconds());

        clock.advance(Duration.ofMillis(19_500));
        assertTrue(limiter.canSend());
    }

    @Test
    void testRecordSend_AtDailyLimit_RefusedAndCounterUnchanged() {
        RateLimiter limiter = new RateLimiter("acct-1", 2, 0, clock);

        assertTrue(limiter.recordSend());
        assertTrue(limiter.recordSend());
        assertFalse(limiter.recordSend());

        assertEquals(2, limiter.snapshot().sentToday());
        assertTrue(limiter.isQuotaExhausted());
        assertFalse(limiter.canSend());
    }

    @Test
    void testWaitSeconds_WhenQuotaExhausted_ReturnsTimeUntilDayBoundary() {
        RateLimiter limiter = new RateLimiter("acct-1", 1, 0, clock);
        limiter.recordSend();

        assertEquals(Duration.ofHours(14).getSeconds(), limiter.waitSeconds());
    }

    @Test
    void testDayRollover_ResetsCounterAtNextLocalMidnight() {
        RateLimiter limiter = new RateLimiter("acct-1", 1, 0, clock);
        limiter.recordSend();
        assertTrue(limiter.isQuotaExhausted());

        clock.advance(Duration.ofHours(13).plusMinutes(59));
        assertTrue(limiter.isQuotaExhausted());

        clock.advance(Duration.ofMinutes(1));
        assertFalse(limiter.isQuotaExhausted());
        RateLimiterState state = limiter.snapshot();
        assertEquals(0, state.sentToday());
        assertEquals(Instant.parse("2024-03-12T00:00:00Z"), state.dayBoundary());
    }

    @Test
    void testDailyLimitZero_AlwaysBlocks() {
        RateLimiter limiter = new RateLimiter("acct-1", 0, 0, clock);

        assertFalse(limiter.canSend());
        assertTrue(limiter.isQuotaExhausted());
        assertFalse(limiter.recordSend());
    }

    @Test
    void testDelayMinZero_DisablesOnlyDelayCheck() {
        RateLimiter limiter = new RateLimiter("acct-1", 3, 0, clock);

        for (int i = 0; i < 3; i++) {
            assertTrue(limiter.canSend());
            assertTrue(limiter.recordSend());
        }
        assertFalse(limiter.canSend());
    }

    @Test
    void testQuotaInvariant_ManyCallsNeverExceedLimit() {
        RateLimiter limiter = new RateLimiter("acct-1", 7, 1, clock);

        int counted = 0;
        for (int i = 0; i < 50; i++) {
            if (limiter.recordSend()) {
                counted++;
            }
            clock.advance(Duration.ofMillis(700));
            assertTrue(limiter.snapshot().sentToday() <= 7);
        }
        assertEquals(7, counted);
    }

    @Test
    void testReconfigure_KeepsCounters() {
        RateLimiter limiter = new RateLimiter("acct-1", 1, 0, clock);
        limiter.recordSend();

        limiter.reconfigure(3, 0);

        assertEquals(1, limiter.snapshot().sentToday());
        assertEquals(2, limiter.snapshot().remainingToday());
        assertTrue(limiter.canSend());
    }

    @Test
    void testConstructor_NegativeLimit_Throws() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter("acct-1", -1, 0, clock));
    }
}
