package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.common.ratelimit.RateLimiter;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterRegistryTest {

    private final RateLimiterRegistry registry = new RateLimiterRegistry(
        new MutableClock(Instant.parse("2024-03-11T10:00:00Z"), ZoneOffset.UTC));

    @Test
    void testLimiterFor_SameAccount_SharedAcrossCampaigns() {
        RateLimiter first = registry.limiterFor(1L, 50, 30);
        first.recordSend();

        RateLimiter second = registry.limiterFor(1L, 20, 60);

        assertSame(first, second);
        assertEquals(1, second.snapshot().sentToday());
        assertEquals(20, second.snapshot().dailyLimit());
        assertNotSame(first, registry.limiterFor(2L, 50, 30));
        assertTrue(registry.find(1L).isPresent());
        assertTrue(registry.find(3L).isEmpty());
    }

    @Test
    void testTryAcquireRun_SecondRunOnAccount_Refused() throws Exception {
        assertTrue(registry.tryAcquireRun(1L));
        assertTrue(registry.isRunInProgress(1L));
        assertFalse(registry.tryAcquireRun(1L), "same worker must not start a second loop");

        Boolean otherThread = CompletableFuture.supplyAsync(() -> registry.tryAcquireRun(1L)).get();
        assertFalse(otherThread);
        Boolean otherAccount = CompletableFuture.supplyAsync(() -> {
            boolean acquired = registry.tryAcquireRun(2L);
            registry.releaseRun(2L);
            return acquired;
        }).get();
        assertTrue(otherAccount);

        registry.releaseRun(1L);
        assertFalse(registry.isRunInProgress(1L));
    }

    @Test
    void testReleaseRun_FromNonOwner_Ignored() throws Exception {
        assertTrue(registry.tryAcquireRun(1L));

        CompletableFuture.runAsync(() -> registry.releaseRun(1L)).get();

        assertTrue(registry.isRunInProgress(1L));
        registry.releaseRun(1L);
    }
}
