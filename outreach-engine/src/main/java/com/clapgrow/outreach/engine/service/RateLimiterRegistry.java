package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.common.ratelimit.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One {@link RateLimiter} and one run lock per sending account.
 *
 * Limiters live for the lifetime of the JVM so a daily quota carries over between runs.
 * The run lock guarantees a single active send loop per account; it is taken with
 * {@code tryLock} and must be released by the thread that acquired it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimiterRegistry {

    private final Clock clock;

    private final ConcurrentHashMap<Long, RateLimiter> limiters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, ReentrantLock> runLocks = new ConcurrentHashMap<>();

    /**
     * Limiter for the account, created on first use and reconfigured with the given limits.
     */
    public RateLimiter limiterFor(Long sendingAccountId, int dailyLimit, long delayMinSeconds) {
        RateLimiter limiter = limiters.computeIfAbsent(sendingAccountId,
            id -> new RateLimiter(String.valueOf(id), dailyLimit, delayMinSeconds, clock));
        limiter.reconfigure(dailyLimit, delayMinSeconds);
        return limiter;
    }

    public Optional<RateLimiter> find(Long sendingAccountId) {
        return Optional.ofNullable(limiters.get(sendingAccountId));
    }

    /**
     * @return true if the caller now owns the account's run lock
     */
    public boolean tryAcquireRun(Long sendingAccountId) {
        ReentrantLock lock = runLocks.computeIfAbsent(sendingAccountId, id -> new ReentrantLock());
        if (lock.isHeldByCurrentThread()) {
            // Re-entry from the same worker would mean two loops on one account
            return false;
        }
        boolean acquired = lock.tryLock();
        if (!acquired) {
            log.debug("Run lock for sending account {} is held by another worker", sendingAccountId);
        }
        return acquired;
    }

    public void releaseRun(Long sendingAccountId) {
        ReentrantLock lock = runLocks.get(sendingAccountId);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
        }
    }

    public boolean isRunInProgress(Long sendingAccountId) {
        ReentrantLock lock = runLocks.get(sendingAccountId);
        return lock != null && lock.isLocked();
    }
}
