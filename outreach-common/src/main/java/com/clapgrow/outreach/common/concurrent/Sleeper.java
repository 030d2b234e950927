package com.clapgrow.outreach.common.concurrent;

import java.time.Duration;

/**
 * Blocking wait abstraction. Production code uses {@link #SYSTEM}; tests substitute a
 * recording implementation so backoff and rate-limit waits do not consume real time.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
