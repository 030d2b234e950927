package com.clapgrow.outreach.common.retry;

import com.clapgrow.outreach.common.concurrent.Sleeper;
import com.clapgrow.outreach.common.retry.RetryPolicyResolver.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Executes an operation with bounded retries and exponential backoff with jitter.
 *
 * <p>Rules:
 * <ul>
 *   <li>The policy for each failure is resolved from its classification; a policy that
 *       does not allow retries ends the loop immediately without consuming the remaining
 *       budget</li>
 *   <li>Retry {@code n} (0-based) waits {@code initialDelay * multiplier^n ± jitter},
 *       capped at the policy's maximum delay</li>
 *   <li>When retries are exhausted the last failure is returned to the caller</li>
 * </ul>
 *
 * <p>An interrupt during a backoff wait re-asserts the thread's interrupt flag and returns
 * the last failure.
 */
@Slf4j
public class RetryRunner {

    private static final long MIN_DELAY_MS = 100L;

    private final RetryPolicyResolver policyResolver;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public RetryRunner(RetryPolicyResolver policyResolver, Sleeper sleeper) {
        this(policyResolver, sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryRunner(RetryPolicyResolver policyResolver, Sleeper sleeper, DoubleSupplier random) {
        this.policyResolver = Objects.requireNonNull(policyResolver, "policyResolver");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Run the operation until it succeeds, fails permanently or runs out of retries.
     *
     * @param operationName name used in log lines
     * @param operation     single attempt; must not return null
     * @return outcome holding the last attempt's result and the attempt count
     */
    public <T> RetryOutcome<T> run(String operationName, Supplier<AttemptResult<T>> operation) {
        int attempt = 0;
        while (true) {
            attempt++;
            AttemptResult<T> result = Objects.requireNonNull(operation.get(),
                "Operation " + operationName + " returned no result");

            if (result.success()) {
                if (attempt > 1) {
                    log.info("{} succeeded on attempt {}", operationName, attempt);
                }
                return new RetryOutcome<>(result, attempt);
            }

            RetryPolicy policy = policyResolver.resolve(result.classification());
            if (!policy.shouldRetry()) {
                log.warn("{} failed with {} error, not retrying: {}",
                    operationName, result.classification(), result.errorMessage());
                return new RetryOutcome<>(result, attempt);
            }

            int retryIndex = attempt - 1;
            if (retryIndex >= policy.maxRetries()) {
                log.error("{} failed after {} attempts. Last error ({}): {}",
                    operationName, attempt, result.classification(), result.errorMessage());
                return new RetryOutcome<>(result, attempt);
            }

            long delayMs = computeDelayMs(policy, retryIndex);
            log.warn("{} attempt {}/{} failed ({}): {}. Retrying in {}ms",
                operationName, attempt, policy.maxRetries() + 1, result.classification(),
                result.errorMessage(), delayMs);

            try {
                sleeper.sleep(Duration.ofMillis(delayMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while backing off {} after attempt {}", operationName, attempt);
                return new RetryOutcome<>(result, attempt);
            }
        }
    }

    long computeDelayMs(RetryPolicy policy, int retryIndex) {
        double base = policy.initialDelayMs() * Math.pow(policy.backoffMultiplier(), retryIndex);
        double jitter = base * policy.jitterFactor() * (2 * random.getAsDouble() - 1);
        double delay = Math.max(MIN_DELAY_MS, base + jitter);
        return (long) Math.min(delay, policy.maxDelayMs());
    }
}
