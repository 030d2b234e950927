package com.clapgrow.outreach.common.retry;

/**
 * Resolves retry policy based on failure classification.
 *
 * Maps failure classifications to retry strategies:
 * - PERMANENT: No retry (fail the attempt immediately)
 * - RATE_LIMIT: Retry with a longer exponential backoff
 * - TRANSIENT: Retry with standard strategy
 *
 * This allows different failure types to have different retry behaviors
 * without coupling the classification logic to retry logic.
 */
public interface RetryPolicyResolver {

    /**
     * Resolve retry policy for a given failure classification.
     *
     * @param classification Failure classification
     * @return Retry policy configuration
     */
    RetryPolicy resolve(FailureClassification classification);

    /**
     * Retry policy configuration.
     *
     * Delay before retry {@code n} (0-based) is
     * {@code initialDelayMs * backoffMultiplier^n}, randomized by {@code ±jitterFactor}
     * and capped at {@code maxDelayMs}.
     */
    record RetryPolicy(
        boolean shouldRetry,
        long initialDelayMs,
        long maxDelayMs,
        double backoffMultiplier,
        int maxRetries,
        double jitterFactor
    ) {

        public static final double DEFAULT_JITTER = 0.25;

        public RetryPolicy {
            if (initialDelayMs < 0 || maxDelayMs < 0) {
                throw new IllegalArgumentException("Retry delays must not be negative");
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative");
            }
            if (jitterFactor < 0 || jitterFactor >= 1) {
                throw new IllegalArgumentException("jitterFactor must be in [0, 1)");
            }
        }

        /**
         * No retry policy (for permanent failures).
         */
        public static RetryPolicy noRetry() {
            return new RetryPolicy(false, 0, 0, 1.0, 0, 0);
        }

        /**
         * Standard retry policy (for transient failures).
         */
        public static RetryPolicy standard() {
            return new RetryPolicy(true, 1000, 60000, 2.0, 3, DEFAULT_JITTER);
        }

        /**
         * Exponential backoff retry policy (for rate limits).
         */
        public static RetryPolicy exponentialBackoff() {
            return new RetryPolicy(true, 5000, 300000, 2.0, 5, DEFAULT_JITTER);
        }
    }
}
