package com.clapgrow.outreach.common.retry;

import java.util.Objects;

/**
 * Default {@link RetryPolicyResolver}: permanent failures are never retried, transient
 * failures use the standard policy and rate-limit responses use the rate-limit policy.
 */
public class ClassificationRetryPolicyResolver implements RetryPolicyResolver {

    private final RetryPolicy transientPolicy;
    private final RetryPolicy rateLimitPolicy;

    public ClassificationRetryPolicyResolver() {
        this(RetryPolicy.standard(), RetryPolicy.exponentialBackoff());
    }

    public ClassificationRetryPolicyResolver(RetryPolicy transientPolicy, RetryPolicy rateLimitPolicy) {
        this.transientPolicy = Objects.requireNonNull(transientPolicy, "transientPolicy");
        this.rateLimitPolicy = Objects.requireNonNull(rateLimitPolicy, "rateLimitPolicy");
    }

    @Override
    public RetryPolicy resolve(FailureClassification classification) {
        return switch (classification) {
            case PERMANENT -> RetryPolicy.noRetry();
            case RATE_LIMIT -> rateLimitPolicy;
            case TRANSIENT -> transientPolicy;
        };
    }
}
