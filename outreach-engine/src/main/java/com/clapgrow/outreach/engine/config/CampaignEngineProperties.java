package com.clapgrow.outreach.engine.config;

import com.clapgrow.outreach.common.retry.RetryPolicyResolver.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the bulk send engine.
 *
 * Maps to:
 * outreach:
 *   engine:
 *     max-wait-slice-seconds: 60
 *     time-zone: Asia/Kolkata
 *     retry:
 *       max-retries: 3
 *       initial-delay-ms: 1000
 *     rate-limit-retry:
 *       max-retries: 5
 *       initial-delay-ms: 5000
 */
@Configuration
@ConfigurationProperties(prefix = "outreach.engine")
@Data
public class CampaignEngineProperties {

    /**
     * Longest single sleep while waiting on the rate limiter. Pause and shutdown are
     * observed between slices. Default: 60
     */
    private long maxWaitSliceSeconds = 60;

    /**
     * Zone whose midnight resets daily quotas. Blank means the JVM default zone.
     */
    private String timeZone = "";

    /**
     * Policy for transient delivery failures (timeouts, 5xx, connection errors).
     */
    private RetrySettings retry = new RetrySettings(3, 1000, 60000, 2.0, 0.25);

    /**
     * Policy for rate-limit responses from the delivery channel.
     */
    private RetrySettings rateLimitRetry = new RetrySettings(5, 5000, 300000, 2.0, 0.25);

    @Data
    public static class RetrySettings {
        private int maxRetries;
        private long initialDelayMs;
        private long maxDelayMs;
        private double multiplier;
        private double jitter;

        public RetrySettings() {
        }

        public RetrySettings(int maxRetries, long initialDelayMs, long maxDelayMs, double multiplier, double jitter) {
            this.maxRetries = maxRetries;
            this.initialDelayMs = initialDelayMs;
            this.maxDelayMs = maxDelayMs;
            this.multiplier = multiplier;
            this.jitter = jitter;
        }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxRetries > 0, initialDelayMs, maxDelayMs, multiplier, maxRetries, jitter);
        }
    }
}
