package com.clapgrow.outreach.engine.config;

import com.clapgrow.outreach.common.concurrent.Sleeper;
import com.clapgrow.outreach.common.personalization.MessagePersonalizer;
import com.clapgrow.outreach.common.retry.ClassificationRetryPolicyResolver;
import com.clapgrow.outreach.common.retry.RetryPolicyResolver;
import com.clapgrow.outreach.common.retry.RetryRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the framework-free engine building blocks from outreach-common.
 */
@Configuration
@Slf4j
public class EngineConfig {

    @Bean
    public Clock clock(CampaignEngineProperties properties) {
        String zone = properties.getTimeZone();
        if (zone == null || zone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        log.info("Daily send quotas reset at midnight {}", zone);
        return Clock.system(ZoneId.of(zone));
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public RetryPolicyResolver retryPolicyResolver(CampaignEngineProperties properties) {
        return new ClassificationRetryPolicyResolver(
            properties.getRetry().toPolicy(),
            properties.getRateLimitRetry().toPolicy());
    }

    @Bean
    public RetryRunner retryRunner(RetryPolicyResolver retryPolicyResolver, Sleeper sleeper) {
        return new RetryRunner(retryPolicyResolver, sleeper);
    }

    @Bean
    public MessagePersonalizer messagePersonalizer() {
        return new MessagePersonalizer();
    }
}
