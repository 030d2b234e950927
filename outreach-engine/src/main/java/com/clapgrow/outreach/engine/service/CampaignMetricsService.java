package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.common.retry.FailureClassification;
import com.clapgrow.outreach.engine.model.RunStopReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Prometheus metrics for campaign delivery.
 *
 * Tracks:
 * - Messages sent / failed (by failure classification) / retried
 * - Attempts per message
 * - Runs completed by stop reason, and run duration
 *
 * Metrics are exposed at /actuator/prometheus. Meters are created once in @PostConstruct.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignMetricsService {

    private final MeterRegistry meterRegistry;

    private Counter messagesSent;
    private Counter messagesRetried;
    private DistributionSummary attemptsPerMessage;
    private Timer runDuration;
    private final Map<FailureClassification, Counter> messagesFailed = new EnumMap<>(FailureClassification.class);
    private final Map<RunStopReason, Counter> runsCompleted = new EnumMap<>(RunStopReason.class);

    @PostConstruct
    void init() {
        messagesSent = Counter.builder("outreach.messages.sent")
            .description("Messages accepted by the delivery channel")
            .register(meterRegistry);

        messagesRetried = Counter.builder("outreach.messages.retried")
            .description("Messages that needed more than one delivery attempt")
            .register(meterRegistry);

        attemptsPerMessage = DistributionSummary.builder("outreach.messages.attempts")
            .description("Delivery attempts per message")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);

        runDuration = Timer.builder("outreach.run.duration")
            .description("Wall-clock duration of campaign runs, rate-limit waits included")
            .register(meterRegistry);

        for (FailureClassification classification : FailureClassification.values()) {
            messagesFailed.put(classification, Counter.builder("outreach.messages.failed")
                .description("Messages that could not be delivered")
                .tag("classification", classification.name())
                .register(meterRegistry));
        }

        for (RunStopReason reason : RunStopReason.values()) {
            runsCompleted.put(reason, Counter.builder("outreach.runs.completed")
                .description("Campaign runs that ended, by stop reason")
                .tag("stopReason", reason.name())
                .register(meterRegistry));
        }
        log.info("Initialized outreach delivery metrics");
    }

    public void recordSent(int attempts) {
        messagesSent.increment();
        recordAttempts(attempts);
    }

    public void recordFailed(FailureClassification classification, int attempts) {
        messagesFailed.get(classification).increment();
        recordAttempts(attempts);
    }

    public void recordRunFinished(RunStopReason stopReason, long durationMs) {
        runsCompleted.get(stopReason).increment();
        runDuration.record(durationMs, TimeUnit.MILLISECONDS);
    }

    private void recordAttempts(int attempts) {
        attemptsPerMessage.record(attempts);
        if (attempts > 1) {
            messagesRetried.increment();
        }
    }
}
