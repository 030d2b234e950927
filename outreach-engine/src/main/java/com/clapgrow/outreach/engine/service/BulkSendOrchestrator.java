package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.common.concurrent.Sleeper;
import com.clapgrow.outreach.common.delivery.DeliveryReceipt;
import com.clapgrow.outreach.common.delivery.DeliveryRequest;
import com.clapgrow.outreach.common.personalization.MessagePersonalizer;
import com.clapgrow.outreach.common.personalization.TemplateValidationResult;
import com.clapgrow.outreach.common.ratelimit.RateLimiter;
import com.clapgrow.outreach.common.retry.RetryOutcome;
import com.clapgrow.outreach.common.retry.RetryRunner;
import com.clapgrow.outreach.engine.config.CampaignEngineProperties;
import com.clapgrow.outreach.engine.entity.Campaign;
import com.clapgrow.outreach.engine.entity.CampaignTarget;
import com.clapgrow.outreach.engine.entity.SendRecord;
import com.clapgrow.outreach.engine.entity.SendingAccount;
import com.clapgrow.outreach.engine.enums.CampaignStatus;
import com.clapgrow.outreach.engine.exception.CampaignStateException;
import com.clapgrow.outreach.engine.exception.CampaignValidationException;
import com.clapgrow.outreach.engine.exception.NoEligibleTargetsException;
import com.clapgrow.outreach.engine.exception.SendingIdentityBusyException;
import com.clapgrow.outreach.engine.exception.SendingIdentityException;
import com.clapgrow.outreach.engine.model.ProgressSnapshot;
import com.clapgrow.outreach.engine.model.RunResult;
import com.clapgrow.outreach.engine.model.RunStopReason;
import com.clapgrow.outreach.engine.model.TargetError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one campaign: sends one message to every pending, DM-eligible target, in creation
 * order, under the sending account's rate limiter.
 *
 * Preconditions are all checked before anything is written:
 * - campaign exists and is DRAFT, PAUSED, or ACTIVE with no run in progress
 *   (an ACTIVE campaign is one whose previous run stopped on the daily quota)
 * - sending account exists, is active and has an authenticated channel
 * - template validates
 * - at least one eligible pending target
 * - no other run holds the sending account
 *
 * Per target:
 * 1. Re-read the campaign status; stop if PAUSED
 * 2. Wait for the rate limiter in bounded slices, re-checking pause; stop if the daily quota is used up
 * 3. Render, then send through the retry runner
 * 4. Commit target status and its send record together
 *
 * Per-target failures are collected, never thrown. Only precondition errors and
 * {@link com.clapgrow.outreach.engine.exception.CampaignStoreException} escape; in the latter
 * case every target committed so far stays committed and the run can be resumed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BulkSendOrchestrator {

    private final CampaignStore campaignStore;
    private final CampaignStateMachine campaignStateMachine;
    private final TargetStateMachine targetStateMachine;
    private final MessagePersonalizer messagePersonalizer;
    private final DeliveryGateway deliveryGateway;
    private final RetryRunner retryRunner;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final ProgressTracker progressTracker;
    private final CampaignMetricsService metricsService;
    private final CampaignEngineProperties properties;
    private final Sleeper sleeper;
    private final Clock clock;

    public RunResult run(Long campaignId) {
        long startedAtMs = clock.millis();
        Campaign campaign = campaignStore.getCampaign(campaignId);
        checkPreconditions(campaign);

        Long accountId = campaign.getSendingAccountId();
        if (!rateLimiterRegistry.tryAcquireRun(accountId)) {
            throw new SendingIdentityBusyException(accountId);
        }

        RunTally tally = new RunTally();
        try {
            campaign = markActive(campaign);
            RateLimiter limiter = rateLimiterRegistry.limiterFor(
                accountId, campaign.getDailyLimit(), campaign.getDelayMinSeconds());
            List<CampaignTarget> targets = campaignStore.listPendingTargets(campaignId);
            progressTracker.start(campaignId, targets.size());

            log.info("Starting run for campaign {} on account {}: {} eligible targets, {} sends left today",
                campaignId, accountId, targets.size(), limiter.snapshot().remainingToday());

            RunStopReason stopReason = sendAll(campaign, targets, limiter, tally);
            finishCampaign(campaignId, stopReason, tally);

            long durationMs = clock.millis() - startedAtMs;
            ProgressSnapshot finalProgress = progressTracker.finish(campaignId)
                .orElseGet(() -> ProgressSnapshot.start(campaignId, targets.size(), clock.instant()).completed());
            metricsService.recordRunFinished(stopReason, durationMs);

            log.info("Run for campaign {} ended ({}): sent={}, failed={}, duration={}ms",
                campaignId, stopReason, tally.sent, tally.failed, durationMs);
            return new RunResult(campaignId, targets.size(), tally.sent, tally.failed, tally.errors,
                stopReason, durationMs, finalProgress);
        } finally {
            // Already removed on a normal finish; this covers a run aborted by a store error
            progressTracker.finish(campaignId);
            rateLimiterRegistry.releaseRun(accountId);
        }
    }

    private void checkPreconditions(Campaign campaign) {
        Long campaignId = campaign.getId();
        CampaignStatus status = campaign.getStatus();
        if (status != CampaignStatus.DRAFT && status != CampaignStatus.PAUSED && status != CampaignStatus.ACTIVE) {
            throw new CampaignStateException(
                "Campaign " + campaignId + " cannot be run from status " + status);
        }
        if (status == CampaignStatus.ACTIVE && progressTracker.isRunning(campaignId)) {
            throw new CampaignStateException("Campaign " + campaignId + " is already running");
        }

        verifySendingReady(campaign);

        if (campaignStore.countPendingTargets(campaignId) == 0) {
            throw new NoEligibleTargetsException(campaignId);
        }
    }

    /**
     * Checks that the campaign's sending account can send and that its template renders.
     * Reads only; used before any run and before failed targets are reset for a retry.
     */
    public void verifySendingReady(Campaign campaign) {
        Long accountId = campaign.getSendingAccountId();
        SendingAccount account = campaignStore.getSendingAccount(accountId)
            .orElseThrow(() -> new SendingIdentityException("Sending account " + accountId + " not found"));
        if (!account.isActive()) {
            throw new SendingIdentityException("Sending account " + accountId + " is deactivated");
        }
        if (!account.isChannelConnected() || !deliveryGateway.isAuthenticated(String.valueOf(accountId))) {
            throw new SendingIdentityException(
                "Sending account " + accountId + " has no authenticated delivery channel");
        }

        TemplateValidationResult validation = messagePersonalizer.validate(
            campaign.getMessageTemplate(), campaign.isPersonalizationEnabled());
        if (!validation.valid()) {
            throw new CampaignValidationException("Invalid message template: " + validation.errorSummary(),
                validation.errors());
        }
    }

    private Campaign markActive(Campaign campaign) {
        if (campaign.getStatus() == CampaignStatus.ACTIVE) {
            return campaign;
        }
        long targetCount = campaignStore.countTargets(campaign.getId());
        return campaignStore.updateCampaign(campaign.getId(), current -> {
            switch (current.getStatus()) {
                case DRAFT -> campaignStateMachine.activate(current, targetCount);
                case PAUSED -> campaignStateMachine.resume(current);
                default -> { }
            }
        });
    }

    private RunStopReason sendAll(Campaign campaign, List<CampaignTarget> targets, RateLimiter limiter,
                                  RunTally tally) {
        Long campaignId = campaign.getId();
        for (CampaignTarget target : targets) {
            if (Thread.currentThread().isInterrupted()) {
                return RunStopReason.INTERRUPTED;
            }
            if (isPaused(campaignId)) {
                log.info("Campaign {} paused after {} targets", campaignId, tally.processed());
                return RunStopReason.PAUSED;
            }
            RunStopReason blocked = awaitSendSlot(campaignId, limiter);
            if (blocked != null) {
                return blocked;
            }

            progressTracker.update(campaignId, snapshot -> snapshot.withCurrentTarget(target.getId()));
            if (!attempt(campaign, target, limiter, tally)) {
                return RunStopReason.INTERRUPTED;
            }
        }
        return RunStopReason.COMPLETED;
    }

    /**
     * Blocks until the limiter allows a send.
     *
     * @return null when a send may proceed, otherwise the reason the run must stop
     */
    private RunStopReason awaitSendSlot(Long campaignId, RateLimiter limiter) {
        long maxSliceSeconds = Math.max(1, properties.getMaxWaitSliceSeconds());
        while (!limiter.canSend()) {
            if (limiter.isQuotaExhausted()) {
                log.info("Daily limit reached for account {}; campaign {} stops until {}",
                    limiter.getIdentity(), campaignId, limiter.snapshot().dayBoundary());
                return RunStopReason.QUOTA_EXHAUSTED;
            }
            long waitSeconds = Math.max(1, Math.min(limiter.waitSeconds(), maxSliceSeconds));
            log.debug("Campaign {} waiting {}s for the next send slot", campaignId, waitSeconds);
            try {
                sleeper.sleep(Duration.ofSeconds(waitSeconds));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Campaign {} interrupted while waiting for a send slot", campaignId);
                return RunStopReason.INTERRUPTED;
            }
            if (isPaused(campaignId)) {
                log.info("Campaign {} paused while waiting for a send slot", campaignId);
                return RunStopReason.PAUSED;
            }
        }
        return null;
    }

    /**
     * Sends to one target and commits the outcome.
     *
     * @return false if the thread was interrupted before an outcome could be decided; the
     *         target is then left PENDING with no send record
     */
    private boolean attempt(Campaign campaign, CampaignTarget target, RateLimiter limiter, RunTally tally) {
        Long campaignId = campaign.getId();
        LocalDateTime queuedAt = now();
        String content = campaign.isPersonalizationEnabled()
            ? messagePersonalizer.render(campaign.getMessageTemplate(), target.toProfile())
            : campaign.getMessageTemplate();
        DeliveryRequest request = new DeliveryRequest(
            String.valueOf(campaign.getSendingAccountId()), target.deliveryRecipientId(), content);

        RetryOutcome<DeliveryReceipt> outcome = retryRunner.run(
            "Send to " + target.getUsername(), () -> deliveryGateway.send(request));

        if (outcome.isSuccess()) {
            DeliveryReceipt receipt = outcome.value();
            if (!limiter.recordSend()) {
                log.warn("Send to {} was delivered but could not be counted against account {}",
                    target.getUsername(), limiter.getIdentity());
            }
            targetStateMachine.markSent(target);
            SendRecord record = SendRecord.sent(target, content, receipt.messageId(), outcome.attempts(),
                queuedAt, target.getMessageSentAt(),
                receipt.deliveredAt() != null ? LocalDateTime.ofInstant(receipt.deliveredAt(), clock.getZone()) : null);
            campaignStore.commitTargetOutcome(target, record);

            tally.sent++;
            progressTracker.update(campaignId, ProgressSnapshot::recordSent);
            metricsService.recordSent(outcome.attempts());
            log.info("Sent message to {} for campaign {} (messageId={}, attempts={})",
                target.getUsername(), campaignId, receipt.messageId(), outcome.attempts());
            return true;
        }

        if (Thread.currentThread().isInterrupted()) {
            log.warn("Send to {} for campaign {} interrupted; target left pending",
                target.getUsername(), campaignId);
            return false;
        }

        targetStateMachine.markFailed(target, outcome.errorMessage());
        campaignStore.commitTargetOutcome(target,
            SendRecord.failed(target, content, outcome.errorMessage(), outcome.attempts(), queuedAt));

        tally.failed++;
        tally.errors.add(new TargetError(target.getId(), target.getUsername(), outcome.errorMessage(),
            outcome.classification(), outcome.attempts(), clock.instant()));
        progressTracker.update(campaignId, ProgressSnapshot::recordFailed);
        metricsService.recordFailed(outcome.classification(), outcome.attempts());
        log.error("Failed to send message to {} for campaign {} after {} attempts ({}): {}",
            target.getUsername(), campaignId, outcome.attempts(), outcome.classification(), outcome.errorMessage());
        return true;
    }

    /**
     * Post-loop status: a pause or an interrupt leaves the status as is; a run with attempts
     * but no successful send fails the campaign; no eligible pending targets left completes
     * it; otherwise it stays ACTIVE for a later run.
     */
    private void finishCampaign(Long campaignId, RunStopReason stopReason, RunTally tally) {
        if (stopReason == RunStopReason.PAUSED || stopReason == RunStopReason.INTERRUPTED) {
            return;
        }
        boolean failRun = tally.sent == 0 && tally.processed() > 0;
        boolean drained = !failRun && campaignStore.countPendingTargets(campaignId) == 0;
        if (!failRun && !drained) {
            return;
        }
        // Decided on the stored status: a pause that lands after the loop wins
        AtomicReference<CampaignStatus> finishedAs = new AtomicReference<>();
        Campaign campaign = campaignStore.updateCampaign(campaignId, current -> {
            finishedAs.set(null);
            if (current.getStatus() != CampaignStatus.ACTIVE) {
                return;
            }
            if (failRun) {
                campaignStateMachine.fail(current);
            } else {
                campaignStateMachine.complete(current);
            }
            finishedAs.set(current.getStatus());
        });

        if (finishedAs.get() == CampaignStatus.FAILED) {
            log.warn("Campaign {} failed: no message delivered out of {} attempted targets",
                campaignId, tally.processed());
        } else if (finishedAs.get() == CampaignStatus.COMPLETED) {
            log.info("Campaign {} completed ({} messages sent in total)", campaignId, campaign.getMessagesSent());
        } else {
            log.info("Campaign {} left in {} after its run", campaignId, campaign.getStatus());
        }
    }

    private boolean isPaused(Long campaignId) {
        return campaignStore.getCampaignStatus(campaignId) == CampaignStatus.PAUSED;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static final class RunTally {
        private int sent;
        private int failed;
        private final List<TargetError> errors = new ArrayList<>();

        int processed() {
            return sent + failed;
        }
    }
}
