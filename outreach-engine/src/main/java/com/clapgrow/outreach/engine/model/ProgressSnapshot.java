package com.clapgrow.outreach.engine.model;

import java.time.Instant;

/**
 * Live view of one campaign run. Immutable; the tracker swaps whole snapshots.
 *
 * @param currentTargetId target being attempted, or null between targets
 */
public record ProgressSnapshot(
    Long campaignId,
    int totalTargets,
    int processed,
    int sent,
    int failed,
    Long currentTargetId,
    ProgressStatus status,
    Instant startedAt
) {

    public static ProgressSnapshot start(Long campaignId, int totalTargets, Instant startedAt) {
        return new ProgressSnapshot(campaignId, totalTargets, 0, 0, 0, null, ProgressStatus.RUNNING, startedAt);
    }

    public ProgressSnapshot withCurrentTarget(Long targetId) {
        return new ProgressSnapshot(campaignId, totalTargets, processed, sent, failed, targetId, status, startedAt);
    }

    public ProgressSnapshot recordSent() {
        return new ProgressSnapshot(campaignId, totalTargets, processed + 1, sent + 1, failed, null, status, startedAt);
    }

    public ProgressSnapshot recordFailed() {
        return new ProgressSnapshot(campaignId, totalTargets, processed + 1, sent, failed + 1, null, status, startedAt);
    }

    public ProgressSnapshot completed() {
        return new ProgressSnapshot(campaignId, totalTargets, processed, sent, failed, null,
            ProgressStatus.COMPLETED, startedAt);
    }

    public double percentComplete() {
        if (totalTargets == 0) {
            return 100.0;
        }
        return Math.round(processed * 10000.0 / totalTargets) / 100.0;
    }
}
