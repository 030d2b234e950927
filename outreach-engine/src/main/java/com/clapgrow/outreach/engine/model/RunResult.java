package com.clapgrow.outreach.engine.model;

import java.util.List;

/**
 * Outcome of one campaign run.
 *
 * @param totalTargets  eligible pending targets when the run started
 * @param finalProgress last progress snapshot, taken as the run finished
 */
public record RunResult(
    Long campaignId,
    int totalTargets,
    int sentCount,
    int failedCount,
    List<TargetError> errors,
    RunStopReason stopReason,
    long durationMs,
    ProgressSnapshot finalProgress
) {

    public RunResult {
        errors = List.copyOf(errors);
    }

    public int processedCount() {
        return sentCount + failedCount;
    }
}
