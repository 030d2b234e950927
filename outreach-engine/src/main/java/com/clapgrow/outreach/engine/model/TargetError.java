package com.clapgrow.outreach.engine.model;

import com.clapgrow.outreach.common.retry.FailureClassification;

import java.time.Instant;

public record TargetError(
    Long targetId,
    String username,
    String error,
    FailureClassification classification,
    int attempts,
    Instant timestamp
) {
}
