package com.clapgrow.outreach.engine.enums;

public enum TargetStatus {
    PENDING,
    SENT,
    FAILED,
    REPLIED
}
