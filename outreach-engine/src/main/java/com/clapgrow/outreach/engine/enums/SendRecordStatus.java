package com.clapgrow.outreach.engine.enums;

public enum SendRecordStatus {
    SENT,
    FAILED
}
