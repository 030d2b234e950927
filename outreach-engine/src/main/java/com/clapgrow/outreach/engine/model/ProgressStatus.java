package com.clapgrow.outreach.engine.model;

public enum ProgressStatus {
    RUNNING,
    COMPLETED
}
