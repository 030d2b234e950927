package com.clapgrow.outreach.engine.dto;

public record AddTargetsResponse(int requested, int added, int skippedDuplicates, int totalTargets) {
}
