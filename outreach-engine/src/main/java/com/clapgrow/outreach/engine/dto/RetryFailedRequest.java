package com.clapgrow.outreach.engine.dto;

import lombok.Data;

import java.util.List;

/**
 * Empty or missing {@code targetIds} retries every failed target.
 */
@Data
public class RetryFailedRequest {
    private List<Long> targetIds;
}
