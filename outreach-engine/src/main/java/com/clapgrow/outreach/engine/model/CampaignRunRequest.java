package com.clapgrow.outreach.engine.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Kafka payload asking a worker to run a campaign.
 * With {@code retryFailed} set, failed targets (all, or only {@code targetIds}) are reset first.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CampaignRunRequest {
    private Long campaignId;
    private String requestedBy;
    private boolean retryFailed;
    private List<Long> targetIds;
}
