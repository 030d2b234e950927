package com.clapgrow.outreach.engine.dto;

import com.clapgrow.outreach.engine.enums.CampaignStatus;
import com.clapgrow.outreach.engine.enums.TargetStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Rates are percentages rounded to two decimals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignStatisticsResponse {
    private Long campaignId;
    private CampaignStatus status;
    private int totalTargets;
    private Map<TargetStatus, Long> targetsByStatus;
    private long sendAttempts;
    private long successfulSends;
    private long failedSends;
    private int messagesSent;
    private int repliesReceived;
    /** Successful send records over all send records. */
    private double successRate;
    /** Messages sent over total targets. */
    private double deliveryRate;
    /** Replies over messages sent. */
    private double responseRate;
    private double engagementScore;
}
