package com.clapgrow.outreach.engine.dto;

import com.clapgrow.outreach.engine.entity.Campaign;
import com.clapgrow.outreach.engine.enums.CampaignStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignResponse {
    private Long id;
    private Long sendingAccountId;
    private String name;
    private String description;
    private String messageTemplate;
    private boolean personalizationEnabled;
    private int dailyLimit;
    private int delayMinSeconds;
    private int delayMaxSeconds;
    private CampaignStatus status;
    private int totalTargets;
    private int messagesSent;
    private int repliesReceived;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static CampaignResponse from(Campaign campaign) {
        return CampaignResponse.builder()
            .id(campaign.getId())
            .sendingAccountId(campaign.getSendingAccountId())
            .name(campaign.getName())
            .description(campaign.getDescription())
            .messageTemplate(campaign.getMessageTemplate())
            .personalizationEnabled(campaign.isPersonalizationEnabled())
            .dailyLimit(campaign.getDailyLimit())
            .delayMinSeconds(campaign.getDelayMinSeconds())
            .delayMaxSeconds(campaign.getDelayMaxSeconds())
            .status(campaign.getStatus())
            .totalTargets(campaign.getTotalTargets())
            .messagesSent(campaign.getMessagesSent())
            .repliesReceived(campaign.getRepliesReceived())
            .startedAt(campaign.getStartedAt())
            .completedAt(campaign.getCompletedAt())
            .createdAt(campaign.getCreatedAt())
            .updatedAt(campaign.getUpdatedAt())
            .build();
    }
}
