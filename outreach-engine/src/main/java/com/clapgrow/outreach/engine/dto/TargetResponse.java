package com.clapgrow.outreach.engine.dto;

import com.clapgrow.outreach.engine.entity.CampaignTarget;
import com.clapgrow.outreach.engine.enums.TargetStatus;

import java.time.LocalDateTime;

public record TargetResponse(
    Long id,
    Long campaignId,
    String username,
    String recipientId,
    String displayName,
    Integer followerCount,
    Integer followingCount,
    boolean dmEligible,
    TargetStatus status,
    String errorMessage,
    LocalDateTime messageSentAt,
    LocalDateTime repliedAt
) {
    public static TargetResponse from(CampaignTarget target) {
        return new TargetResponse(
            target.getId(),
            target.getCampaignId(),
            target.getUsername(),
            target.getRecipientId(),
            target.getDisplayName(),
            target.getFollowerCount(),
            target.getFollowingCount(),
            target.isDmEligible(),
            target.getStatus(),
            target.getErrorMessage(),
            target.getMessageSentAt(),
            target.getRepliedAt());
    }
}
