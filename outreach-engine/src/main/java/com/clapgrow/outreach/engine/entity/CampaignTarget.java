package com.clapgrow.outreach.engine.entity;

import com.clapgrow.outreach.common.personalization.RecipientProfile;
import com.clapgrow.outreach.engine.enums.TargetStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One recipient within a campaign.
 * Status changes go through {@code TargetStateMachine}.
 */
@Entity
@Table(name = "campaign_targets",
    uniqueConstraints = @UniqueConstraint(name = "uk_campaign_targets_username",
        columnNames = {"campaign_id", "username"}),
    indexes = {
        @Index(name = "idx_campaign_targets_campaign_status", columnList = "campaign_id, status"),
        @Index(name = "idx_campaign_targets_created_at", columnList = "created_at")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CampaignTarget extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "campaign_id", nullable = false)
    private Long campaignId;

    @Column(name = "username", nullable = false, length = 100)
    private String username;

    /** Channel-side recipient id; falls back to the username when the channel has none. */
    @Column(name = "recipient_id", length = 100)
    private String recipientId;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Column(name = "follower_count")
    private Integer followerCount;

    @Column(name = "following_count")
    private Integer followingCount;

    @Column(name = "dm_eligible", nullable = false)
    private boolean dmEligible = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TargetStatus status = TargetStatus.PENDING;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "message_sent_at")
    private LocalDateTime messageSentAt;

    @Column(name = "replied_at")
    private LocalDateTime repliedAt;

    public RecipientProfile toProfile() {
        return new RecipientProfile(username, displayName, followerCount, followingCount);
    }

    public String deliveryRecipientId() {
        return recipientId != null && !recipientId.isBlank() ? recipientId : username;
    }
}
