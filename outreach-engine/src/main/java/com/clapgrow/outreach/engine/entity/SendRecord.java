package com.clapgrow.outreach.engine.entity;

import com.clapgrow.outreach.engine.enums.SendRecordStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Outcome of one delivery attempt sequence for a target. Written once, never updated.
 */
@Entity
@Table(name = "send_records", indexes = {
    @Index(name = "idx_send_records_campaign", columnList = "campaign_id"),
    @Index(name = "idx_send_records_target", columnList = "target_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SendRecord extends BaseAuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "campaign_id", nullable = false, updatable = false)
    private Long campaignId;

    @Column(name = "target_id", nullable = false, updatable = false)
    private Long targetId;

    @Column(name = "content", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "channel_message_id", updatable = false, length = 255)
    private String channelMessageId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, updatable = false, length = 20)
    private SendRecordStatus status;

    @Column(name = "attempts", nullable = false, updatable = false)
    private int attempts;

    @Column(name = "error_message", updatable = false, columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "queued_at", nullable = false, updatable = false)
    private LocalDateTime queuedAt;

    @Column(name = "sent_at", updatable = false)
    private LocalDateTime sentAt;

    @Column(name = "delivered_at", updatable = false)
    private LocalDateTime deliveredAt;

    private SendRecord(Long campaignId, Long targetId, String content, SendRecordStatus status, int attempts,
                       LocalDateTime queuedAt) {
        this.campaignId = campaignId;
        this.targetId = targetId;
        this.content = content;
        this.status = status;
        this.attempts = attempts;
        this.queuedAt = queuedAt;
    }

    public static SendRecord sent(CampaignTarget target, String content, String channelMessageId, int attempts,
                                  LocalDateTime queuedAt, LocalDateTime sentAt, LocalDateTime deliveredAt) {
        SendRecord record = new SendRecord(target.getCampaignId(), target.getId(), content,
            SendRecordStatus.SENT, attempts, queuedAt);
        record.channelMessageId = channelMessageId;
        record.sentAt = sentAt;
        record.deliveredAt = deliveredAt;
        return record;
    }

    public static SendRecord failed(CampaignTarget target, String content, String errorMessage, int attempts,
                                    LocalDateTime queuedAt) {
        SendRecord record = new SendRecord(target.getCampaignId(), target.getId(), content,
            SendRecordStatus.FAILED, attempts, queuedAt);
        record.errorMessage = errorMessage;
        return record;
    }
}
