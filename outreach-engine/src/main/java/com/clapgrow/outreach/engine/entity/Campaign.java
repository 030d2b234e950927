package com.clapgrow.outreach.engine.entity;

import com.clapgrow.outreach.engine.enums.CampaignStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "campaigns", indexes = {
    @Index(name = "idx_campaigns_account", columnList = "sending_account_id"),
    @Index(name = "idx_campaigns_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Campaign extends BaseAuditableEntity {

    public static final int DEFAULT_DAILY_LIMIT = 50;
    public static final int DEFAULT_DELAY_MIN_SECONDS = 30;
    public static final int DEFAULT_DELAY_MAX_SECONDS = 120;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "sending_account_id", nullable = false)
    private Long sendingAccountId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "message_template", nullable = false, columnDefinition = "TEXT")
    private String messageTemplate;

    @Column(name = "personalization_enabled", nullable = false)
    private boolean personalizationEnabled = true;

    @Column(name = "daily_limit", nullable = false)
    private int dailyLimit = DEFAULT_DAILY_LIMIT;

    @Column(name = "delay_min_seconds", nullable = false)
    private int delayMinSeconds = DEFAULT_DELAY_MIN_SECONDS;

    /**
     * Upper bound for any randomized spacing applied outside the engine.
     * Stored and validated only; the bulk send loop enforces {@code delayMinSeconds}.
     */
    @Column(name = "delay_max_seconds", nullable = false)
    private int delayMaxSeconds = DEFAULT_DELAY_MAX_SECONDS;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CampaignStatus status = CampaignStatus.DRAFT;

    @Column(name = "total_targets", nullable = false)
    private int totalTargets;

    @Column(name = "messages_sent", nullable = false)
    private int messagesSent;

    @Column(name = "replies_received", nullable = false)
    private int repliesReceived;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    /**
     * Bumped by every write, including the counter increments in {@code CampaignRepository},
     * so a save of a stale copy fails instead of rolling counters back.
     */
    @Version
    @Column(name = "version")
    private Long version;
}
