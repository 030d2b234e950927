package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.common.personalization.MessagePersonalizer;
import com.clapgrow.outreach.common.personalization.TemplateValidationResult;
import com.clapgrow.outreach.engine.dto.AddTargetsResponse;
import com.clapgrow.outreach.engine.dto.CampaignStatisticsResponse;
import com.clapgrow.outreach.engine.dto.CreateCampaignRequest;
import com.clapgrow.outreach.engine.dto.TargetRequest;
import com.clapgrow.outreach.engine.dto.UpdateCampaignRequest;
import com.clapgrow.outreach.engine.entity.Campaign;
import com.clapgrow.outreach.engine.entity.CampaignTarget;
import com.clapgrow.outreach.engine.enums.CampaignStatus;
import com.clapgrow.outreach.engine.enums.SendRecordStatus;
import com.clapgrow.outreach.engine.enums.TargetStatus;
import com.clapgrow.outreach.engine.exception.CampaignNotFoundException;
import com.clapgrow.outreach.engine.exception.CampaignStateException;
import com.clapgrow.outreach.engine.exception.CampaignValidationException;
import com.clapgrow.outreach.engine.exception.SendingIdentityBusyException;
import com.clapgrow.outreach.engine.repository.CampaignRepository;
import com.clapgrow.outreach.engine.repository.CampaignTargetRepository;
import com.clapgrow.outreach.engine.repository.SendRecordRepository;
import com.clapgrow.outreach.engine.repository.SendingAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Campaign and target management outside the send loop.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignService {

    static final int MIN_TEMPLATE_LENGTH = 10;
    static final int MAX_DAILY_LIMIT = 1000;

    private final CampaignRepository campaignRepository;
    private final CampaignTargetRepository targetRepository;
    private final SendRecordRepository sendRecordRepository;
    private final SendingAccountRepository sendingAccountRepository;
    private final CampaignStateMachine campaignStateMachine;
    private final TargetStateMachine targetStateMachine;
    private final MessagePersonalizer messagePersonalizer;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final CampaignStore campaignStore;

    @Transactional
    public Campaign createCampaign(CreateCampaignRequest request) {
        List<String> errors = new ArrayList<>();
        if (isBlank(request.getName())) {
            errors.add("Name is required");
        }
        boolean personalization = request.getPersonalizationEnabled() == null || request.getPersonalizationEnabled();
        validateTemplate(request.getMessageTemplate(), personalization, errors);

        int dailyLimit = request.getDailyLimit() != null ? request.getDailyLimit() : Campaign.DEFAULT_DAILY_LIMIT;
        int delayMin = request.getDelayMinSeconds() != null
            ? request.getDelayMinSeconds() : Campaign.DEFAULT_DELAY_MIN_SECONDS;
        int delayMax = request.getDelayMaxSeconds() != null
            ? request.getDelayMaxSeconds() : Campaign.DEFAULT_DELAY_MAX_SECONDS;
        validateLimits(dailyLimit, delayMin, delayMax, errors);

        if (request.getSendingAccountId() == null) {
            errors.add("Sending account is required");
        } else if (!sendingAccountRepository.existsById(request.getSendingAccountId())) {
            errors.add("Sending account not found: " + request.getSendingAccountId());
        }
        if (!errors.isEmpty()) {
            throw new CampaignValidationException("Invalid campaign: " + String.join("; ", errors), errors);
        }

        Campaign campaign = new Campaign();
        campaign.setSendingAccountId(request.getSendingAccountId());
        campaign.setName(request.getName().trim());
        campaign.setDescription(request.getDescription());
        campaign.setMessageTemplate(request.getMessageTemplate());
        campaign.setPersonalizationEnabled(personalization);
        campaign.setDailyLimit(dailyLimit);
        campaign.setDelayMinSeconds(delayMin);
        campaign.setDelayMaxSeconds(delayMax);
        campaign.setStatus(CampaignStatus.DRAFT);

        Campaign saved = campaignRepository.save(campaign);
        log.info("Created campaign {} '{}' for sending account {}", saved.getId(), saved.getName(),
            saved.getSendingAccountId());
        return saved;
    }

    @Transactional(readOnly = true)
    public Campaign getCampaign(Long campaignId) {
        return campaignRepository.findById(campaignId)
            .orElseThrow(() -> CampaignNotFoundException.campaign(campaignId));
    }

    @Transactional(readOnly = true)
    public List<Campaign> listCampaigns(Long sendingAccountId, CampaignStatus status) {
        if (sendingAccountId != null && status != null) {
            return campaignRepository.findBySendingAccountIdAndStatusOrderByCreatedAtDesc(sendingAccountId, status);
        }
        if (sendingAccountId != null) {
            return campaignRepository.findBySendingAccountIdOrderByCreatedAtDesc(sendingAccountId);
        }
        if (status != null) {
            return campaignRepository.findByStatusOrderByCreatedAtDesc(status);
        }
        return campaignRepository.findAllByOrderByCreatedAtDesc();
    }

    /**
     * Applies the non-null fields of the request. Template, delays and the personalization toggle
     * are editable in DRAFT only; ACTIVE and COMPLETED campaigns accept name, description and
     * daily limit. Counters written by a running send loop meanwhile are kept.
     */
    public Campaign updateCampaign(Long campaignId, UpdateCampaignRequest request) {
        Campaign updated = campaignStore.updateCampaign(campaignId, campaign -> applyUpdate(campaign, request));
        log.info("Updated campaign {}", campaignId);
        return updated;
    }

    private void applyUpdate(Campaign campaign, UpdateCampaignRequest request) {
        Long campaignId = campaign.getId();
        CampaignStatus status = campaign.getStatus();

        boolean draftOnlyChange = request.getMessageTemplate() != null
            || request.getPersonalizationEnabled() != null
            || request.getDelayMinSeconds() != null
            || request.getDelayMaxSeconds() != null;
        if (draftOnlyChange && status != CampaignStatus.DRAFT) {
            throw new CampaignStateException(String.format(
                "Campaign %d in %s only accepts name, description and daily limit changes", campaignId, status));
        }

        List<String> errors = new ArrayList<>();
        if (request.getName() != null && isBlank(request.getName())) {
            errors.add("Name cannot be blank");
        }
        boolean personalization = request.getPersonalizationEnabled() != null
            ? request.getPersonalizationEnabled() : campaign.isPersonalizationEnabled();
        String template = request.getMessageTemplate() != null
            ? request.getMessageTemplate() : campaign.getMessageTemplate();
        if (request.getMessageTemplate() != null || request.getPersonalizationEnabled() != null) {
            validateTemplate(template, personalization, errors);
        }
        int dailyLimit = request.getDailyLimit() != null ? request.getDailyLimit() : campaign.getDailyLimit();
        int delayMin = request.getDelayMinSeconds() != null
            ? request.getDelayMinSeconds() : campaign.getDelayMinSeconds();
        int delayMax = request.getDelayMaxSeconds() != null
            ? request.getDelayMaxSeconds() : campaign.getDelayMaxSeconds();
        validateLimits(dailyLimit, delayMin, delayMax, errors);
        if (!errors.isEmpty()) {
            throw new CampaignValidationException("Invalid campaign update: " + String.join("; ", errors), errors);
        }

        if (request.getName() != null) {
            campaign.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            campaign.setDescription(request.getDescription());
        }
        campaign.setMessageTemplate(template);
        campaign.setPersonalizationEnabled(personalization);
        campaign.setDailyLimit(dailyLimit);
        campaign.setDelayMinSeconds(delayMin);
        campaign.setDelayMaxSeconds(delayMax);
    }

    @Transactional
    public void deleteCampaign(Long campaignId) {
        Campaign campaign = getCampaign(campaignId);
        if (campaign.getStatus() == CampaignStatus.ACTIVE) {
            throw new CampaignStateException("Campaign " + campaignId + " is ACTIVE; pause it before deleting");
        }
        if (rateLimiterRegistry.isRunInProgress(campaign.getSendingAccountId())) {
            throw new SendingIdentityBusyException(campaign.getSendingAccountId());
        }
        int records = sendRecordRepository.deleteByCampaignId(campaignId);
        int targets = targetRepository.deleteByCampaignId(campaignId);
        campaignRepository.delete(campaign);
        log.info("Deleted campaign {} with {} targets and {} send records", campaignId, targets, records);
    }

    /**
     * Adds targets to a DRAFT or PAUSED campaign. Handles already in the campaign, or repeated
     * within the request, are skipped.
     */
    @Transactional
    public AddTargetsResponse addTargets(Long campaignId, List<TargetRequest> targets) {
        Campaign campaign = getCampaign(campaignId);
        if (campaign.getStatus() != CampaignStatus.DRAFT && campaign.getStatus() != CampaignStatus.PAUSED) {
            throw new CampaignStateException(String.format(
                "Targets can only be added to DRAFT or PAUSED campaigns (campaign %d is %s)",
                campaignId, campaign.getStatus()));
        }

        Set<String> known = new HashSet<>();
        for (String username : targetRepository.findUsernamesByCampaignId(campaignId)) {
            known.add(normalizeHandle(username));
        }

        List<CampaignTarget> toSave = new ArrayList<>();
        for (TargetRequest request : targets) {
            String username = request.getUsername().trim();
            if (!known.add(normalizeHandle(username))) {
                continue;
            }
            CampaignTarget target = new CampaignTarget();
            target.setCampaignId(campaignId);
            target.setUsername(username);
            target.setRecipientId(request.getRecipientId());
            target.setDisplayName(request.getDisplayName());
            target.setFollowerCount(request.getFollowerCount());
            target.setFollowingCount(request.getFollowingCount());
            target.setDmEligible(request.getDmEligible() == null || request.getDmEligible());
            target.setStatus(TargetStatus.PENDING);
            toSave.add(target);
        }
        targetRepository.saveAll(toSave);

        int total = (int) targetRepository.countByCampaignId(campaignId);
        campaignRepository.updateTotalTargets(campaignId, total);

        int skipped = targets.size() - toSave.size();
        log.info("Added {} targets to campaign {} ({} duplicates skipped, {} total)",
            toSave.size(), campaignId, skipped, total);
        return new AddTargetsResponse(targets.size(), toSave.size(), skipped, total);
    }

    @Transactional(readOnly = true)
    public List<CampaignTarget> listTargets(Long campaignId, TargetStatus status) {
        getCampaign(campaignId);
        if (status != null) {
            return targetRepository.findByCampaignIdAndStatusOrderByCreatedAtAscIdAsc(campaignId, status);
        }
        return targetRepository.findByCampaignIdOrderByCreatedAtAscIdAsc(campaignId);
    }

    /**
     * DRAFT → ACTIVE without starting a run; the scheduler or an operator starts it later.
     */
    public Campaign activateCampaign(Long campaignId) {
        long targetCount = targetRepository.countByCampaignId(campaignId);
        return campaignStore.updateCampaign(campaignId, campaign -> {
            campaignStateMachine.activate(campaign, targetCount);
            campaign.setTotalTargets((int) targetCount);
        });
    }

    @Transactional
    public CampaignTarget recordReply(Long campaignId, Long targetId) {
        CampaignTarget target = targetRepository.findByIdAndCampaignId(targetId, campaignId)
            .orElseThrow(() -> CampaignNotFoundException.target(campaignId, targetId));
        targetStateMachine.markReplied(target);
        CampaignTarget saved = targetRepository.save(target);
        campaignRepository.incrementRepliesReceived(campaignId);
        log.info("Recorded reply from {} in campaign {}", target.getUsername(), campaignId);
        return saved;
    }

    @Transactional(readOnly = true)
    public CampaignStatisticsResponse getStatistics(Long campaignId) {
        Campaign campaign = getCampaign(campaignId);

        Map<TargetStatus, Long> byStatus = new EnumMap<>(TargetStatus.class);
        for (TargetStatus status : TargetStatus.values()) {
            byStatus.put(status, 0L);
        }
        for (Object[] row : targetRepository.countByStatus(campaignId)) {
            byStatus.put((TargetStatus) row[0], ((Number) row[1]).longValue());
        }

        long attempts = sendRecordRepository.countByCampaignId(campaignId);
        long successful = sendRecordRepository.countByCampaignIdAndStatus(campaignId, SendRecordStatus.SENT);
        long failed = sendRecordRepository.countByCampaignIdAndStatus(campaignId, SendRecordStatus.FAILED);

        double successRate = percentage(successful, attempts);
        double deliveryRate = percentage(campaign.getMessagesSent(), campaign.getTotalTargets());
        double responseRate = percentage(campaign.getRepliesReceived(), campaign.getMessagesSent());
        double engagementScore = round(0.3 * deliveryRate + 0.5 * responseRate);

        return CampaignStatisticsResponse.builder()
            .campaignId(campaignId)
            .status(campaign.getStatus())
            .totalTargets(campaign.getTotalTargets())
            .targetsByStatus(byStatus)
            .sendAttempts(attempts)
            .successfulSends(successful)
            .failedSends(failed)
            .messagesSent(campaign.getMessagesSent())
            .repliesReceived(campaign.getRepliesReceived())
            .successRate(successRate)
            .deliveryRate(deliveryRate)
            .responseRate(responseRate)
            .engagementScore(engagementScore)
            .build();
    }

    private void validateTemplate(String template, boolean personalizationEnabled, List<String> errors) {
        if (isBlank(template)) {
            errors.add("Message template is required");
            return;
        }
        if (template.length() < MIN_TEMPLATE_LENGTH) {
            errors.add("Message template must be at least " + MIN_TEMPLATE_LENGTH + " characters");
        }
        TemplateValidationResult result = messagePersonalizer.validate(template, personalizationEnabled);
        if (!result.valid()) {
            errors.addAll(result.errors());
        }
    }

    private static void validateLimits(int dailyLimit, int delayMin, int delayMax, List<String> errors) {
        if (dailyLimit < 1 || dailyLimit > MAX_DAILY_LIMIT) {
            errors.add("Daily limit must be between 1 and " + MAX_DAILY_LIMIT);
        }
        if (delayMin < 0) {
            errors.add("Minimum delay cannot be negative");
        }
        if (delayMax < delayMin) {
            errors.add("Maximum delay must be greater than or equal to minimum delay");
        }
    }

    private static String normalizeHandle(String username) {
        String trimmed = username.trim();
        if (trimmed.startsWith("@")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    static double percentage(long part, long whole) {
        if (whole <= 0) {
            return 0.0;
        }
        return round(part * 100.0 / whole);
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
