package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.engine.entity.Campaign;
import com.clapgrow.outreach.engine.entity.CampaignTarget;
import com.clapgrow.outreach.engine.entity.SendRecord;
import com.clapgrow.outreach.engine.entity.SendingAccount;
import com.clapgrow.outreach.engine.enums.CampaignStatus;
import com.clapgrow.outreach.engine.enums.SendRecordStatus;
import com.clapgrow.outreach.engine.enums.TargetStatus;
import com.clapgrow.outreach.engine.exception.CampaignNotFoundException;
import com.clapgrow.outreach.engine.exception.CampaignStoreException;
import com.clapgrow.outreach.engine.exception.ConcurrentCampaignUpdateException;
import com.clapgrow.outreach.engine.repository.CampaignRepository;
import com.clapgrow.outreach.engine.repository.CampaignTargetRepository;
import com.clapgrow.outreach.engine.repository.SendRecordRepository;
import com.clapgrow.outreach.engine.repository.SendingAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link CampaignStore} over Spring Data JPA.
 *
 * Multi-row writes run in a {@link TransactionTemplate} so that commit failures surface
 * here, inside the translation to {@link CampaignStoreException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaCampaignStore implements CampaignStore {

    static final int MAX_UPDATE_ATTEMPTS = 3;

    private final CampaignRepository campaignRepository;
    private final CampaignTargetRepository targetRepository;
    private final SendRecordRepository sendRecordRepository;
    private final SendingAccountRepository sendingAccountRepository;
    private final TargetStateMachine targetStateMachine;
    private final TransactionTemplate transactionTemplate;

    @Override
    public Campaign getCampaign(Long campaignId) {
        return access("load campaign " + campaignId, () -> campaignRepository.findById(campaignId))
            .orElseThrow(() -> CampaignNotFoundException.campaign(campaignId));
    }

    @Override
    public CampaignStatus getCampaignStatus(Long campaignId) {
        return access("read status of campaign " + campaignId, () -> campaignRepository.findStatusById(campaignId))
            .orElseThrow(() -> CampaignNotFoundException.campaign(campaignId));
    }

    @Override
    public Optional<SendingAccount> getSendingAccount(Long sendingAccountId) {
        return access("load sending account " + sendingAccountId,
            () -> sendingAccountRepository.findById(sendingAccountId));
    }

    @Override
    public Campaign updateCampaign(Long campaignId, Consumer<Campaign> change) {
        for (int attempt = 1; ; attempt++) {
            int current = attempt;
            Campaign saved = access("update campaign " + campaignId, () -> {
                try {
                    return transactionTemplate.execute(status -> {
                        Campaign campaign = campaignRepository.findById(campaignId)
                            .orElseThrow(() -> CampaignNotFoundException.campaign(campaignId));
                        change.accept(campaign);
                        return campaignRepository.saveAndFlush(campaign);
                    });
                } catch (ObjectOptimisticLockingFailureException e) {
                    if (current >= MAX_UPDATE_ATTEMPTS) {
                        throw new ConcurrentCampaignUpdateException(campaignId, current, e);
                    }
                    log.warn("Campaign {} changed concurrently; reapplying update (attempt {} of {})",
                        campaignId, current + 1, MAX_UPDATE_ATTEMPTS);
                    return null;
                }
            });
            if (saved != null) {
                return saved;
            }
        }
    }

    @Override
    public List<CampaignTarget> listPendingTargets(Long campaignId) {
        return access("list pending targets of campaign " + campaignId,
            () -> targetRepository.findEligiblePending(campaignId));
    }

    @Override
    public long countPendingTargets(Long campaignId) {
        return access("count pending targets of campaign " + campaignId,
            () -> targetRepository.countEligiblePending(campaignId));
    }

    @Override
    public long countTargets(Long campaignId) {
        return access("count targets of campaign " + campaignId, () -> targetRepository.countByCampaignId(campaignId));
    }

    @Override
    public void commitTargetOutcome(CampaignTarget target, SendRecord sendRecord) {
        access("commit outcome of target " + target.getId(), () -> transactionTemplate.execute(status -> {
            targetRepository.save(target);
            sendRecordRepository.save(sendRecord);
            if (sendRecord.getStatus() == SendRecordStatus.SENT) {
                campaignRepository.incrementMessagesSent(target.getCampaignId());
            }
            return null;
        }));
    }

    @Override
    public int resetFailedTargets(Long campaignId, Collection<Long> targetIds) {
        Set<Long> selected = targetIds == null ? Set.of() : new HashSet<>(targetIds);
        Integer reset = access("reset failed targets of campaign " + campaignId,
            () -> transactionTemplate.execute(status -> {
                List<CampaignTarget> failed = targetRepository
                    .findByCampaignIdAndStatusOrderByCreatedAtAscIdAsc(campaignId, TargetStatus.FAILED);
                List<CampaignTarget> toReset = failed.stream()
                    .filter(target -> selected.isEmpty() || selected.contains(target.getId()))
                    .toList();
                toReset.forEach(targetStateMachine::resetForRetry);
                targetRepository.saveAll(toReset);
                return toReset.size();
            }));
        log.info("Reset {} failed targets of campaign {} to PENDING", reset, campaignId);
        return reset != null ? reset : 0;
    }

    private <T> T access(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to {}: {}", operation, e.getMessage(), e);
            throw new CampaignStoreException("Failed to " + operation, e);
        }
    }
}
