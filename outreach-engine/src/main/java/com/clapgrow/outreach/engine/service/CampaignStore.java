package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.engine.entity.Campaign;
import com.clapgrow.outreach.engine.entity.CampaignTarget;
import com.clapgrow.outreach.engine.entity.SendRecord;
import com.clapgrow.outreach.engine.entity.SendingAccount;
import com.clapgrow.outreach.engine.enums.CampaignStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Persistence port used by the bulk send engine.
 *
 * Implementations translate storage failures into
 * {@link com.clapgrow.outreach.engine.exception.CampaignStoreException}.
 */
public interface CampaignStore {

    /**
     * @throws com.clapgrow.outreach.engine.exception.CampaignNotFoundException if absent
     */
    Campaign getCampaign(Long campaignId);

    /**
     * Current status as committed in storage, never a cached copy.
     */
    CampaignStatus getCampaignStatus(Long campaignId);

    Optional<SendingAccount> getSendingAccount(Long sendingAccountId);

    /**
     * Loads the current campaign, applies {@code change} to it and saves it in one transaction.
     * When a concurrent write to the same campaign wins, the change is applied again to a
     * freshly loaded copy, so it must decide from the campaign it is given, not from an
     * earlier read. Exceptions thrown by {@code change} abort the update and propagate.
     *
     * @return the saved campaign
     * @throws com.clapgrow.outreach.engine.exception.CampaignNotFoundException if absent
     * @throws com.clapgrow.outreach.engine.exception.ConcurrentCampaignUpdateException if
     *         concurrent writes keep winning
     */
    Campaign updateCampaign(Long campaignId, Consumer<Campaign> change);

    /**
     * PENDING, DM-eligible targets in creation order.
     */
    List<CampaignTarget> listPendingTargets(Long campaignId);

    long countPendingTargets(Long campaignId);

    long countTargets(Long campaignId);

    /**
     * Persist a target's new status together with its send record, atomically.
     * A SENT record also bumps the campaign's {@code messagesSent} in the same transaction.
     */
    void commitTargetOutcome(CampaignTarget target, SendRecord sendRecord);

    /**
     * Move FAILED targets back to PENDING.
     *
     * @param targetIds targets to reset; null or empty resets every failed target of the campaign
     * @return number of targets reset
     */
    int resetFailedTargets(Long campaignId, Collection<Long> targetIds);
}
