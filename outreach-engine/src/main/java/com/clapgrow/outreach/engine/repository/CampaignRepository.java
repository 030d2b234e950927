package com.clapgrow.outreach.engine.repository;

import com.clapgrow.outreach.engine.entity.Campaign;
import com.clapgrow.outreach.engine.enums.CampaignStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CampaignRepository extends JpaRepository<Campaign, Long> {

    List<Campaign> findBySendingAccountIdOrderByCreatedAtDesc(Long sendingAccountId);

    List<Campaign> findBySendingAccountIdAndStatusOrderByCreatedAtDesc(Long sendingAccountId, CampaignStatus status);

    List<Campaign> findByStatusOrderByCreatedAtDesc(CampaignStatus status);

    List<Campaign> findAllByOrderByCreatedAtDesc();

    /**
     * Status straight from the database, bypassing any entity already loaded in the
     * persistence context. Used by the send loop to observe an external pause.
     */
    @Query("SELECT c.status FROM Campaign c WHERE c.id = :campaignId")
    Optional<CampaignStatus> findStatusById(@Param("campaignId") Long campaignId);

    // Bulk updates skip Hibernate's version check, so each one bumps the version itself

    @Modifying
    @Query("UPDATE Campaign c SET c.messagesSent = c.messagesSent + 1, c.version = c.version + 1 " +
           "WHERE c.id = :campaignId")
    int incrementMessagesSent(@Param("campaignId") Long campaignId);

    @Modifying
    @Query("UPDATE Campaign c SET c.repliesReceived = c.repliesReceived + 1, c.version = c.version + 1 " +
           "WHERE c.id = :campaignId")
    int incrementRepliesReceived(@Param("campaignId") Long campaignId);

    @Modifying
    @Query("UPDATE Campaign c SET c.totalTargets = :totalTargets, c.version = c.version + 1 " +
           "WHERE c.id = :campaignId")
    int updateTotalTargets(@Param("campaignId") Long campaignId, @Param("totalTargets") int totalTargets);
}
