package com.clapgrow.outreach.engine.repository;

import com.clapgrow.outreach.engine.entity.CampaignTarget;
import com.clapgrow.outreach.engine.enums.TargetStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public interface CampaignTargetRepository extends JpaRepository<CampaignTarget, Long> {

    /**
     * Targets the send loop may attempt, in creation order.
     */
    @Query("SELECT t FROM CampaignTarget t WHERE t.campaignId = :campaignId " +
           "AND t.status = com.clapgrow.outreach.engine.enums.TargetStatus.PENDING AND t.dmEligible = true " +
           "ORDER BY t.createdAt ASC, t.id ASC")
    List<CampaignTarget> findEligiblePending(@Param("campaignId") Long campaignId);

    @Query("SELECT COUNT(t) FROM CampaignTarget t WHERE t.campaignId = :campaignId " +
           "AND t.status = com.clapgrow.outreach.engine.enums.TargetStatus.PENDING AND t.dmEligible = true")
    long countEligiblePending(@Param("campaignId") Long campaignId);

    long countByCampaignId(Long campaignId);

    List<CampaignTarget> findByCampaignIdOrderByCreatedAtAscIdAsc(Long campaignId);

    List<CampaignTarget> findByCampaignIdAndStatusOrderByCreatedAtAscIdAsc(Long campaignId, TargetStatus status);

    Optional<CampaignTarget> findByIdAndCampaignId(Long id, Long campaignId);

    @Query("SELECT t.username FROM CampaignTarget t WHERE t.campaignId = :campaignId")
    Set<String> findUsernamesByCampaignId(@Param("campaignId") Long campaignId);

    @Query("SELECT t.status, COUNT(t) FROM CampaignTarget t WHERE t.campaignId = :campaignId GROUP BY t.status")
    List<Object[]> countByStatus(@Param("campaignId") Long campaignId);

    @Modifying
    @Query("DELETE FROM CampaignTarget t WHERE t.campaignId = :campaignId")
    int deleteByCampaignId(@Param("campaignId") Long campaignId);
}
