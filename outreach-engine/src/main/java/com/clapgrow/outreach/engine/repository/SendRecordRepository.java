package com.clapgrow.outreach.engine.repository;

import com.clapgrow.outreach.engine.entity.SendRecord;
import com.clapgrow.outreach.engine.enums.SendRecordStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SendRecordRepository extends JpaRepository<SendRecord, Long> {

    List<SendRecord> findByTargetIdOrderByCreatedAtAsc(Long targetId);

    long countByCampaignId(Long campaignId);

    long countByCampaignIdAndStatus(Long campaignId, SendRecordStatus status);

    @Modifying
    @Query("DELETE FROM SendRecord r WHERE r.campaignId = :campaignId")
    int deleteByCampaignId(@Param("campaignId") Long campaignId);
}
