package com.example.quotagate.usage;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface UsageRecordRepository extends JpaRepository<UsageRecord, UUID> {

    @Query("""
        select coalesce(sum(u.costUnits), 0) from UsageRecord u
         where u.accountId = :accountId
           and u.usageType = :usageType
           and u.billingPeriodStart = :start
           and u.billingPeriodEnd = :end
        """)
    long sumCostUnits(
            @Param("accountId") UUID accountId,
            @Param("usageType") UsageType usageType,
            @Param("start") Instant start,
            @Param("end") Instant end
    );

    List<UsageRecord> findByAccountIdAndBillingPeriodStartAndBillingPeriodEndOrderByCreatedAtAsc(
            UUID accountId, Instant billingPeriodStart, Instant billingPeriodEnd);

    @Modifying
    @Query("delete from UsageRecord u where u.billingPeriodEnd < :cutoff")
    int deleteEndedBefore(@Param("cutoff") Instant cutoff);
}
