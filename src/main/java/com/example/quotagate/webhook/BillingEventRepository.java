package com.example.quotagate.webhook;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

public interface BillingEventRepository extends JpaRepository<BillingEvent, UUID> {

    Optional<BillingEvent> findByEventId(String eventId);

    long countByEventIdAndStatus(String eventId, BillingEventStatus status);

    /**
     * Moves a FAILED row with retries left back to RECEIVED. Only one concurrent
     * redelivery gets a row count of 1.
     */
    @Transactional
    @Modifying
    @Query("""
        update BillingEvent e
           set e.status = :received, e.retryCount = e.retryCount + 1
         where e.eventId = :eventId
           and e.status = :failed
           and e.retryCount < :maxRetries
        """)
    int claimRetry(
            @Param("eventId") String eventId,
            @Param("maxRetries") int maxRetries,
            @Param("failed") BillingEventStatus failed,
            @Param("received") BillingEventStatus received
    );
}
