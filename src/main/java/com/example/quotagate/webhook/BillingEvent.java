package com.example.quotagate.webhook;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.UUID;

/** Audit row per external event id. Never deleted. */
@Entity
@Table(
    name = "billing_events",
    uniqueConstraints = @UniqueConstraint(name = "uk_billing_events_event_id", columnNames = "event_id"),
    indexes = {
        @Index(name = "ix_billing_events_account_time", columnList = "account_id, occurred_at"),
        @Index(name = "ix_billing_events_type_time", columnList = "event_type, occurred_at"),
        @Index(name = "ix_billing_events_status", columnList = "status")
    }
)
public class BillingEvent {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false, length = 128)
    private String eventId;

    @Column(name = "event_type", nullable = false, length = 128)
    private String eventType;

    @Column(name = "raw_payload", nullable = false, columnDefinition = "text")
    private String rawPayload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private BillingEventStatus status;

    @Column(name = "error", columnDefinition = "text")
    private String error;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "account_id")
    private UUID accountId;

    @Column(name = "external_subscription_id", length = 100)
    private String externalSubscriptionId;

    @Column(name = "external_customer_id", length = 100)
    private String externalCustomerId;

    @Column(name = "occurred_at")
    private Instant occurredAt;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    protected BillingEvent() {}

    public BillingEvent(UUID id, String eventId, String eventType, String rawPayload, Instant occurredAt, Instant receivedAt) {
        this.id = id;
        this.eventId = eventId;
        this.eventType = eventType;
        this.rawPayload = rawPayload;
        this.occurredAt = occurredAt;
        this.receivedAt = receivedAt;
        this.status = BillingEventStatus.RECEIVED;
    }

    public void complete(BillingEventStatus status, String detail, Instant at) {
        this.status = status;
        this.error = status == BillingEventStatus.FAILED ? detail : null;
        this.processedAt = at;
    }

    public void attach(UUID accountId, String externalSubscriptionId, String externalCustomerId) {
        if (accountId != null) this.accountId = accountId;
        if (externalSubscriptionId != null) this.externalSubscriptionId = externalSubscriptionId;
        if (externalCustomerId != null) this.externalCustomerId = externalCustomerId;
    }

    public void exhaustRetries(int maxRetries) {
        this.retryCount = maxRetries;
    }

    public UUID getId() { return id; }
    public String getEventId() { return eventId; }
    public String getEventType() { return eventType; }
    public String getRawPayload() { return rawPayload; }
    public BillingEventStatus getStatus() { return status; }
    public String getError() { return error; }
    public int getRetryCount() { return retryCount; }
    public UUID getAccountId() { return accountId; }
    public String getExternalSubscriptionId() { return externalSubscriptionId; }
    public String getExternalCustomerId() { return externalCustomerId; }
    public Instant getOccurredAt() { return occurredAt; }
    public Instant getReceivedAt() { return receivedAt; }
    public Instant getProcessedAt() { return processedAt; }
}
