package com.example.quotagate.usage;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * One ledger entry. Written once per recorded admission and never updated;
 * removed only by the retention purge.
 */
@Entity
@Table(
    name = "usage_records",
    indexes = {
        @Index(name = "ix_usage_account_type_period", columnList = "account_id, usage_type, billing_period_start"),
        @Index(name = "ix_usage_subscription_period", columnList = "subscription_id, billing_period_start"),
        @Index(name = "ix_usage_period_end", columnList = "billing_period_end")
    }
)
public class UsageRecord {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Column(name = "subscription_id")
    private UUID subscriptionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "usage_type", nullable = false, length = 40)
    private UsageType usageType;

    @Column(name = "endpoint_class", length = 100)
    private String endpointClass;

    @Column(name = "cost_units", nullable = false)
    private long costUnits;

    @Column(name = "billing_period_start", nullable = false)
    private Instant billingPeriodStart;

    @Column(name = "billing_period_end", nullable = false)
    private Instant billingPeriodEnd;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected UsageRecord() {}

    public UsageRecord(
            UUID id,
            UUID accountId,
            UUID subscriptionId,
            UsageType usageType,
            String endpointClass,
            long costUnits,
            Instant billingPeriodStart,
            Instant billingPeriodEnd,
            Instant createdAt
    ) {
        if (costUnits <= 0) {
            throw new IllegalArgumentException("cost units must be positive: " + costUnits);
        }
        this.id = id;
        this.accountId = accountId;
        this.subscriptionId = subscriptionId;
        this.usageType = usageType;
        this.endpointClass = endpointClass;
        this.costUnits = costUnits;
        this.billingPeriodStart = billingPeriodStart;
        this.billingPeriodEnd = billingPeriodEnd;
        this.createdAt = createdAt;
    }

    public UUID getId() { return id; }
    public UUID getAccountId() { return accountId; }
    public UUID getSubscriptionId() { return subscriptionId; }
    public UsageType getUsageType() { return usageType; }
    public String getEndpointClass() { return endpointClass; }
    public long getCostUnits() { return costUnits; }
    public Instant getBillingPeriodStart() { return billingPeriodStart; }
    public Instant getBillingPeriodEnd() { return billingPeriodEnd; }
    public Instant getCreatedAt() { return createdAt; }
}
