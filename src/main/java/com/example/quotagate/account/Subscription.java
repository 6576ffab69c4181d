package com.example.quotagate.account;

import com.example.quotagate.billing.QuotaLimits;
import com.example.quotagate.billing.Tier;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.UUID;

/**
 * Paid plan of an account, kept in sync from billing webhooks. Cancelled rows are
 * kept for their historical billing periods; a new checkout creates a new row.
 */
@Entity
@Table(
    name = "subscriptions",
    uniqueConstraints = @UniqueConstraint(name = "uk_subscriptions_external", columnNames = "external_subscription_id"),
    indexes = {
        @Index(name = "ix_subscriptions_account", columnList = "account_id"),
        @Index(name = "ix_subscriptions_customer", columnList = "external_customer_id"),
        @Index(name = "ix_subscriptions_status", columnList = "status")
    }
)
public class Subscription {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Column(name = "external_subscription_id", nullable = false, length = 100)
    private String externalSubscriptionId;

    @Column(name = "external_customer_id", length = 100)
    private String externalCustomerId;

    @Column(name = "external_price_id", length = 100)
    private String externalPriceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "tier", nullable = false, length = 30)
    private Tier tier;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private SubscriptionStatus status;

    @Column(name = "current_period_start")
    private Instant currentPeriodStart;

    @Column(name = "current_period_end")
    private Instant currentPeriodEnd;

    @Column(name = "next_billed_at")
    private Instant nextBilledAt;

    @Column(name = "trial_start")
    private Instant trialStart;

    @Column(name = "trial_end")
    private Instant trialEnd;

    @Embedded
    private QuotaLimits limits;

    @Column(name = "limits_version", length = 50)
    private String limitsVersion;

    @Column(name = "currency", length = 3)
    private String currency;

    @Column(name = "customer_portal_url", length = 500)
    private String customerPortalUrl;

    /** occurred_at of the newest event applied; older events are ignored. */
    @Column(name = "last_event_at")
    private Instant lastEventAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Subscription() {}

    public Subscription(
            UUID id,
            UUID accountId,
            String externalSubscriptionId,
            String externalCustomerId,
            Tier tier,
            QuotaLimits limits,
            String limitsVersion,
            Instant createdAt
    ) {
        this.id = id;
        this.accountId = accountId;
        this.externalSubscriptionId = externalSubscriptionId;
        this.externalCustomerId = externalCustomerId;
        this.tier = tier;
        this.status = SubscriptionStatus.INACTIVE;
        this.limits = limits;
        this.limitsVersion = limitsVersion;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    /** True when an event that happened at {@code occurredAt} predates one already applied. */
    public boolean predatesLastEvent(Instant occurredAt) {
        return occurredAt != null && lastEventAt != null && occurredAt.isBefore(lastEventAt);
    }

    public void recordEvent(Instant occurredAt, Instant at) {
        if (occurredAt != null && (lastEventAt == null || occurredAt.isAfter(lastEventAt))) {
            this.lastEventAt = occurredAt;
        }
        this.updatedAt = at;
    }

    /** Replaces tier and limits snapshot. */
    public void assignTier(Tier tier, QuotaLimits limits, String limitsVersion, String priceId) {
        this.tier = tier;
        this.limits = limits;
        this.limitsVersion = limitsVersion;
        if (priceId != null) this.externalPriceId = priceId;
    }

    /** Replaces both bounds; callers pass bounds straight from the event. */
    public void replacePeriod(Instant start, Instant end) {
        if (start == null || end == null) return;
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("billing period end " + end + " is not after start " + start);
        }
        this.currentPeriodStart = start;
        this.currentPeriodEnd = end;
    }

    public void moveTo(SubscriptionStatus target) {
        if (!status.canMoveTo(target)) {
            throw new IllegalStateException("Subscription " + externalSubscriptionId + " cannot move from " + status + " to " + target);
        }
        this.status = target;
    }

    /**
     * Takes the status reported by the provider as-is. Only leaving CANCELLED is refused.
     */
    public void adoptStatus(SubscriptionStatus target) {
        if (status.isTerminal() && target != status) {
            throw new IllegalStateException("Subscription " + externalSubscriptionId + " is cancelled");
        }
        this.status = target;
    }

    public void startTrial(Instant start, Instant end) {
        this.trialStart = start;
        this.trialEnd = end;
    }

    public void endTrial() {
        this.trialStart = null;
        this.trialEnd = null;
    }

    public void setNextBilledAt(Instant nextBilledAt) { this.nextBilledAt = nextBilledAt; }
    public void setCurrency(String currency) { this.currency = currency; }
    public void setCustomerPortalUrl(String customerPortalUrl) { this.customerPortalUrl = customerPortalUrl; }
    public void setExternalCustomerId(String externalCustomerId) { this.externalCustomerId = externalCustomerId; }

    public UUID getId() { return id; }
    public UUID getAccountId() { return accountId; }
    public String getExternalSubscriptionId() { return externalSubscriptionId; }
    public String getExternalCustomerId() { return externalCustomerId; }
    public String getExternalPriceId() { return externalPriceId; }
    public Tier getTier() { return tier; }
    public SubscriptionStatus getStatus() { return status; }
    public Instant getCurrentPeriodStart() { return currentPeriodStart; }
    public Instant getCurrentPeriodEnd() { return currentPeriodEnd; }
    public Instant getNextBilledAt() { return nextBilledAt; }
    public Instant getTrialStart() { return trialStart; }
    public Instant getTrialEnd() { return trialEnd; }
    public QuotaLimits getLimits() { return limits; }
    public String getLimitsVersion() { return limitsVersion; }
    public String getCurrency() { return currency; }
    public String getCustomerPortalUrl() { return customerPortalUrl; }
    public Instant getLastEventAt() { return lastEventAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
