package com.example.quotagate.account;

import com.example.quotagate.billing.Tier;
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

/**
 * A tenant. Tier and status are only changed from billing webhooks and mirror the
 * account's current subscription.
 */
@Entity
@Table(
    name = "accounts",
    uniqueConstraints = @UniqueConstraint(name = "uk_accounts_external_customer", columnNames = "external_customer_id"),
    indexes = @Index(name = "ix_accounts_tier_status", columnList = "tier, subscription_status")
)
public class Account {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "email", length = 320)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(name = "tier", nullable = false, length = 30)
    private Tier tier;

    @Enumerated(EnumType.STRING)
    @Column(name = "subscription_status", nullable = false, length = 30)
    private SubscriptionStatus subscriptionStatus;

    @Column(name = "external_customer_id", length = 100)
    private String externalCustomerId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Account() {}

    public Account(UUID id, String email, Tier tier, Instant createdAt) {
        this.id = id;
        this.email = email;
        this.tier = tier;
        this.subscriptionStatus = SubscriptionStatus.INACTIVE;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public static Account free(UUID id, String email, Instant createdAt) {
        return new Account(id, email, Tier.FREE, createdAt);
    }

    /** Copies tier and status from the subscription; a non-entitled subscription leaves the account on FREE. */
    public void mirror(Subscription subscription, Instant at) {
        this.subscriptionStatus = subscription.getStatus();
        this.tier = subscription.getStatus().isEntitled() ? subscription.getTier() : Tier.FREE;
        this.updatedAt = at;
    }

    public void linkCustomer(String externalCustomerId, String email, Instant at) {
        this.externalCustomerId = externalCustomerId;
        if (email != null && !email.isBlank()) this.email = email;
        this.updatedAt = at;
    }

    public UUID getId() { return id; }
    public String getEmail() { return email; }
    public Tier getTier() { return tier; }
    public SubscriptionStatus getSubscriptionStatus() { return subscriptionStatus; }
    public String getExternalCustomerId() { return externalCustomerId; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
