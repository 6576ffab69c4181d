package com.example.quotagate.account;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Subscription lifecycle. INACTIVE is the account status when no subscription exists.
 *
 * TRIALING -> ACTIVE -> {PAST_DUE, PAUSED} -> CANCELLED, with PAST_DUE and PAUSED
 * able to return to ACTIVE. CANCELLED is terminal.
 */
public enum SubscriptionStatus {
    INACTIVE,
    TRIALING,
    ACTIVE,
    PAST_DUE,
    PAUSED,
    CANCELLED;

    /** Statuses under which the subscription's tier, limits and billing period apply. */
    public boolean isEntitled() {
        return this == ACTIVE || this == TRIALING || this == PAST_DUE;
    }

    public boolean isTerminal() {
        return this == CANCELLED;
    }

    public boolean canMoveTo(SubscriptionStatus target) {
        if (this == target) return !isTerminal() || target == CANCELLED;
        return allowedTargets().contains(target);
    }

    private Set<SubscriptionStatus> allowedTargets() {
        return switch (this) {
            case INACTIVE -> EnumSet.of(TRIALING, ACTIVE, CANCELLED);
            case TRIALING -> EnumSet.of(ACTIVE, PAST_DUE, PAUSED, CANCELLED);
            case ACTIVE -> EnumSet.of(PAST_DUE, PAUSED, CANCELLED);
            case PAST_DUE -> EnumSet.of(ACTIVE, PAUSED, CANCELLED);
            case PAUSED -> EnumSet.of(ACTIVE, CANCELLED);
            case CANCELLED -> EnumSet.noneOf(SubscriptionStatus.class);
        };
    }

    /** Maps a provider status string ({@code active}, {@code past_due}, {@code canceled}, ...). */
    public static Optional<SubscriptionStatus> fromExternal(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "trialing", "trial" -> Optional.of(TRIALING);
            case "active" -> Optional.of(ACTIVE);
            case "past_due", "past-due", "unpaid" -> Optional.of(PAST_DUE);
            case "paused" -> Optional.of(PAUSED);
            case "canceled", "cancelled" -> Optional.of(CANCELLED);
            default -> Optional.empty();
        };
    }
}
