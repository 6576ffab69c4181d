package com.example.quotagate.webhook;

import com.example.quotagate.account.Account;
import com.example.quotagate.account.AccountNotFoundException;
import com.example.quotagate.account.AccountRepository;
import com.example.quotagate.account.Subscription;
import com.example.quotagate.account.SubscriptionRepository;
import com.example.quotagate.account.SubscriptionStatus;
import com.example.quotagate.billing.Tier;
import com.example.quotagate.billing.TierCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Applies billing events to {@link Subscription} and mirrors the result onto its
 * {@link Account}. Every event type runs in its own transaction; an exception rolls
 * the whole transition back.
 *
 * <p>Events that happened before the last event applied to a subscription are
 * ignored, and period bounds are always replaced with the absolute values from the
 * payload, so redelivered or reordered events cannot move state backwards.
 */
@Service
public class SubscriptionTransitions {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionTransitions.class);

    private final AccountRepository accounts;
    private final SubscriptionRepository subscriptions;
    private final TierCatalog catalog;
    private final Clock clock;
    private final Map<String, Function<WebhookEvent, TransitionResult>> handlers;

    public SubscriptionTransitions(
            AccountRepository accounts,
            SubscriptionRepository subscriptions,
            TierCatalog catalog,
            Clock clock
    ) {
        this.accounts = accounts;
        this.subscriptions = subscriptions;
        this.catalog = catalog;
        this.clock = clock;

        Map<String, Function<WebhookEvent, TransitionResult>> h = new LinkedHashMap<>();
        h.put("subscription.created", this::upsertSubscription);
        h.put("subscription.updated", this::upsertSubscription);
        h.put("subscription.activated", this::upsertSubscription);
        h.put("subscription.canceled", this::cancelSubscription);
        h.put("subscription.cancelled", this::cancelSubscription);
        h.put("subscription.paused", e -> moveSubscription(e, SubscriptionStatus.PAUSED));
        h.put("subscription.resumed", e -> moveSubscription(e, SubscriptionStatus.ACTIVE));
        h.put("subscription.past_due", e -> moveSubscription(e, SubscriptionStatus.PAST_DUE));
        h.put("subscription.trial_ended", this::endTrial);
        h.put("transaction.completed", this::transactionCompleted);
        h.put("transaction.payment_failed", this::paymentFailed);
        h.put("customer.created", this::customerUpserted);
        h.put("customer.updated", this::customerUpserted);
        this.handlers = Collections.unmodifiableMap(h);
    }

    public boolean supports(String eventType) {
        return handlers.containsKey(eventType);
    }

    public Set<String> supportedEventTypes() {
        return handlers.keySet();
    }

    /**
     * @throws IllegalArgumentException for unsupported event types or unusable payloads
     * @throws AccountNotFoundException when no account can be resolved for a new subscription
     * @throws UnknownSubscriptionException when the event refers to a subscription not seen yet
     */
    @Transactional
    public TransitionResult apply(WebhookEvent event) {
        Function<WebhookEvent, TransitionResult> handler = handlers.get(event.eventType());
        if (handler == null) {
            throw new IllegalArgumentException("Unsupported event type " + event.eventType());
        }
        return handler.apply(event);
    }

    // subscription.created / updated / activated

    private TransitionResult upsertSubscription(WebhookEvent event) {
        String subId = requireText(event, "id");
        String customerId = event.dataText("customer_id");
        Instant now = clock.instant();

        Optional<Subscription> existing = subscriptions.findByExternalSubscriptionId(subId);
        if (existing.isPresent() && existing.get().predatesLastEvent(event.occurredAt())) {
            return TransitionResult.ignored("stale event", existing.get().getAccountId(), subId, customerId);
        }

        UUID accountId = existing.map(Subscription::getAccountId)
                .or(event::customAccountId)
                .or(() -> Optional.ofNullable(customerId)
                        .flatMap(accounts::findByExternalCustomerId)
                        .map(Account::getId))
                .orElseThrow(() -> new AccountNotFoundException("subscription " + subId));
        Account account = accounts.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));

        Optional<SubscriptionStatus> reported = SubscriptionStatus.fromExternal(event.dataText("status"));
        if (existing.isPresent() && existing.get().getStatus().isTerminal()
                && reported.filter(s -> s != SubscriptionStatus.CANCELLED).isPresent()) {
            return TransitionResult.ignored("subscription is cancelled", accountId, subId, customerId);
        }

        String priceId = event.firstPriceId();
        Optional<Tier> priced = catalog.tierForPriceId(priceId);
        if (priceId != null && priced.isEmpty()) {
            log.warn("Unknown price id {} on subscription {}; keeping current tier", priceId, subId);
        }

        Subscription sub;
        if (existing.isPresent()) {
            sub = existing.get();
            Tier tier = priced.orElse(sub.getTier());
            if (tier != sub.getTier()) {
                log.info("Subscription {} tier {} -> {}", subId, sub.getTier(), tier);
                sub.assignTier(tier, catalog.limits(tier), catalog.version(), priceId);
            }
        } else {
            Tier tier = priced.orElse(account.getTier());
            sub = new Subscription(UUID.randomUUID(), accountId, subId, customerId,
                    tier, catalog.limits(tier), catalog.version(), now);
            sub.assignTier(tier, catalog.limits(tier), catalog.version(), priceId);
            supersedeOthers(accountId, subId);
        }

        SubscriptionStatus status = reported.orElse(
                sub.getStatus() == SubscriptionStatus.INACTIVE ? SubscriptionStatus.ACTIVE : sub.getStatus());
        if (status != sub.getStatus()) {
            log.info("Subscription {} status {} -> {}", subId, sub.getStatus(), status);
        }
        sub.adoptStatus(status);
        if (status == SubscriptionStatus.CANCELLED) {
            downgradeToFree(sub);
        }

        replacePeriod(sub, event, "current_billing_period");
        Instant nextBilledAt = event.dataInstant("next_billed_at");
        if (nextBilledAt != null) sub.setNextBilledAt(nextBilledAt);
        String currency = event.dataText("currency_code");
        if (currency != null) sub.setCurrency(currency);
        String portal = event.dataText("management_urls", "customer_portal");
        if (portal != null) sub.setCustomerPortalUrl(portal);
        if (customerId != null) sub.setExternalCustomerId(customerId);
        if (status == SubscriptionStatus.TRIALING && event.firstItemTrialEnd() != null) {
            sub.startTrial(event.firstItemTrialStart(), event.firstItemTrialEnd());
        }

        sub.recordEvent(event.occurredAt(), now);
        subscriptions.save(sub);
        linkCustomer(account, customerId, null, now);
        mirror(account, sub, now);

        return TransitionResult.applied(
                (existing.isPresent() ? "updated " : "created ") + sub.getTier() + "/" + sub.getStatus(),
                accountId, subId, customerId);
    }

    // subscription.canceled

    private TransitionResult cancelSubscription(WebhookEvent event) {
        Subscription sub = requireSubscription(event);
        if (sub.predatesLastEvent(event.occurredAt())) {
            return ignored(sub, "stale event");
        }
        if (sub.getStatus() == SubscriptionStatus.CANCELLED) {
            return ignored(sub, "already cancelled");
        }
        Instant now = clock.instant();
        sub.moveTo(SubscriptionStatus.CANCELLED);
        downgradeToFree(sub);
        sub.endTrial();
        sub.setNextBilledAt(null);
        sub.recordEvent(event.occurredAt(), now);
        subscriptions.save(sub);
        mirrorById(sub, now);
        log.info("Subscription {} cancelled; account {} back on FREE", sub.getExternalSubscriptionId(), sub.getAccountId());
        return applied(sub, "cancelled");
    }

    // subscription.paused / resumed / past_due

    private TransitionResult moveSubscription(WebhookEvent event, SubscriptionStatus target) {
        Subscription sub = requireSubscription(event);
        if (sub.predatesLastEvent(event.occurredAt())) {
            return ignored(sub, "stale event");
        }
        SubscriptionStatus from = sub.getStatus();
        if (from == target) {
            return ignored(sub, "already " + target);
        }
        if (!from.canMoveTo(target)) {
            return ignored(sub, from + " -> " + target + " not allowed");
        }
        Instant now = clock.instant();
        sub.moveTo(target);
        if (target == SubscriptionStatus.ACTIVE) {
            replacePeriod(sub, event, "current_billing_period");
        }
        sub.recordEvent(event.occurredAt(), now);
        subscriptions.save(sub);
        mirrorById(sub, now);
        log.info("Subscription {} status {} -> {}", sub.getExternalSubscriptionId(), from, target);
        return applied(sub, from + " -> " + target);
    }

    // subscription.trial_ended

    private TransitionResult endTrial(WebhookEvent event) {
        Subscription sub = requireSubscription(event);
        if (sub.predatesLastEvent(event.occurredAt())) {
            return ignored(sub, "stale event");
        }
        if (sub.getStatus().isTerminal()) {
            return ignored(sub, "subscription is cancelled");
        }
        Instant now = clock.instant();
        sub.endTrial();
        String detail = "trial ended";
        if (sub.getStatus() == SubscriptionStatus.TRIALING) {
            sub.moveTo(SubscriptionStatus.ACTIVE);
            detail = "trial ended, TRIALING -> ACTIVE";
        }
        sub.recordEvent(event.occurredAt(), now);
        subscriptions.save(sub);
        mirrorById(sub, now);
        return applied(sub, detail);
    }

    // transaction.completed

    private TransitionResult transactionCompleted(WebhookEvent event) {
        Optional<Subscription> found = subscriptionForTransaction(event);
        if (found.isEmpty()) {
            return TransitionResult.ignored("no subscription for transaction", null,
                    event.dataText("subscription_id"), event.dataText("customer_id"));
        }
        Subscription sub = found.get();
        if (sub.predatesLastEvent(event.occurredAt())) {
            return ignored(sub, "stale event");
        }
        if (sub.getStatus().isTerminal()) {
            return ignored(sub, "subscription is cancelled");
        }
        Instant now = clock.instant();
        boolean renewed = replacePeriod(sub, event, "billing_period");
        SubscriptionStatus from = sub.getStatus();
        if (from == SubscriptionStatus.PAST_DUE || from == SubscriptionStatus.INACTIVE) {
            sub.moveTo(SubscriptionStatus.ACTIVE);
        }
        if (!renewed && from == sub.getStatus()) {
            return ignored(sub, "payment recorded, no change");
        }
        sub.recordEvent(event.occurredAt(), now);
        subscriptions.save(sub);
        mirrorById(sub, now);
        return applied(sub, renewed ? "period renewed, " + sub.getStatus() : from + " -> " + sub.getStatus());
    }

    // transaction.payment_failed

    private TransitionResult paymentFailed(WebhookEvent event) {
        Optional<Subscription> found = subscriptionForTransaction(event);
        if (found.isEmpty()) {
            return TransitionResult.ignored("no subscription for transaction", null,
                    event.dataText("subscription_id"), event.dataText("customer_id"));
        }
        Subscription sub = found.get();
        if (sub.predatesLastEvent(event.occurredAt())) {
            return ignored(sub, "stale event");
        }
        SubscriptionStatus from = sub.getStatus();
        if (from != SubscriptionStatus.ACTIVE && from != SubscriptionStatus.TRIALING) {
            return ignored(sub, "payment failed while " + from);
        }
        Instant now = clock.instant();
        sub.moveTo(SubscriptionStatus.PAST_DUE);
        sub.recordEvent(event.occurredAt(), now);
        subscriptions.save(sub);
        mirrorById(sub, now);
        log.info("Subscription {} payment failed: {} -> PAST_DUE", sub.getExternalSubscriptionId(), from);
        return applied(sub, from + " -> PAST_DUE");
    }

    // customer.created / updated

    private TransitionResult customerUpserted(WebhookEvent event) {
        String customerId = requireText(event, "id");
        Instant now = clock.instant();

        Optional<Account> account = event.customAccountId().flatMap(accounts::findById)
                .or(() -> accounts.findByExternalCustomerId(customerId));
        if (account.isEmpty()) {
            return TransitionResult.ignored("no account for customer", null, null, customerId);
        }
        Account a = account.get();
        boolean linked = linkCustomer(a, customerId, event.dataText("email"), now);

        String portal = event.dataText("management_urls", "customer_portal");
        if (portal != null) {
            subscriptions.findFirstByExternalCustomerIdAndStatusNotOrderByUpdatedAtDesc(customerId, SubscriptionStatus.CANCELLED)
                    .ifPresent(sub -> {
                        sub.setCustomerPortalUrl(portal);
                        subscriptions.save(sub);
                    });
        }
        if (!linked && portal == null) {
            return TransitionResult.ignored("customer already linked", a.getId(), null, customerId);
        }
        return TransitionResult.applied("customer linked", a.getId(), null, customerId);
    }

    private Subscription requireSubscription(WebhookEvent event) {
        String subId = requireText(event, "id");
        return subscriptions.findByExternalSubscriptionId(subId)
                .orElseThrow(() -> new UnknownSubscriptionException(subId));
    }

    private Optional<Subscription> subscriptionForTransaction(WebhookEvent event) {
        String subId = event.dataText("subscription_id");
        if (subId != null) {
            Optional<Subscription> bySub = subscriptions.findByExternalSubscriptionId(subId);
            if (bySub.isPresent()) return bySub;
        }
        String customerId = event.dataText("customer_id");
        if (customerId == null) return Optional.empty();
        return subscriptions.findFirstByExternalCustomerIdAndStatusNotOrderByUpdatedAtDesc(customerId, SubscriptionStatus.CANCELLED);
    }

    /** New checkout: any other live subscription of the account ends. */
    private void supersedeOthers(UUID accountId, String keepSubId) {
        for (Subscription other : subscriptions.findByAccountIdAndStatusNot(accountId, SubscriptionStatus.CANCELLED)) {
            if (other.getExternalSubscriptionId().equals(keepSubId)) continue;
            log.info("Subscription {} superseded by {}", other.getExternalSubscriptionId(), keepSubId);
            other.moveTo(SubscriptionStatus.CANCELLED);
            downgradeToFree(other);
            subscriptions.save(other);
        }
    }

    private void downgradeToFree(Subscription sub) {
        sub.assignTier(Tier.FREE, catalog.limits(Tier.FREE), catalog.version(), null);
    }

    private boolean replacePeriod(Subscription sub, WebhookEvent event, String field) {
        Instant start = event.dataInstant(field, "starts_at");
        Instant end = event.dataInstant(field, "ends_at");
        if (start == null || end == null) return false;
        sub.replacePeriod(start, end);
        return true;
    }

    private boolean linkCustomer(Account account, String customerId, String email, Instant now) {
        if (customerId == null || customerId.equals(account.getExternalCustomerId())) return false;
        Optional<Account> holder = accounts.findByExternalCustomerId(customerId);
        if (holder.isPresent() && !holder.get().getId().equals(account.getId())) {
            log.warn("Customer {} already linked to account {}; not relinking to {}",
                    customerId, holder.get().getId(), account.getId());
            return false;
        }
        account.linkCustomer(customerId, email, now);
        accounts.save(account);
        return true;
    }

    private void mirrorById(Subscription sub, Instant now) {
        Account account = accounts.findById(sub.getAccountId())
                .orElseThrow(() -> new AccountNotFoundException(sub.getAccountId()));
        mirror(account, sub, now);
    }

    /** Copies tier and status onto the account unless another live subscription is the current one. */
    private void mirror(Account account, Subscription sub, Instant now) {
        Optional<Subscription> current = subscriptions
                .findFirstByAccountIdAndStatusNotOrderByUpdatedAtDesc(account.getId(), SubscriptionStatus.CANCELLED);
        if (current.isPresent() && !current.get().getId().equals(sub.getId())) {
            return;
        }
        account.mirror(sub, now);
        accounts.save(account);
    }

    private static String requireText(WebhookEvent event, String field) {
        String v = event.dataText(field);
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException(event.eventType() + " without data." + field);
        }
        return v;
    }

    private static TransitionResult applied(Subscription sub, String detail) {
        return TransitionResult.applied(detail, sub.getAccountId(), sub.getExternalSubscriptionId(), sub.getExternalCustomerId());
    }

    private static TransitionResult ignored(Subscription sub, String detail) {
        return TransitionResult.ignored(detail, sub.getAccountId(), sub.getExternalSubscriptionId(), sub.getExternalCustomerId());
    }
}
