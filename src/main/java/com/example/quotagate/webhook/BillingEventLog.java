package com.example.quotagate.webhook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency layer backed by the unique constraint on {@code billing_events.event_id}.
 * If the event already exists {@link #tryStart} returns empty and the caller must not
 * process it again, unless {@link #claimRetry} hands the failed row back.
 */
@Service
public class BillingEventLog {

    private static final Logger log = LoggerFactory.getLogger(BillingEventLog.class);

    private final BillingEventRepository events;
    private final WebhookProperties props;
    private final Clock clock;

    public BillingEventLog(BillingEventRepository events, WebhookProperties props, Clock clock) {
        this.events = events;
        this.props = props;
        this.clock = clock;
    }

    public Optional<BillingEvent> tryStart(WebhookEvent event, String rawPayload) {
        BillingEvent row = new BillingEvent(
                UUID.randomUUID(), event.eventId(), event.eventType(), rawPayload, event.occurredAt(), clock.instant());
        try {
            return Optional.of(events.saveAndFlush(row));
        } catch (DataIntegrityViolationException dup) {
            return Optional.empty();
        } catch (RuntimeException ex) {
            // some drivers surface the unique violation as another exception type
            if (events.findByEventId(event.eventId()).isPresent()) {
                return Optional.empty();
            }
            throw ex;
        }
    }

    /** Hands a FAILED row with retries left back to the caller, at most once per redelivery. */
    public Optional<BillingEvent> claimRetry(String eventId) {
        int claimed = events.claimRetry(
                eventId, props.getMaxRetries(), BillingEventStatus.FAILED, BillingEventStatus.RECEIVED);
        return claimed == 1 ? events.findByEventId(eventId) : Optional.empty();
    }

    public Optional<BillingEvent> find(String eventId) {
        return events.findByEventId(eventId);
    }

    public void markProcessed(UUID rowId, TransitionResult result) {
        complete(rowId, BillingEventStatus.PROCESSED, result.detail(), result);
    }

    public void markIgnored(UUID rowId, TransitionResult result) {
        complete(rowId, BillingEventStatus.IGNORED, result.detail(), result);
    }

    public void markFailed(UUID rowId, String error) {
        complete(rowId, BillingEventStatus.FAILED, error, null);
    }

    /** True while the row can still be claimed by a redelivery. */
    public boolean hasRetriesLeft(UUID rowId) {
        return events.findById(rowId)
                .map(e -> e.getStatus() == BillingEventStatus.FAILED && e.getRetryCount() < props.getMaxRetries())
                .orElse(false);
    }

    /**
     * Stores a verified body that could not be parsed. The row is keyed by a content
     * hash and never retried; resending the same bytes fails the same way.
     */
    public void recordMalformed(String eventId, String rawPayload, String error) {
        BillingEvent row = new BillingEvent(UUID.randomUUID(), eventId, "malformed", rawPayload, null, clock.instant());
        row.complete(BillingEventStatus.FAILED, error, clock.instant());
        row.exhaustRetries(props.getMaxRetries());
        try {
            events.saveAndFlush(row);
        } catch (DataIntegrityViolationException dup) {
            log.debug("Malformed webhook {} already recorded", eventId);
        }
    }

    private void complete(UUID rowId, BillingEventStatus status, String detail, TransitionResult result) {
        BillingEvent e = events.findById(rowId).orElse(null);
        if (e == null) return;
        e.complete(status, detail, clock.instant());
        if (result != null) {
            e.attach(result.accountId(), result.externalSubscriptionId(), result.externalCustomerId());
        }
        events.save(e);
    }
}
