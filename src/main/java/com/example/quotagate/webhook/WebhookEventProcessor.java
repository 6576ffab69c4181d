package com.example.quotagate.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for billing webhooks: verify, deduplicate, apply, audit.
 *
 * Only authentication failures escape as exceptions. Everything else, including
 * failed transitions, comes back as a {@link WebhookOutcome} so the HTTP layer can
 * acknowledge it.
 */
@Service
public class WebhookEventProcessor {

    private static final Logger log = LoggerFactory.getLogger(WebhookEventProcessor.class);

    private final WebhookSignatureVerifier verifier;
    private final BillingEventLog eventLog;
    private final SubscriptionTransitions transitions;
    private final ObjectMapper mapper;
    private final Map<WebhookOutcome.Status, Counter> outcomes = new EnumMap<>(WebhookOutcome.Status.class);
    private final Counter rejected;

    public WebhookEventProcessor(
            WebhookSignatureVerifier verifier,
            BillingEventLog eventLog,
            SubscriptionTransitions transitions,
            ObjectMapper mapper,
            MeterRegistry registry
    ) {
        this.verifier = verifier;
        this.eventLog = eventLog;
        this.transitions = transitions;
        this.mapper = mapper;
        for (WebhookOutcome.Status status : WebhookOutcome.Status.values()) {
            outcomes.put(status, Counter.builder("webhook_events_total")
                    .tag("outcome", status.name().toLowerCase(Locale.ROOT))
                    .register(registry));
        }
        this.rejected = Counter.builder("webhook_events_total")
                .tag("outcome", "rejected")
                .register(registry);
    }

    /**
     * @throws WebhookAuthenticationException when the signature does not match the raw bytes
     */
    public WebhookOutcome receive(byte[] rawBody, String signatureHeader, String timestampHeader) {
        try {
            verifier.verifyOrThrow(rawBody, signatureHeader, timestampHeader);
        } catch (WebhookAuthenticationException e) {
            rejected.increment();
            log.warn("Webhook rejected: {}", e.getMessage());
            throw e;
        }

        String rawText = new String(rawBody, StandardCharsets.UTF_8);
        WebhookEvent event;
        try {
            event = WebhookEvent.parse(mapper, rawBody);
        } catch (MalformedWebhookException e) {
            String eventId = "sha256:" + sha256Hex(rawBody);
            eventLog.recordMalformed(eventId, rawText, e.getMessage());
            log.warn("Malformed webhook recorded as {}: {}", eventId, e.getMessage());
            return count(WebhookOutcome.failed(eventId, "malformed", e.getMessage(), false));
        }

        Optional<BillingEvent> started = eventLog.tryStart(event, rawText);
        if (started.isEmpty()) {
            started = eventLog.claimRetry(event.eventId());
            if (started.isEmpty()) {
                return count(alreadySeen(event));
            }
            log.info("Retrying webhook {} ({}), attempt {}", event.eventId(), event.eventType(),
                    started.get().getRetryCount());
        }
        BillingEvent row = started.get();

        if (!transitions.supports(event.eventType())) {
            TransitionResult unknown = TransitionResult.ignored("unknown event type", null, null, null);
            eventLog.markIgnored(row.getId(), unknown);
            log.warn("Unhandled webhook event type {} ({}), acknowledged", event.eventType(), event.eventId());
            return count(WebhookOutcome.ignored(event.eventId(), event.eventType(), unknown.detail()));
        }

        try {
            TransitionResult result = transitions.apply(event);
            if (result.applied()) {
                eventLog.markProcessed(row.getId(), result);
                log.info("Webhook {} ({}) processed: {}", event.eventId(), event.eventType(), result.detail());
                return count(WebhookOutcome.processed(event.eventId(), event.eventType(), result.detail()));
            }
            eventLog.markIgnored(row.getId(), result);
            log.info("Webhook {} ({}) ignored: {}", event.eventId(), event.eventType(), result.detail());
            return count(WebhookOutcome.ignored(event.eventId(), event.eventType(), result.detail()));
        } catch (RuntimeException e) {
            String error = e.getClass().getSimpleName() + ": " + e.getMessage();
            eventLog.markFailed(row.getId(), error);
            boolean retryable = eventLog.hasRetriesLeft(row.getId());
            log.error("Webhook {} ({}) failed, retryable={}: {}", event.eventId(), event.eventType(), retryable, error);
            return count(WebhookOutcome.failed(event.eventId(), event.eventType(), error, retryable));
        }
    }

    public Iterable<String> supportedEventTypes() {
        return transitions.supportedEventTypes();
    }

    private WebhookOutcome alreadySeen(WebhookEvent event) {
        return eventLog.find(event.eventId())
                .filter(e -> e.getStatus() == BillingEventStatus.FAILED)
                .map(e -> WebhookOutcome.failed(event.eventId(), event.eventType(),
                        "retries exhausted: " + e.getError(), false))
                .orElseGet(() -> {
                    log.debug("Duplicate webhook {} ({})", event.eventId(), event.eventType());
                    return WebhookOutcome.duplicate(event.eventId(), event.eventType());
                });
    }

    private WebhookOutcome count(WebhookOutcome outcome) {
        outcomes.get(outcome.status()).increment();
        return outcome;
    }

    private static String sha256Hex(byte[] raw) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(raw));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
