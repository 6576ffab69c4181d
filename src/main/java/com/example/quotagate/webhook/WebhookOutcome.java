package com.example.quotagate.webhook;

/**
 * Result of one webhook delivery.
 *
 * @param retryable only for FAILED: another delivery of this event would be processed again
 */
public record WebhookOutcome(Status status, String eventId, String eventType, String detail, boolean retryable) {

    public enum Status {
        PROCESSED,
        /** Accepted without state change (unknown type, stale, redundant). */
        IGNORED,
        /** Event id already handled or in progress. */
        DUPLICATE,
        FAILED
    }

    public static WebhookOutcome processed(String eventId, String eventType, String detail) {
        return new WebhookOutcome(Status.PROCESSED, eventId, eventType, detail, false);
    }

    public static WebhookOutcome ignored(String eventId, String eventType, String detail) {
        return new WebhookOutcome(Status.IGNORED, eventId, eventType, detail, false);
    }

    public static WebhookOutcome duplicate(String eventId, String eventType) {
        return new WebhookOutcome(Status.DUPLICATE, eventId, eventType, "already processed", false);
    }

    public static WebhookOutcome failed(String eventId, String eventType, String detail, boolean retryable) {
        return new WebhookOutcome(Status.FAILED, eventId, eventType, detail, retryable);
    }

    public boolean successful() {
        return status != Status.FAILED;
    }
}
