package com.example.quotagate.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.UUID;

/**
 * Parsed envelope of a billing webhook:
 * {@code {"event_id", "event_type", "occurred_at", "data": {...}}}.
 */
public final class WebhookEvent {

    private final String eventId;
    private final String eventType;
    private final Instant occurredAt;
    private final JsonNode data;

    private WebhookEvent(String eventId, String eventType, Instant occurredAt, JsonNode data) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.occurredAt = occurredAt;
        this.data = data;
    }

    /**
     * @throws MalformedWebhookException when the body is not JSON or lacks event_id / event_type
     */
    public static WebhookEvent parse(ObjectMapper mapper, byte[] rawBody) {
        JsonNode root;
        try {
            root = mapper.readTree(rawBody);
        } catch (IOException e) {
            throw new MalformedWebhookException("Webhook body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedWebhookException("Webhook body is not a JSON object", null);
        }

        String eventId = text(root, "event_id");
        String eventType = text(root, "event_type");
        if (eventId == null || eventId.isBlank() || eventType == null || eventType.isBlank()) {
            throw new MalformedWebhookException("Webhook body lacks event_id or event_type", null);
        }

        JsonNode data = root.get("data");
        return new WebhookEvent(
                eventId.trim(),
                eventType.trim(),
                parseInstant(text(root, "occurred_at")),
                data == null || !data.isObject() ? MissingNode.getInstance() : data
        );
    }

    public String eventId() { return eventId; }
    public String eventType() { return eventType; }

    /** When the provider says the event happened; null if absent or unparsable. */
    public Instant occurredAt() { return occurredAt; }

    public JsonNode data() { return data; }

    public String dataText(String... path) {
        return text(data, path);
    }

    public Instant dataInstant(String... path) {
        return parseInstant(text(data, path));
    }

    public Optional<UUID> customAccountId() {
        String v = dataText("custom_data", "account_id");
        if (v == null) v = dataText("custom_data", "accountId");
        if (v == null || v.isBlank()) return Optional.empty();
        try {
            return Optional.of(UUID.fromString(v.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** Price id of the first subscription item, if any. */
    public String firstPriceId() {
        JsonNode items = data.path("items");
        if (!items.isArray() || items.isEmpty()) return null;
        return text(items.get(0), "price", "id");
    }

    public Instant firstItemTrialStart() {
        JsonNode items = data.path("items");
        if (!items.isArray() || items.isEmpty()) return null;
        return parseInstant(text(items.get(0), "trial_dates", "starts_at"));
    }

    public Instant firstItemTrialEnd() {
        JsonNode items = data.path("items");
        if (!items.isArray() || items.isEmpty()) return null;
        return parseInstant(text(items.get(0), "trial_dates", "ends_at"));
    }

    private static String text(JsonNode root, String... path) {
        JsonNode n = root;
        for (String p : path) {
            if (n == null) return null;
            n = n.get(p);
        }
        return (n != null && n.isValueNode() && !n.isNull()) ? n.asText() : null;
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) return null;
        String s = value.trim();
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(s).toInstant();
            } catch (DateTimeParseException e2) {
                return null;
            }
        }
    }
}
