package com.example.quotagate.webhook;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Billing provider webhook ingress.
 *
 * <pre>
 *  curl -i -X POST http://localhost:8080/api/webhooks/paddle \
 *       -H "Paddle-Signature: ts=1700000000,h1=..." --data-binary @event.json
 * </pre>
 *
 * 401 on a bad signature, 200 for everything else so the sender stops redelivering.
 * With {@code admission.webhook.redeliver-on-failure} a failed event with retries
 * left is answered with 503 instead.
 */
@RestController
@RequestMapping("/api/webhooks/paddle")
public class WebhookController {

    private final WebhookEventProcessor processor;
    private final WebhookProperties props;

    public WebhookController(WebhookEventProcessor processor, WebhookProperties props) {
        this.processor = processor;
        this.props = props;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> receive(
            @RequestBody byte[] rawBody,
            @RequestHeader(value = "Paddle-Signature", required = false) String signature,
            @RequestHeader(value = "Paddle-Timestamp", required = false) String timestamp
    ) {
        WebhookOutcome outcome = processor.receive(rawBody, signature, timestamp);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", outcome.status().name().toLowerCase(Locale.ROOT));
        body.put("eventId", outcome.eventId());
        body.put("eventType", outcome.eventType());
        body.put("detail", outcome.detail());

        if (!outcome.successful() && outcome.retryable() && props.isRedeliverOnFailure()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        return ResponseEntity.ok(body);
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        List<String> types = new ArrayList<>();
        processor.supportedEventTypes().forEach(types::add);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("secretConfigured", props.hasSecret());
        body.put("supportedEvents", types);
        return body;
    }
}
