package com.example.quotagate.webhook;

import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * Verifies {@code Paddle-Signature: ts=<unix>,h1=<hex>} headers.
 *
 * The signed content is {@code <timestamp> + "." + <raw body bytes>}, HMAC-SHA256
 * with the shared secret, hex encoded. Several h1 values are accepted (secret
 * rotation); any match passes. Comparison is constant-time.
 */
@Component
public class WebhookSignatureVerifier {

    private static final String HMAC = "HmacSHA256";

    private final WebhookProperties props;
    private final Clock clock;

    public WebhookSignatureVerifier(WebhookProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    /**
     * @param timestampHeader separate timestamp header; when blank the {@code ts} part of the signature is used
     * @throws WebhookAuthenticationException on any mismatch or missing part
     */
    public void verifyOrThrow(byte[] rawBody, String signatureHeader, String timestampHeader) {
        if (!props.hasSecret()) {
            throw new WebhookAuthenticationException("Webhook secret is not configured");
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new WebhookAuthenticationException("Missing signature header");
        }
        if (rawBody == null || rawBody.length == 0) {
            throw new WebhookAuthenticationException("Empty webhook body");
        }

        String signedTs = null;
        List<String> signatures = new ArrayList<>();
        for (String part : signatureHeader.split("[,;]")) {
            int eq = part.indexOf('=');
            if (eq <= 0) continue;
            String key = part.substring(0, eq).trim();
            String value = part.substring(eq + 1).trim();
            if ("ts".equals(key)) signedTs = value;
            else if ("h1".equals(key) && !value.isEmpty()) signatures.add(value.toLowerCase(Locale.ROOT));
        }

        String timestamp = timestampHeader != null && !timestampHeader.isBlank() ? timestampHeader.trim() : signedTs;
        if (timestamp == null || timestamp.isEmpty()) {
            throw new WebhookAuthenticationException("Missing signature timestamp");
        }
        if (signedTs != null && !signedTs.equals(timestamp)) {
            throw new WebhookAuthenticationException("Timestamp header does not match signed timestamp");
        }
        if (signatures.isEmpty()) {
            throw new WebhookAuthenticationException("No h1 signature in header");
        }
        checkTolerance(timestamp);

        byte[] expected = hmacSha256Hex(props.getSecret(), timestamp, rawBody).getBytes(StandardCharsets.US_ASCII);
        boolean matched = false;
        for (String candidate : signatures) {
            // no early exit, every candidate is compared
            matched |= MessageDigest.isEqual(expected, candidate.getBytes(StandardCharsets.US_ASCII));
        }
        if (!matched) {
            throw new WebhookAuthenticationException("Invalid webhook signature");
        }
    }

    /** Signature header value for {@code rawBody}; used by tests and local tooling. */
    public static String sign(String secret, String timestamp, byte[] rawBody) {
        return "ts=" + timestamp + ",h1=" + hmacSha256Hex(secret, timestamp, rawBody);
    }

    private void checkTolerance(String timestamp) {
        Duration tolerance = props.getTolerance();
        if (tolerance == null || tolerance.isZero() || tolerance.isNegative()) return;

        long epochSeconds;
        try {
            epochSeconds = Long.parseLong(timestamp);
        } catch (NumberFormatException e) {
            throw new WebhookAuthenticationException("Signature timestamp is not a unix time");
        }
        Duration age = Duration.between(Instant.ofEpochSecond(epochSeconds), clock.instant()).abs();
        if (age.compareTo(tolerance) > 0) {
            throw new WebhookAuthenticationException("Signature timestamp outside tolerance");
        }
    }

    private static String hmacSha256Hex(String secret, String timestamp, byte[] rawBody) {
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC));
            mac.update(timestamp.getBytes(StandardCharsets.UTF_8));
            mac.update((byte) '.');
            return HexFormat.of().formatHex(mac.doFinal(rawBody));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC calculation failed", e);
        }
    }
}
