package com.example.quotagate.webhook;

/** Webhook signature could not be verified; nothing was recorded or applied. */
public class WebhookAuthenticationException extends RuntimeException {

    public WebhookAuthenticationException(String message) {
        super(message);
    }
}
