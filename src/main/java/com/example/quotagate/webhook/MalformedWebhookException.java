package com.example.quotagate.webhook;

/** Verified webhook body that cannot be read as an event. */
public class MalformedWebhookException extends RuntimeException {

    public MalformedWebhookException(String message, Throwable cause) {
        super(message, cause);
    }
}
