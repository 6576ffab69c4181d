package com.example.quotagate.admission;

import com.example.quotagate.account.AccountNotFoundException;
import com.example.quotagate.webhook.WebhookAuthenticationException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AdmissionDeniedException.class)
    public ResponseEntity<Map<String, Object>> denied(AdmissionDeniedException ex) {
        AdmissionDecision d = ex.decision();
        HttpHeaders headers = new HttpHeaders();
        d.headers().forEach(headers::add);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("reason", d.reason().code());
        body.put("message", ex.getMessage());
        if (d.reason() == DenialReason.BURST_LIMIT) {
            body.put("current", d.burstCurrent());
            body.put("limit", d.burstLimit());
            body.put("retryAfter", d.retryAfterSeconds());
        } else {
            body.put("used", d.used());
            body.put("limit", d.limit());
            body.put("reset", d.periodEnd().toString());
        }
        body.put("ts", Instant.now().toString());
        return new ResponseEntity<>(body, headers, HttpStatus.TOO_MANY_REQUESTS);
    }

    @ExceptionHandler(WebhookAuthenticationException.class)
    public ResponseEntity<Map<String, Object>> unauthorized(WebhookAuthenticationException ex) {
        return error(HttpStatus.UNAUTHORIZED, "invalid_signature", ex.getMessage());
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(AccountNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "account_not_found", ex.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> storeUnavailable(DataAccessException ex) {
        log.error("Usage store unavailable, request denied", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "store_unavailable", "usage ledger unavailable");
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            ConstraintViolationException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, Object>> badRequest(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request",
                ex.getMessage() == null ? "invalid_request" : ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String reason, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("reason", reason);
        body.put("message", message);
        body.put("ts", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
