package com.lendguard.api.dto;

import java.time.Instant;
import java.util.Map;

/**
 * Standard error response body: error (code), message, retryable, optional details, timestamp (ISO 8601).
 * retryable separates "rejected" (validation, safety) from "temporarily unavailable" (oracle, infrastructure).
 */
public record ErrorBody(String error, String message, boolean retryable, Map<String, Object> details, Instant timestamp) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, false, Map.of(), Instant.now());
    }

    public static ErrorBody of(String error, String message, boolean retryable, Map<String, Object> details) {
        return new ErrorBody(error, message, retryable, details, Instant.now());
    }
}
