package com.lendguard.common;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown by the risk engine for every classified failure. The {@link ErrorCode} decides whether the caller
 * may retry (oracle, infrastructure) or must treat the rejection as final (validation, safety).
 */
public class RiskEngineException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> details;

    public RiskEngineException(ErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    public RiskEngineException(ErrorCode code, String message, Throwable cause) {
        this(code, message, Map.of(), cause);
    }

    public RiskEngineException(ErrorCode code, String message, Map<String, ?> details) {
        this(code, message, details, null);
    }

    public RiskEngineException(ErrorCode code, String message, Map<String, ?> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
