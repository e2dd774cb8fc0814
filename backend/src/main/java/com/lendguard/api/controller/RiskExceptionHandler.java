package com.lendguard.api.controller;

import com.lendguard.api.dto.ErrorBody;
import com.lendguard.common.ErrorCode;
import com.lendguard.common.RiskEngineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Map;
import java.util.Optional;

/**
 * Maps engine errors to HTTP: VALIDATION 400 (404 for unknown position or pool), SAFETY 422,
 * ORACLE and INFRASTRUCTURE 503. Bean validation failures (@Valid) map to 400.
 */
@RestControllerAdvice
@Slf4j
public class RiskExceptionHandler {

    @ExceptionHandler(RiskEngineException.class)
    public ResponseEntity<ErrorBody> handleEngine(RiskEngineException ex) {
        HttpStatus status = statusFor(ex.getCode());
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(status)
                .body(ErrorBody.of(ex.getCode().name(), ex.getMessage(), ex.isRetryable(), ex.getDetails()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + " is required")
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message, false, Map.of()));
    }

    static HttpStatus statusFor(ErrorCode code) {
        if (code == ErrorCode.POSITION_NOT_FOUND || code == ErrorCode.POOL_NOT_FOUND) {
            return HttpStatus.NOT_FOUND;
        }
        return switch (code.getCategory()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case SAFETY -> HttpStatus.UNPROCESSABLE_ENTITY;
            case ORACLE, INFRASTRUCTURE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
