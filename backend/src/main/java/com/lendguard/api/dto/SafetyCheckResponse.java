package com.lendguard.api.dto;

import com.lendguard.risk.HealthFactor;

import java.math.BigDecimal;

/**
 * Result of a passing borrow or withdraw check. Failing checks return an ErrorBody with status 422.
 */
public record SafetyCheckResponse(String operation, BigDecimal amount, BigDecimal projectedHealthFactor,
                                  boolean projectedHealthFactorInfinite) {

    public static SafetyCheckResponse of(String operation, BigDecimal amount, HealthFactor projected) {
        return new SafetyCheckResponse(operation, amount, projected.value(), projected.isInfinite());
    }
}
