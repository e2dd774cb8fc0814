package com.lendguard.common;

/**
 * Stable error codes surfaced by the engine and the ops API.
 */
public enum ErrorCode {

    INVALID_AMOUNT(ErrorCategory.VALIDATION),
    INVALID_ADDRESS(ErrorCategory.VALIDATION),
    UNSUPPORTED_ASSET(ErrorCategory.VALIDATION),
    POOL_NOT_FOUND(ErrorCategory.VALIDATION),
    POOL_NOT_ACTIVE(ErrorCategory.VALIDATION),
    POSITION_NOT_FOUND(ErrorCategory.VALIDATION),
    INVALID_TRANSACTION_HASH(ErrorCategory.VALIDATION),

    ZERO_PRICE(ErrorCategory.ORACLE),
    STALE_PRICE(ErrorCategory.ORACLE),
    INSUFFICIENT_SOURCES(ErrorCategory.ORACLE),
    NETWORK_TIMEOUT(ErrorCategory.ORACLE),
    ORACLE_UNAVAILABLE(ErrorCategory.ORACLE),
    MISSING_PRICE(ErrorCategory.ORACLE),
    CHAIN_READ_FAILED(ErrorCategory.ORACLE),

    LTV_EXCEEDED(ErrorCategory.SAFETY),
    INSUFFICIENT_LIQUIDITY(ErrorCategory.SAFETY),
    INSUFFICIENT_COLLATERAL(ErrorCategory.SAFETY),
    HEALTH_FACTOR_BELOW_ONE(ErrorCategory.SAFETY),
    DEBT_TO_COVER_EXCEEDS_DEBT(ErrorCategory.SAFETY),
    POSITION_NOT_LIQUIDATABLE(ErrorCategory.SAFETY),

    PERSISTENCE_FAILED(ErrorCategory.INFRASTRUCTURE);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isRetryable() {
        return category.isRetryable();
    }
}
