package com.lendguard.common;

/**
 * Error taxonomy of the risk engine. Only ORACLE and INFRASTRUCTURE failures are worth retrying;
 * VALIDATION and SAFETY rejections are final for the given input.
 */
public enum ErrorCategory {
    VALIDATION(false),
    ORACLE(true),
    SAFETY(false),
    INFRASTRUCTURE(true);

    private final boolean retryable;

    ErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
