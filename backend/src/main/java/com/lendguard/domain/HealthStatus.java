package com.lendguard.domain;

/**
 * Severity bucket of a position's health factor, from safest to liquidation-eligible.
 */
public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL,
    LIQUIDATABLE;

    public boolean requiresAlert() {
        return this != HEALTHY;
    }
}
