package com.lendguard.domain;

/**
 * Delivery priority of a position alert.
 */
public enum AlertPriority {
    MEDIUM,
    CRITICAL
}
