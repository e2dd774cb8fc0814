package com.lendguard.domain;

/**
 * Lifecycle of a lending position. Only ACTIVE positions are monitored or scanned for liquidation.
 */
public enum PositionStatus {
    ACTIVE,
    LIQUIDATED,
    CLOSED
}
