package com.lendguard.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Targeted writes that leave principal amounts untouched.
 */
public interface LendingPositionRepositoryCustom {

    /**
     * Sets healthFactor (null = no debt) and lastHealthCheckAt on one position.
     *
     * @return true if a document matched
     */
    boolean updateHealthFactor(String positionId, BigDecimal healthFactor, Instant checkedAt);
}
