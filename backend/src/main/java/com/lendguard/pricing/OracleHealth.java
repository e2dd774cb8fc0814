package com.lendguard.pricing;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Result of a direct oracle probe. On failure price is null and error carries the error code.
 */
public record OracleHealth(
        boolean healthy,
        String probeAsset,
        BigDecimal price,
        Integer numSources,
        Instant lastUpdated,
        String error,
        String message,
        Instant checkedAt
) {
}
