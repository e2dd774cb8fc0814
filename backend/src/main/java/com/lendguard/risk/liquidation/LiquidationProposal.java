package com.lendguard.risk.liquidation;

import com.lendguard.risk.HealthFactor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Amounts an external executor needs to submit one liquidation.
 */
public record LiquidationProposal(
        String positionId,
        String poolAddress,
        String collateralAsset,
        String debtAsset,
        BigDecimal debtToCover,
        BigDecimal collateralToSeize,
        BigDecimal bonusCollateral,
        BigDecimal collateralPrice,
        BigDecimal debtPrice,
        HealthFactor healthFactor,
        boolean fullLiquidation,
        Instant proposedAt
) {
}
