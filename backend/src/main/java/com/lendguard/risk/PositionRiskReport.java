package com.lendguard.risk;

import com.lendguard.domain.HealthStatus;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Point-in-time risk view of one position.
 *
 * @param suppliedAssets collateral redeemable for the position's vToken balance, null when the pool has no vault
 */
public record PositionRiskReport(
        String positionId,
        String poolAddress,
        String collateralAsset,
        BigDecimal collateralAmount,
        BigDecimal collateralValue,
        String debtAsset,
        BigDecimal debtAmount,
        BigDecimal debtValue,
        HealthFactor healthFactor,
        HealthStatus healthStatus,
        BigDecimal ltv,
        BigDecimal maxLtv,
        BigDecimal liquidationThreshold,
        BigDecimal remainingBorrowable,
        BigDecimal maxWithdrawable,
        BigDecimal suppliedAssets,
        boolean degradedPrices,
        Instant evaluatedAt
) {
}
