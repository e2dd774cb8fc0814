package com.lendguard.api.dto;

import com.lendguard.domain.HealthStatus;
import com.lendguard.risk.PositionRiskReport;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * GET /api/v1/risk/positions/{id}. healthFactor is null when the position has no debt (infinite).
 */
public record PositionHealthResponse(
        String positionId,
        String poolAddress,
        String collateralAsset,
        BigDecimal collateralAmount,
        BigDecimal collateralValueUsd,
        String debtAsset,
        BigDecimal debtAmount,
        BigDecimal debtValueUsd,
        BigDecimal healthFactor,
        boolean healthFactorInfinite,
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

    public static PositionHealthResponse from(PositionRiskReport r) {
        return new PositionHealthResponse(
                r.positionId(), r.poolAddress(),
                r.collateralAsset(), r.collateralAmount(), r.collateralValue(),
                r.debtAsset(), r.debtAmount(), r.debtValue(),
                r.healthFactor().value(), r.healthFactor().isInfinite(), r.healthStatus(),
                r.ltv(), r.maxLtv(), r.liquidationThreshold(),
                r.remainingBorrowable(), r.maxWithdrawable(), r.suppliedAssets(),
                r.degradedPrices(), r.evaluatedAt());
    }
}
