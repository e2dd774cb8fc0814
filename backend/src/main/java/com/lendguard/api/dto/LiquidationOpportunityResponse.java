package com.lendguard.api.dto;

import com.lendguard.risk.liquidation.LiquidationOpportunity;

import java.math.BigDecimal;

public record LiquidationOpportunityResponse(
        String positionId,
        String userId,
        String poolAddress,
        String collateralAsset,
        String debtAsset,
        BigDecimal collateralAmount,
        BigDecimal debtAmount,
        BigDecimal collateralValueUsd,
        BigDecimal debtValueUsd,
        BigDecimal healthFactor,
        BigDecimal maxDebtToCover,
        BigDecimal collateralToSeize,
        BigDecimal bonusCollateral,
        BigDecimal potentialProfitUsd
) {

    public static LiquidationOpportunityResponse from(LiquidationOpportunity o) {
        return new LiquidationOpportunityResponse(
                o.positionId(), o.userId(), o.poolAddress(), o.collateralAsset(), o.debtAsset(),
                o.collateralAmount(), o.debtAmount(), o.collateralValueUsd(), o.debtValueUsd(),
                o.healthFactor().value(), o.maxDebtToCover(),
                o.seizure().totalCollateral(), o.seizure().bonusCollateral(), o.potentialProfitUsd());
    }
}
