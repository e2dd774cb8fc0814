package com.lendguard.risk.liquidation;

import com.lendguard.risk.HealthFactor;

import java.math.BigDecimal;

/**
 * A liquidation-eligible position with the largest coverable debt and the seizure it would earn.
 *
 * @param potentialProfitUsd USD value of the bonus collateral at {@code maxDebtToCover}
 */
public record LiquidationOpportunity(
        String positionId,
        String userId,
        String poolAddress,
        String collateralAsset,
        String debtAsset,
        BigDecimal collateralAmount,
        BigDecimal debtAmount,
        BigDecimal collateralValueUsd,
        BigDecimal debtValueUsd,
        HealthFactor healthFactor,
        BigDecimal maxDebtToCover,
        SeizureQuote seizure,
        BigDecimal potentialProfitUsd
) {
}
