package com.lendguard.api.dto;

import com.lendguard.risk.liquidation.LiquidationProposal;

import java.math.BigDecimal;
import java.time.Instant;

public record LiquidationProposalResponse(
        String positionId,
        String poolAddress,
        String collateralAsset,
        String debtAsset,
        BigDecimal debtToCover,
        BigDecimal collateralToSeize,
        BigDecimal bonusCollateral,
        BigDecimal collateralPrice,
        BigDecimal debtPrice,
        BigDecimal healthFactor,
        boolean fullLiquidation,
        Instant proposedAt
) {

    public static LiquidationProposalResponse from(LiquidationProposal p) {
        return new LiquidationProposalResponse(
                p.positionId(), p.poolAddress(), p.collateralAsset(), p.debtAsset(),
                p.debtToCover(), p.collateralToSeize(), p.bonusCollateral(),
                p.collateralPrice(), p.debtPrice(), p.healthFactor().value(),
                p.fullLiquidation(), p.proposedAt());
    }
}
