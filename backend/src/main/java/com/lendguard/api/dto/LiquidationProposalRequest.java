package com.lendguard.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/risk/liquidations/proposals. debtToCover omitted means full liquidation.
 */
public record LiquidationProposalRequest(
        @NotBlank(message = "INVALID_REQUEST") String positionId,
        String debtToCover
) {
}
