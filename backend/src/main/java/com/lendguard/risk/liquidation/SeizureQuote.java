package com.lendguard.risk.liquidation;

import java.math.BigDecimal;

/**
 * Collateral seized for a given debt repayment: {@code total = base + bonus} exactly.
 */
public record SeizureQuote(BigDecimal baseCollateral, BigDecimal bonusCollateral, BigDecimal totalCollateral) {
}
