package com.lendguard.risk.liquidation;

import java.time.Instant;
import java.util.List;

/**
 * Published after a scheduled scan that found at least one opportunity. Consumed by the external executor.
 */
public record LiquidationOpportunitiesFoundEvent(List<LiquidationOpportunity> opportunities, Instant scannedAt) {
}
