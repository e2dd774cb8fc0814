package com.lendguard.api.dto;

import com.lendguard.pricing.AggregationMode;
import com.lendguard.pricing.PriceQuote;

import java.math.BigDecimal;
import java.time.Instant;

public record PriceQuoteResponse(
        String asset,
        BigDecimal price,
        Instant lastUpdated,
        int numSources,
        AggregationMode mode,
        boolean cached,
        boolean degraded
) {

    public static PriceQuoteResponse from(PriceQuote q) {
        return new PriceQuoteResponse(q.asset(), q.price(), q.lastUpdated(), q.numSources(), q.mode(),
                q.cached(), q.degraded());
    }
}
