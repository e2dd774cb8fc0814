package com.lendguard.pricing;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * Validated USD price of one asset.
 *
 * @param cached   served from the cache within its TTL
 * @param degraded served from an expired cache entry after both aggregation modes failed
 */
public record PriceQuote(
        String asset,
        BigDecimal price,
        BigInteger rawPrice,
        int decimals,
        Instant lastUpdated,
        int numSources,
        Instant expiration,
        AggregationMode mode,
        boolean cached,
        boolean degraded
) {

    public static PriceQuote from(String asset, OracleResponse response, AggregationMode mode) {
        return new PriceQuote(
                asset,
                new BigDecimal(response.rawPrice(), response.decimals()),
                response.rawPrice(),
                response.decimals(),
                Instant.ofEpochSecond(response.lastUpdated()),
                response.numSources(),
                response.expiration() != null ? Instant.ofEpochSecond(response.expiration()) : null,
                mode,
                false,
                false);
    }

    public PriceQuote asCached() {
        return new PriceQuote(asset, price, rawPrice, decimals, lastUpdated, numSources, expiration, mode, true, false);
    }

    public PriceQuote asDegraded() {
        return new PriceQuote(asset, price, rawPrice, decimals, lastUpdated, numSources, expiration, mode, true, true);
    }
}
