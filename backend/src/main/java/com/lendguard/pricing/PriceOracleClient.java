package com.lendguard.pricing;

import com.lendguard.common.ErrorCode;
import com.lendguard.common.RiskEngineException;
import com.lendguard.pricing.config.OracleProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fetches and validates USD prices. Resolution order per asset:
 * fresh cache → MEDIAN → MEAN → retained (degraded) cache entry → most specific error.
 * Unsupported assets fail immediately with UNSUPPORTED_ASSET.
 */
@Slf4j
public class PriceOracleClient {

    private final OracleReader oracleReader;
    private final OracleProperties properties;
    private final PriceCache cache;
    private final Clock clock;
    private final Executor executor;

    public PriceOracleClient(OracleReader oracleReader, OracleProperties properties, PriceCache cache,
                             Clock clock, Executor executor) {
        this.oracleReader = oracleReader;
        this.properties = properties;
        this.cache = cache;
        this.clock = clock;
        this.executor = executor;
    }

    public PriceQuote getPrice(String asset) {
        return getPrice(asset, false);
    }

    public PriceQuote getPrice(String asset, boolean bypassCache) {
        String symbol = normalize(asset);
        String assetId = requireAssetId(symbol);

        if (!bypassCache) {
            Optional<PriceQuote> fresh = cache.fresh(symbol);
            if (fresh.isPresent()) {
                log.debug("Price cache hit for {}", symbol);
                return fresh.get().asCached();
            }
        }

        RiskEngineException medianError;
        try {
            return fetchAndCache(symbol, assetId, AggregationMode.MEDIAN);
        } catch (RiskEngineException e) {
            medianError = e;
            log.warn("MEDIAN price for {} rejected ({}), retrying with MEAN", symbol, e.getCode());
        }

        RiskEngineException meanError;
        try {
            return fetchAndCache(symbol, assetId, AggregationMode.MEAN);
        } catch (RiskEngineException e) {
            meanError = e;
            log.warn("MEAN price for {} rejected ({})", symbol, e.getCode());
        }

        Optional<PriceQuote> retained = cache.retained(symbol);
        if (retained.isPresent()) {
            log.warn("Serving degraded cached price for {} (last updated {})", symbol, retained.get().lastUpdated());
            return retained.get().asDegraded();
        }

        RiskEngineException chosen = mostSpecific(medianError, meanError);
        RiskEngineException other = chosen == medianError ? meanError : medianError;
        if (other != chosen) {
            chosen.addSuppressed(other);
        }
        throw chosen;
    }

    /**
     * Fetches every asset independently on the oracle executor. A failing asset lands in the error map and
     * never fails the batch.
     */
    public PriceBatchResult getPrices(Collection<String> assets) {
        Set<String> symbols = new LinkedHashSet<>();
        for (String asset : assets) {
            if (asset != null && !asset.isBlank()) {
                symbols.add(normalize(asset));
            }
        }
        Map<String, CompletableFuture<PriceQuote>> futures = new LinkedHashMap<>();
        Map<String, RiskEngineException> errors = new LinkedHashMap<>();
        for (String symbol : symbols) {
            try {
                futures.put(symbol, CompletableFuture.supplyAsync(() -> getPrice(symbol), executor));
            } catch (RejectedExecutionException e) {
                errors.put(symbol, new RiskEngineException(ErrorCode.ORACLE_UNAVAILABLE,
                        "Oracle executor saturated; price fetch for " + symbol + " rejected",
                        Map.of("asset", symbol), e));
            }
        }
        Map<String, PriceQuote> quotes = new LinkedHashMap<>();
        futures.forEach((symbol, future) -> {
            try {
                quotes.put(symbol, future.join());
            } catch (CompletionException e) {
                errors.put(symbol, asEngineException(e.getCause() != null ? e.getCause() : e));
            }
        });
        if (!errors.isEmpty()) {
            log.warn("Batch price fetch: {} resolved, {} failed {}", quotes.size(), errors.size(), errors.keySet());
        }
        return new PriceBatchResult(quotes, errors);
    }

    /**
     * Queries the oracle directly (MEDIAN, no cache, one source suffices) and reports the outcome.
     */
    public OracleHealth healthCheck(String probeAsset) {
        String symbol = normalize(probeAsset != null ? probeAsset : properties.getHealthProbeAsset());
        Instant now = clock.instant();
        try {
            String assetId = requireAssetId(symbol);
            OracleResponse response = oracleReader.query(assetId, AggregationMode.MEDIAN);
            PriceQuote quote = validate(symbol, response, AggregationMode.MEDIAN, 1);
            return new OracleHealth(true, symbol, quote.price(), quote.numSources(), quote.lastUpdated(),
                    null, null, now);
        } catch (RiskEngineException e) {
            log.warn("Oracle health check failed for {}: {}", symbol, e.getMessage());
            return new OracleHealth(false, symbol, null, null, null, e.getCode().name(), e.getMessage(), now);
        } catch (RuntimeException e) {
            log.warn("Oracle health check failed for {}", symbol, e);
            return new OracleHealth(false, symbol, null, null, null, ErrorCode.ORACLE_UNAVAILABLE.name(),
                    e.getMessage(), now);
        }
    }

    public void clearCache() {
        cache.clear();
        log.info("Price cache cleared");
    }

    public boolean isSupported(String asset) {
        return asset != null && properties.getAssetIdentifiers().containsKey(normalize(asset));
    }

    private PriceQuote fetchAndCache(String symbol, String assetId, AggregationMode mode) {
        OracleResponse response;
        try {
            response = oracleReader.query(assetId, mode);
        } catch (RiskEngineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RiskEngineException(ErrorCode.ORACLE_UNAVAILABLE,
                    "Oracle query failed for " + symbol + ": " + e.getMessage(),
                    Map.of("asset", symbol, "mode", mode.name()), e);
        }
        PriceQuote quote = validate(symbol, response, mode, properties.getMinSources());
        cache.put(symbol, quote);
        return quote;
    }

    PriceQuote validate(String symbol, OracleResponse response, AggregationMode mode, int minSources) {
        if (response == null) {
            throw new RiskEngineException(ErrorCode.ORACLE_UNAVAILABLE, "Empty oracle response for " + symbol,
                    Map.of("asset", symbol, "mode", mode.name()));
        }
        if (response.rawPrice() == null || response.rawPrice().signum() <= 0) {
            throw new RiskEngineException(ErrorCode.ZERO_PRICE, "Oracle returned zero price for " + symbol,
                    Map.of("asset", symbol, "mode", mode.name()));
        }
        long now = clock.instant().getEpochSecond();
        long age = now - response.lastUpdated();
        if (age > properties.getStalenessToleranceSeconds()) {
            throw new RiskEngineException(ErrorCode.STALE_PRICE,
                    "Price for " + symbol + " is stale (" + age + "s old)",
                    Map.of("asset", symbol, "ageSeconds", age,
                            "toleranceSeconds", properties.getStalenessToleranceSeconds()));
        }
        if (response.expiration() != null && response.expiration() > 0 && now > response.expiration()) {
            throw new RiskEngineException(ErrorCode.STALE_PRICE, "Price for " + symbol + " is past its expiration",
                    Map.of("asset", symbol, "expiration", response.expiration()));
        }
        if (response.numSources() < minSources) {
            throw new RiskEngineException(ErrorCode.INSUFFICIENT_SOURCES,
                    "Only " + response.numSources() + " sources for " + symbol + ", need " + minSources,
                    Map.of("asset", symbol, "numSources", response.numSources(), "minSources", minSources));
        }
        return PriceQuote.from(symbol, response, mode);
    }

    private String requireAssetId(String symbol) {
        String assetId = properties.getAssetIdentifiers().get(symbol);
        if (assetId == null || assetId.isBlank()) {
            throw new RiskEngineException(ErrorCode.UNSUPPORTED_ASSET, "Unsupported asset: " + symbol,
                    Map.of("asset", symbol));
        }
        return assetId;
    }

    /**
     * A concrete oracle code beats generic unavailability; MEDIAN wins ties.
     */
    static RiskEngineException mostSpecific(RiskEngineException median, RiskEngineException mean) {
        if (isGeneric(median) && !isGeneric(mean)) {
            return mean;
        }
        return median;
    }

    private static boolean isGeneric(RiskEngineException e) {
        return e.getCode() == ErrorCode.ORACLE_UNAVAILABLE || e.getCode() == ErrorCode.CHAIN_READ_FAILED;
    }

    private static RiskEngineException asEngineException(Throwable t) {
        if (t instanceof RiskEngineException engineException) {
            return engineException;
        }
        return new RiskEngineException(ErrorCode.ORACLE_UNAVAILABLE, String.valueOf(t.getMessage()), t);
    }

    private static String normalize(String asset) {
        if (asset == null || asset.isBlank()) {
            throw new RiskEngineException(ErrorCode.UNSUPPORTED_ASSET, "Asset symbol is required");
        }
        return asset.strip().toUpperCase(Locale.ROOT);
    }
}
