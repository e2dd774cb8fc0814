package com.lendguard.pricing;

import com.lendguard.common.RiskEngineException;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a batch price fetch: quotes for the assets that resolved, errors for the ones that did not.
 */
public final class PriceBatchResult {

    private final Map<String, PriceQuote> quotes;
    private final Map<String, RiskEngineException> errors;

    public PriceBatchResult(Map<String, PriceQuote> quotes, Map<String, RiskEngineException> errors) {
        this.quotes = Collections.unmodifiableMap(new LinkedHashMap<>(quotes));
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public Map<String, PriceQuote> getQuotes() {
        return quotes;
    }

    public Map<String, RiskEngineException> getErrors() {
        return errors;
    }

    public boolean isComplete() {
        return errors.isEmpty();
    }

    /**
     * Asset to USD price for the resolved assets.
     */
    public Map<String, BigDecimal> prices() {
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        quotes.forEach((asset, quote) -> out.put(asset, quote.price()));
        return out;
    }
}
