package com.lendguard.api.dto;

import com.lendguard.pricing.PriceBatchResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GET /api/v1/risk/oracle/prices. Partial results: resolved quotes plus per-asset errors.
 */
public record PriceBatchResponse(Map<String, PriceQuoteResponse> prices, Map<String, ErrorBody> errors) {

    public static PriceBatchResponse from(PriceBatchResult result) {
        Map<String, PriceQuoteResponse> prices = new LinkedHashMap<>();
        result.getQuotes().forEach((asset, quote) -> prices.put(asset, PriceQuoteResponse.from(quote)));
        Map<String, ErrorBody> errors = new LinkedHashMap<>();
        result.getErrors().forEach((asset, e) ->
                errors.put(asset, ErrorBody.of(e.getCode().name(), e.getMessage(), e.isRetryable(), e.getDetails())));
        return new PriceBatchResponse(prices, errors);
    }
}
