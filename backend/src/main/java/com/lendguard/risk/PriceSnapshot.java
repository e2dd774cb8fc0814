package com.lendguard.risk;

import com.lendguard.common.ErrorCode;
import com.lendguard.common.RiskEngineException;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable asset to USD price map used for one evaluation. Keys are upper-case symbols.
 */
public final class PriceSnapshot {

    private final Map<String, BigDecimal> prices;

    private PriceSnapshot(Map<String, BigDecimal> prices) {
        this.prices = Collections.unmodifiableMap(prices);
    }

    public static PriceSnapshot of(Map<String, BigDecimal> prices) {
        Map<String, BigDecimal> copy = new HashMap<>();
        prices.forEach((asset, price) -> copy.put(asset.toUpperCase(Locale.ROOT), price));
        return new PriceSnapshot(copy);
    }

    public static PriceSnapshot of(String asset, BigDecimal price, String otherAsset, BigDecimal otherPrice) {
        Map<String, BigDecimal> map = new HashMap<>();
        map.put(asset, price);
        map.put(otherAsset, otherPrice);
        return of(map);
    }

    /**
     * @throws RiskEngineException MISSING_PRICE when absent, ZERO_PRICE when not positive
     */
    public BigDecimal priceOf(String asset) {
        BigDecimal price = asset != null ? prices.get(asset.toUpperCase(Locale.ROOT)) : null;
        if (price == null) {
            throw new RiskEngineException(ErrorCode.MISSING_PRICE, "No price for " + asset,
                    Map.of("asset", String.valueOf(asset)));
        }
        if (price.signum() <= 0) {
            throw new RiskEngineException(ErrorCode.ZERO_PRICE, "Non-positive price for " + asset,
                    Map.of("asset", asset, "price", price.toPlainString()));
        }
        return price;
    }

    public boolean has(String asset) {
        return asset != null && prices.containsKey(asset.toUpperCase(Locale.ROOT));
    }

    public Map<String, BigDecimal> asMap() {
        return prices;
    }
}
