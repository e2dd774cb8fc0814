package com.lendguard.pool.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pool and asset catalogue. Documented in application.yml under lendguard.pools and lendguard.assets.
 */
@ConfigurationProperties(prefix = "lendguard")
@Getter
@Setter
public class PoolProperties {

    /**
     * Pool key (e.g. ETH-USDC) to pool definition.
     */
    private Map<String, PoolDefinition> pools = new LinkedHashMap<>();

    /**
     * Asset symbol to token definition.
     */
    private Map<String, AssetDefinition> assets = new LinkedHashMap<>();

    /**
     * Interval between on-chain pool refreshes.
     */
    private long poolRefreshIntervalMs = 300_000;

    @Getter
    @Setter
    public static class PoolDefinition {
        private String address;
        private String collateralAsset;
        private String debtAsset;
        private String vaultAddress;
        private BigDecimal maxLtv;
        private BigDecimal liquidationThreshold;
        private BigDecimal liquidationBonus = BigDecimal.ZERO;
        private boolean active = true;
    }

    @Getter
    @Setter
    public static class AssetDefinition {
        private String address;
        private int decimals = 18;
    }
}
