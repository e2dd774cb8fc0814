package com.lendguard.pricing.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Price oracle configuration. Documented in application.yml under lendguard.oracle.
 */
@ConfigurationProperties(prefix = "lendguard.oracle")
@Validated
@Getter
@Setter
public class OracleProperties {

    /**
     * Oracle contract address.
     */
    private String address;

    /**
     * Maximum age of an oracle answer before it is rejected as stale.
     */
    @Min(1)
    private long stalenessToleranceSeconds = 300;

    /**
     * How long a validated quote is served from cache without querying the oracle.
     */
    @Min(0)
    private long cacheTtlMs = 60_000;

    /**
     * How long an expired quote is kept as a degraded fallback.
     */
    @Min(1)
    private long degradedRetentionMinutes = 60;

    @Min(1)
    private int minSources = 3;

    @Min(1)
    private long timeoutMs = 5_000;

    /**
     * Asset used by the health probe.
     */
    private String healthProbeAsset = "ETH";

    /**
     * Asset symbol (upper case) to oracle pair id felt, e.g. ETH -> 19514442401534788 ("ETH/USD").
     */
    private Map<String, String> assetIdentifiers = new LinkedHashMap<>();
}
