package com.lendguard.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Starknet RPC access. Documented in application.yml under lendguard.chain.
 */
@ConfigurationProperties(prefix = "lendguard.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    /** Starknet JSON-RPC endpoints, used round-robin. */
    private List<String> rpcUrls = new ArrayList<>(List.of("https://starknet-mainnet.public.blastapi.io"));

    /** Per-call timeout for pool and vault reads (oracle reads use lendguard.oracle.timeout-ms). */
    private long timeoutMs = 5_000;

    /** Block tag passed to starknet_call. */
    private String blockId = "latest";

    /** RPC budget (requests per second) for this service instance. */
    private int maxRequestsPerSecond = 20;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 2_000;

    private Retry retry = new Retry();

    private EntryPoints entryPoints = new EntryPoints();

    @Getter
    @Setter
    public static class Retry {
        /** Base delay in ms for the first retry; doubles each attempt. */
        private long baseDelayMs = 500;
        private long maxDelayMs = 10_000;
        /** Jitter factor 0..1 (0.2 = ±20%). */
        private double jitterFactor = 0.2;
        /** Total attempts including the first call. */
        private int maxAttempts = 3;
    }

    @Getter
    @Setter
    public static class EntryPoints {
        private String oracleGetData = "get_data";
        private String poolTotalSupplied = "total_supplied";
        private String poolTotalBorrowed = "total_borrowed";
        private String vaultTotalAssets = "total_assets";
        private String vaultTotalSupply = "total_supply";
    }
}
