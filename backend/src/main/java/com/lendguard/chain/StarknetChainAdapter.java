package com.lendguard.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendguard.chain.config.ChainAdapterConfig;
import com.lendguard.chain.config.ChainProperties;
import com.lendguard.common.ErrorCode;
import com.lendguard.common.RiskEngineException;
import com.lendguard.config.CaffeineConfig;
import com.lendguard.pool.PoolChainState;
import com.lendguard.pool.PoolReader;
import com.lendguard.pool.VaultReader;
import com.lendguard.pricing.AggregationMode;
import com.lendguard.pricing.OracleReader;
import com.lendguard.pricing.OracleResponse;
import com.lendguard.pricing.config.OracleProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Reads the price oracle, lending pools and share vaults through starknet_call. Each call is rate limited,
 * bounded by a timeout and retried with backoff across rotated endpoints. After the last attempt a timeout
 * surfaces as NETWORK_TIMEOUT and any other failure as CHAIN_READ_FAILED.
 */
@Component
@Slf4j
public class StarknetChainAdapter implements OracleReader, PoolReader, VaultReader {

    /** DataType::SpotEntry variant index in the oracle's get_data calldata. */
    private static final String SPOT_ENTRY = "0x0";
    private static final MathContext RATE_CONTEXT = new MathContext(36, RoundingMode.DOWN);

    private final StarknetRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final ChainProperties chainProperties;
    private final OracleProperties oracleProperties;

    public StarknetChainAdapter(StarknetRpcClient rpcClient,
                                RpcEndpointRotator rotator,
                                @Qualifier(ChainAdapterConfig.STARKNET_RATE_LIMITER) RateLimiter rateLimiter,
                                ObjectMapper objectMapper,
                                ChainProperties chainProperties,
                                OracleProperties oracleProperties) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.chainProperties = chainProperties;
        this.oracleProperties = oracleProperties;
    }

    @Override
    public OracleResponse query(String assetId, AggregationMode mode) {
        String oracle = oracleProperties.getAddress();
        if (oracle == null || oracle.isBlank()) {
            throw new RiskEngineException(ErrorCode.ORACLE_UNAVAILABLE, "Oracle address is not configured");
        }
        List<String> calldata = List.of(SPOT_ENTRY, FeltCodec.toHex(FeltCodec.parse(assetId)), FeltCodec.toHex(mode.getCode()));
        List<BigInteger> result = callWithRetry(oracle, chainProperties.getEntryPoints().getOracleGetData(), calldata,
                Duration.ofMillis(oracleProperties.getTimeoutMs()));
        if (result.size() < 5) {
            throw new RiskEngineException(ErrorCode.CHAIN_READ_FAILED,
                    "Oracle returned " + result.size() + " felts, expected at least 5",
                    Map.of("assetId", assetId, "mode", mode.name()));
        }
        BigInteger expiration = FeltCodec.option(result, 4);
        return new OracleResponse(
                result.get(0),
                result.get(1).intValueExact(),
                result.get(2).longValueExact(),
                result.get(3).intValueExact(),
                expiration != null ? expiration.longValueExact() : null);
    }

    @Override
    public PoolChainState readPool(String poolAddress) {
        Duration timeout = Duration.ofMillis(chainProperties.getTimeoutMs());
        ChainProperties.EntryPoints entryPoints = chainProperties.getEntryPoints();
        BigInteger supplied = readU256(poolAddress, entryPoints.getPoolTotalSupplied(), timeout);
        BigInteger borrowed = readU256(poolAddress, entryPoints.getPoolTotalBorrowed(), timeout);
        return new PoolChainState(supplied, borrowed);
    }

    @Override
    @Cacheable(cacheNames = CaffeineConfig.VAULT_RATE_CACHE, key = "#vaultAddress")
    public BigDecimal readVaultExchangeRate(String vaultAddress) {
        Duration timeout = Duration.ofMillis(chainProperties.getTimeoutMs());
        ChainProperties.EntryPoints entryPoints = chainProperties.getEntryPoints();
        BigInteger totalAssets = readU256(vaultAddress, entryPoints.getVaultTotalAssets(), timeout);
        BigInteger totalSupply = readU256(vaultAddress, entryPoints.getVaultTotalSupply(), timeout);
        if (totalSupply.signum() == 0) {
            return BigDecimal.ONE;
        }
        return new BigDecimal(totalAssets).divide(new BigDecimal(totalSupply), RATE_CONTEXT);
    }

    private BigInteger readU256(String contract, String entryPoint, Duration timeout) {
        List<BigInteger> result = callWithRetry(contract, entryPoint, List.of(), timeout);
        try {
            return FeltCodec.u256(result, 0);
        } catch (RpcException e) {
            throw new RiskEngineException(ErrorCode.CHAIN_READ_FAILED, e.getMessage(),
                    Map.of("contract", contract, "entryPoint", entryPoint), e);
        }
    }

    List<BigInteger> callWithRetry(String contract, String entryPoint, List<String> calldata, Duration timeout) {
        RpcException lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(rotator.retryDelay(attempt - 1).toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RiskEngineException(ErrorCode.CHAIN_READ_FAILED, "Interrupted during retry", e);
                }
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                return parseResult(call(endpoint, contract, entryPoint, calldata, timeout), entryPoint);
            } catch (RpcException e) {
                lastException = e;
                log.warn("starknet_call {} on {} failed (attempt {}/{}): {}",
                        entryPoint, endpoint, attempt + 1, rotator.getMaxAttempts(), e.getMessage());
            }
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("contract", contract);
        details.put("entryPoint", entryPoint);
        details.put("attempts", rotator.getMaxAttempts());
        if (lastException != null && lastException.isTimeout()) {
            throw new RiskEngineException(ErrorCode.NETWORK_TIMEOUT,
                    entryPoint + " timed out after " + rotator.getMaxAttempts() + " attempts", details, lastException);
        }
        throw new RiskEngineException(ErrorCode.CHAIN_READ_FAILED,
                entryPoint + " failed after " + rotator.getMaxAttempts() + " attempts", details, lastException);
    }

    private String call(String endpoint, String contract, String entryPoint, List<String> calldata, Duration timeout) {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + entryPoint + " on " + endpoint);
        }
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("contract_address", contract);
        request.put("entry_point_selector", FeltCodec.selector(entryPoint));
        request.put("calldata", calldata);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("request", request);
        params.put("block_id", chainProperties.getBlockId());
        String json = rpcClient.call(endpoint, "starknet_call", params)
                .timeout(timeout)
                .onErrorMap(TimeoutException.class,
                        e -> RpcException.timeout(entryPoint + " timed out after " + timeout.toMillis() + "ms", e))
                .onErrorMap(e -> !(e instanceof RpcException), e -> new RpcException(entryPoint + " failed: " + e.getMessage(), e))
                .block();
        if (json == null) {
            throw new RpcException("starknet_call " + entryPoint + " returned no body");
        }
        return json;
    }

    private List<BigInteger> parseResult(String json, String entryPoint) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new RpcException("Failed to parse starknet_call " + entryPoint + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException("starknet_call " + entryPoint + " error: " + error);
        }
        JsonNode result = root.path("result");
        if (!result.isArray()) {
            throw new RpcException("starknet_call " + entryPoint + " returned no result array");
        }
        List<BigInteger> felts = new ArrayList<>(result.size());
        try {
            for (JsonNode felt : result) {
                felts.add(FeltCodec.parse(felt.asText()));
            }
        } catch (IllegalArgumentException e) {
            throw new RpcException("starknet_call " + entryPoint + " returned a malformed felt", e);
        }
        return felts;
    }
}
