package com.lendguard.pool;

import com.lendguard.common.ErrorCode;
import com.lendguard.common.RiskEngineException;
import com.lendguard.config.CaffeineConfig;
import com.lendguard.domain.LendingPool;
import com.lendguard.domain.LendingPoolRepository;
import com.lendguard.pool.config.PoolProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pool configuration merged with on-chain liquidity totals. Configured pools are upserted into lending_pools by
 * {@link #syncConfiguration()}; {@link #refreshFromChain()} updates totals, keeping the last stored state of any
 * pool whose read fails.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PoolRegistry {

    private final PoolProperties poolProperties;
    private final LendingPoolRepository poolRepository;
    private final PoolReader poolReader;
    private final Clock clock;

    /**
     * Upserts every configured pool. Invalid risk parameters fail fast.
     *
     * @return number of pools written
     */
    @CacheEvict(cacheNames = CaffeineConfig.POOL_CACHE, allEntries = true)
    public int syncConfiguration() {
        int written = 0;
        for (Map.Entry<String, PoolProperties.PoolDefinition> e : poolProperties.getPools().entrySet()) {
            String key = e.getKey();
            PoolProperties.PoolDefinition def = e.getValue();
            validateDefinition(key, def);
            String address = normalizeAddress(def.getAddress());
            LendingPool pool = poolRepository.findByPoolAddress(address).orElseGet(LendingPool::new);
            pool.setPoolAddress(address);
            pool.setPoolKey(key);
            pool.setCollateralAsset(def.getCollateralAsset().toUpperCase(Locale.ROOT));
            pool.setDebtAsset(def.getDebtAsset().toUpperCase(Locale.ROOT));
            pool.setVaultAddress(def.getVaultAddress() != null && !def.getVaultAddress().isBlank()
                    ? normalizeAddress(def.getVaultAddress()) : null);
            pool.setMaxLtv(def.getMaxLtv());
            pool.setLiquidationThreshold(def.getLiquidationThreshold());
            pool.setLiquidationBonus(def.getLiquidationBonus());
            pool.setActive(def.isActive());
            poolRepository.save(pool);
            written++;
        }
        log.info("Synced {} configured pools", written);
        return written;
    }

    /**
     * Reads totals for every active pool.
     *
     * @return number of pools refreshed
     */
    @CacheEvict(cacheNames = CaffeineConfig.POOL_CACHE, allEntries = true)
    public int refreshFromChain() {
        int refreshed = 0;
        for (LendingPool pool : poolRepository.findByActiveTrue()) {
            try {
                PoolChainState state = poolReader.readPool(pool.getPoolAddress());
                int decimals = assetDecimals(pool.getDebtAsset());
                BigDecimal supplied = scale(state.totalSupplied(), decimals);
                BigDecimal borrowed = scale(state.totalBorrowed(), decimals);
                if (borrowed.compareTo(supplied) > 0) {
                    log.warn("Pool {} reports borrowed {} > supplied {}; keeping last stored totals",
                            pool.getPoolKey(), borrowed, supplied);
                    continue;
                }
                pool.setTotalSupplied(supplied);
                pool.setTotalBorrowed(borrowed);
                pool.setLastSyncedAt(clock.instant());
                poolRepository.save(pool);
                refreshed++;
            } catch (RiskEngineException e) {
                log.warn("Pool {} refresh failed ({}): {}", pool.getPoolKey(), e.getCode(), e.getMessage());
            }
        }
        log.info("Refreshed {} pools from chain", refreshed);
        return refreshed;
    }

    /**
     * Returns the active pool at the given address.
     */
    @Cacheable(cacheNames = CaffeineConfig.POOL_CACHE, key = "#p0 == null ? '' : #p0.toLowerCase()")
    public LendingPool require(String poolAddress) {
        if (poolAddress == null || poolAddress.isBlank()) {
            throw new RiskEngineException(ErrorCode.POOL_NOT_FOUND, "Pool address is required");
        }
        LendingPool pool = poolRepository.findByPoolAddress(normalizeAddress(poolAddress))
                .orElseThrow(() -> new RiskEngineException(ErrorCode.POOL_NOT_FOUND,
                        "Pool not found: " + poolAddress, Map.of("poolAddress", poolAddress)));
        if (!pool.isActive()) {
            throw new RiskEngineException(ErrorCode.POOL_NOT_ACTIVE, "Pool is not active: " + pool.getPoolKey(),
                    Map.of("poolAddress", poolAddress));
        }
        return pool;
    }

    public List<LendingPool> activePools() {
        return poolRepository.findByActiveTrue();
    }

    public int assetDecimals(String asset) {
        PoolProperties.AssetDefinition def = asset != null
                ? poolProperties.getAssets().get(asset.toUpperCase(Locale.ROOT))
                : null;
        if (def == null) {
            throw new RiskEngineException(ErrorCode.UNSUPPORTED_ASSET, "No asset definition for " + asset,
                    Map.of("asset", String.valueOf(asset)));
        }
        return def.getDecimals();
    }

    static void validateDefinition(String key, PoolProperties.PoolDefinition def) {
        if (def.getAddress() == null || def.getCollateralAsset() == null || def.getDebtAsset() == null) {
            throw new IllegalStateException("Pool " + key + " needs address, collateralAsset and debtAsset");
        }
        if (def.getMaxLtv() == null || def.getLiquidationThreshold() == null) {
            throw new IllegalStateException("Pool " + key + " needs maxLtv and liquidationThreshold");
        }
        if (def.getMaxLtv().signum() <= 0 || def.getMaxLtv().compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalStateException("Pool " + key + " maxLtv must be in (0, 1]");
        }
        if (def.getLiquidationThreshold().compareTo(def.getMaxLtv()) < 0) {
            throw new IllegalStateException("Pool " + key + " liquidationThreshold must be >= maxLtv");
        }
        if (def.getLiquidationBonus() == null || def.getLiquidationBonus().signum() < 0) {
            throw new IllegalStateException("Pool " + key + " liquidationBonus must be non-negative");
        }
    }

    private static BigDecimal scale(BigInteger raw, int decimals) {
        return raw == null ? BigDecimal.ZERO : new BigDecimal(raw, decimals);
    }

    static String normalizeAddress(String address) {
        return address.strip().toLowerCase(Locale.ROOT);
    }
}
