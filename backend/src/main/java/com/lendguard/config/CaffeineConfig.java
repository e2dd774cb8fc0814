package com.lendguard.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine caches behind Spring's cache abstraction. The oracle price cache is not here: it is owned by
 * PriceOracleClient so it can be cleared and inspected directly.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String POOL_CACHE = "poolCache";
    public static final String VAULT_RATE_CACHE = "vaultRateCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(POOL_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(200)
                .build());
        manager.registerCustomCache(VAULT_RATE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(30, TimeUnit.SECONDS)
                .maximumSize(200)
                .build());
        return manager;
    }
}
