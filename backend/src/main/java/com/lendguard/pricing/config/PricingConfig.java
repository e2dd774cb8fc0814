package com.lendguard.pricing.config;

import com.lendguard.config.AsyncConfig;
import com.lendguard.pricing.OracleReader;
import com.lendguard.pricing.PriceCache;
import com.lendguard.pricing.PriceOracleClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Pricing module configuration: properties, the explicit price cache and the oracle client.
 */
@Configuration
@EnableConfigurationProperties(OracleProperties.class)
public class PricingConfig {

    @Bean
    public PriceCache priceCache(OracleProperties oracleProperties, Clock clock) {
        return new PriceCache(clock,
                Duration.ofMillis(oracleProperties.getCacheTtlMs()),
                Duration.ofMinutes(oracleProperties.getDegradedRetentionMinutes()),
                1_000);
    }

    @Bean
    public PriceOracleClient priceOracleClient(OracleReader oracleReader,
                                               OracleProperties oracleProperties,
                                               PriceCache priceCache,
                                               Clock clock,
                                               @Qualifier(AsyncConfig.ORACLE_EXECUTOR) Executor oracleExecutor) {
        return new PriceOracleClient(oracleReader, oracleProperties, priceCache, clock, oracleExecutor);
    }
}
