package com.lendguard.chain.config;

import com.lendguard.chain.RpcEndpointRotator;
import com.lendguard.chain.StarknetRpcClient;
import com.lendguard.chain.WebClientStarknetRpcClient;
import com.lendguard.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Starknet RPC plumbing: client, endpoint rotator with retry policy, local rate limiter.
 */
@Configuration
@EnableConfigurationProperties(ChainProperties.class)
public class ChainAdapterConfig {

    public static final String STARKNET_RATE_LIMITER = "starknetRpcRateLimiter";

    @Bean
    public StarknetRpcClient starknetRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientStarknetRpcClient(webClientBuilder);
    }

    @Bean
    public RpcEndpointRotator starknetEndpointRotator(ChainProperties properties) {
        ChainProperties.Retry retry = properties.getRetry();
        RetryPolicy policy = new RetryPolicy(
                Duration.ofMillis(retry.getBaseDelayMs()),
                Duration.ofMillis(retry.getMaxDelayMs()),
                retry.getJitterFactor(),
                retry.getMaxAttempts());
        return new RpcEndpointRotator(properties.getRpcUrls(), policy);
    }

    @Bean(name = STARKNET_RATE_LIMITER)
    public RateLimiter starknetRpcRateLimiter(ChainProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("starknet-rpc", config);
    }
}
