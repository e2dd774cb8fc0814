package com.lendguard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: oracle-executor for batch price fetches, alert-executor for fire-and-forget alert delivery.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String ORACLE_EXECUTOR = "oracle-executor";
    public static final String ALERT_EXECUTOR = "alert-executor";

    @Bean(name = ORACLE_EXECUTOR)
    public Executor oracleExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(200);
        e.setThreadNamePrefix("oracle-");
        e.initialize();
        return e;
    }

    /** Alerts are best effort; a bounded queue keeps a slow sink from piling up work. */
    @Bean(name = ALERT_EXECUTOR)
    public Executor alertExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setQueueCapacity(1_000);
        e.setThreadNamePrefix("alert-");
        e.initialize();
        return e;
    }
}
