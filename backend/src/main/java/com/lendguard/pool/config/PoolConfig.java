package com.lendguard.pool.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PoolProperties.class)
public class PoolConfig {
}
