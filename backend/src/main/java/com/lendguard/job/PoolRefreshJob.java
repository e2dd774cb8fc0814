package com.lendguard.job;

import com.lendguard.pool.PoolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Loads configured pools at startup, then keeps their on-chain totals current.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PoolRefreshJob {

    private final PoolRegistry poolRegistry;

    @EventListener(ApplicationReadyEvent.class)
    @Order(0)
    public void onApplicationReady(ApplicationReadyEvent event) {
        poolRegistry.syncConfiguration();
        poolRegistry.refreshFromChain();
    }

    @Scheduled(initialDelayString = "${lendguard.pool-refresh-interval-ms:300000}",
            fixedDelayString = "${lendguard.pool-refresh-interval-ms:300000}")
    public void refresh() {
        poolRegistry.refreshFromChain();
    }
}
