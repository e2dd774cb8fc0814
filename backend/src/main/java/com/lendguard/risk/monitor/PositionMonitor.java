package com.lendguard.risk.monitor;

import com.lendguard.common.ErrorCode;
import com.lendguard.common.RiskEngineException;
import com.lendguard.config.SchedulerConfig;
import com.lendguard.domain.HealthStatus;
import com.lendguard.domain.LendingPool;
import com.lendguard.domain.LendingPosition;
import com.lendguard.domain.LendingPositionRepository;
import com.lendguard.domain.PositionAlert;
import com.lendguard.domain.PositionStatus;
import com.lendguard.pool.PoolRegistry;
import com.lendguard.pricing.PriceOracleClient;
import com.lendguard.risk.HealthClassifier;
import com.lendguard.risk.HealthFactor;
import com.lendguard.risk.PriceSnapshot;
import com.lendguard.risk.RiskMath;
import com.lendguard.risk.config.RiskProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodically re-evaluates every active position, classifies its health and raises alerts.
 * Scheduling uses a fixed delay on a single-thread scheduler; manual and scheduled cycles are serialized by a lock.
 * A failing position is logged and counted; the cycle moves on to the next one.
 */
@Component
@Slf4j
public class PositionMonitor {

    private final LendingPositionRepository positionRepository;
    private final PoolRegistry poolRegistry;
    private final PriceOracleClient priceOracleClient;
    private final RiskMath riskMath;
    private final HealthClassifier classifier;
    private final AlertSink alertSink;
    private final TaskScheduler scheduler;
    private final RiskProperties riskProperties;
    private final Clock clock;

    private final MonitorStats stats = new MonitorStats();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<MonitorState> state = new AtomicReference<>(MonitorState.IDLE);
    private final ReentrantLock cycleLock = new ReentrantLock();
    private volatile ScheduledFuture<?> scheduledCycle;

    public PositionMonitor(LendingPositionRepository positionRepository,
                           PoolRegistry poolRegistry,
                           PriceOracleClient priceOracleClient,
                           RiskMath riskMath,
                           HealthClassifier classifier,
                           AlertSink alertSink,
                           @Qualifier(SchedulerConfig.MONITOR_SCHEDULER) TaskScheduler scheduler,
                           RiskProperties riskProperties,
                           Clock clock) {
        this.positionRepository = positionRepository;
        this.poolRegistry = poolRegistry;
        this.priceOracleClient = priceOracleClient;
        this.riskMath = riskMath;
        this.classifier = classifier;
        this.alertSink = alertSink;
        this.scheduler = scheduler;
        this.riskProperties = riskProperties;
        this.clock = clock;
    }

    /**
     * Starts the fixed-delay loop; the first cycle runs immediately.
     *
     * @return false if already running
     */
    public boolean start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Position monitor already running");
            return false;
        }
        Duration interval = Duration.ofMillis(riskProperties.getMonitor().getIntervalMs());
        scheduledCycle = scheduler.scheduleWithFixedDelay(this::runScheduledCycle, clock.instant(), interval);
        log.info("Position monitor started (interval {}ms)", interval.toMillis());
        return true;
    }

    /**
     * Cancels future cycles. A cycle already in progress completes.
     *
     * @return false if not running
     */
    public boolean stop() {
        if (!running.compareAndSet(true, false)) {
            return false;
        }
        ScheduledFuture<?> handle = scheduledCycle;
        if (handle != null) {
            handle.cancel(false);
        }
        scheduledCycle = null;
        log.info("Position monitor stopped");
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    public MonitorState getState() {
        return state.get();
    }

    public MonitorStats.Snapshot getStats() {
        return stats.snapshot();
    }

    public void resetStats() {
        stats.reset();
        log.info("Position monitor statistics reset");
    }

    void runScheduledCycle() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            // an exception escaping here cancels every later execution
            log.error("Position monitor cycle failed", e);
        }
    }

    /**
     * Runs one full cycle on the calling thread.
     */
    public MonitorCycleResult runCycle() {
        cycleLock.lock();
        state.set(MonitorState.SCANNING);
        Instant startedAt = clock.instant();
        try {
            List<LendingPosition> positions = loadActivePositions();
            int checked = 0;
            int healthy = 0;
            int warnings = 0;
            int critical = 0;
            int liquidatable = 0;
            List<String> failed = new ArrayList<>();
            for (LendingPosition position : positions) {
                try {
                    HealthStatus status = evaluate(position);
                    checked++;
                    switch (status) {
                        case HEALTHY -> healthy++;
                        case WARNING -> warnings++;
                        case CRITICAL -> critical++;
                        case LIQUIDATABLE -> liquidatable++;
                    }
                } catch (RuntimeException e) {
                    failed.add(String.valueOf(position.getId()));
                    log.warn("Position {} check failed: {}", position.getId(), e.getMessage(), e);
                }
            }
            MonitorCycleResult result = new MonitorCycleResult(startedAt, Duration.between(startedAt, clock.instant()),
                    checked, healthy, warnings, critical, liquidatable, List.copyOf(failed));
            stats.recordCycle(result);
            log.info("Monitor cycle: {} checked, {} warning, {} critical, {} liquidatable, {} errors in {}ms",
                    checked, warnings, critical, liquidatable, result.errors(), result.duration().toMillis());
            return result;
        } finally {
            state.set(MonitorState.IDLE);
            cycleLock.unlock();
        }
    }

    private List<LendingPosition> loadActivePositions() {
        try {
            return positionRepository.findByStatus(PositionStatus.ACTIVE);
        } catch (DataAccessException e) {
            throw new RiskEngineException(ErrorCode.PERSISTENCE_FAILED, "Failed to load active positions", e);
        }
    }

    HealthStatus evaluate(LendingPosition position) {
        Instant now = clock.instant();
        if (!position.hasDebt()) {
            if (position.getHealthFactor() != null) {
                positionRepository.updateHealthFactor(position.getId(), null, now);
            }
            return HealthStatus.HEALTHY;
        }
        LendingPool pool = poolRegistry.require(position.getPoolAddress());
        BigDecimal collateralPrice = priceOracleClient.getPrice(position.getCollateralAsset()).price();
        BigDecimal debtPrice = priceOracleClient.getPrice(position.getDebtAsset()).price();
        PriceSnapshot prices = PriceSnapshot.of(position.getCollateralAsset(), collateralPrice,
                position.getDebtAsset(), debtPrice);
        HealthFactor hf = riskMath.healthFactor(position, prices, pool.getLiquidationThreshold());
        HealthStatus status = classifier.classify(hf);

        if (status.requiresAlert()) {
            raiseAlert(position, hf, status, now);
        }
        BigDecimal stored = riskMath.context().toOutput(hf.value(), RoundingMode.DOWN);
        positionRepository.updateHealthFactor(position.getId(), stored, now);
        return status;
    }

    private void raiseAlert(LendingPosition position, HealthFactor hf, HealthStatus status, Instant now) {
        PositionAlert alert = new PositionAlert();
        alert.setPositionId(position.getId());
        alert.setUserId(position.getUserId());
        alert.setPoolAddress(position.getPoolAddress());
        alert.setCollateralAsset(position.getCollateralAsset());
        alert.setDebtAsset(position.getDebtAsset());
        alert.setHealthFactor(riskMath.context().toOutput(hf.value(), RoundingMode.DOWN));
        alert.setThreshold(classifier.thresholdFor(status));
        alert.setHealthStatus(status);
        alert.setPriority(HealthClassifier.priorityFor(status));
        alert.setTitle(titleFor(status));
        alert.setMessage(messageFor(status, hf));
        alert.setCreatedAt(now);
        try {
            alertSink.emit(alert);
        } catch (RuntimeException e) {
            log.warn("Alert delivery failed for position {}: {}", position.getId(), e.getMessage());
            return;
        }
        switch (status) {
            case WARNING -> stats.recordWarning();
            case CRITICAL -> stats.recordCritical();
            case LIQUIDATABLE -> stats.recordLiquidationAlert();
            default -> {
            }
        }
    }

    private static String titleFor(HealthStatus status) {
        return switch (status) {
            case WARNING -> "Position health warning";
            case CRITICAL -> "Position at risk of liquidation";
            case LIQUIDATABLE -> "Position eligible for liquidation";
            case HEALTHY -> "Position healthy";
        };
    }

    private static String messageFor(HealthStatus status, HealthFactor hf) {
        String value = hf.value().setScale(4, RoundingMode.DOWN).toPlainString();
        return switch (status) {
            case WARNING -> "Health factor is " + value + ". Consider adding collateral or repaying debt.";
            case CRITICAL -> "Health factor is " + value + ". Add collateral or repay debt now to avoid liquidation.";
            case LIQUIDATABLE -> "Health factor is " + value + ". The position can be liquidated.";
            case HEALTHY -> "Health factor is " + value + ".";
        };
    }
}
