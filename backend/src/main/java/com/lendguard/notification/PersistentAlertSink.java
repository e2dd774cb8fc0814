package com.lendguard.notification;

import com.lendguard.config.AsyncConfig;
import com.lendguard.domain.PositionAlert;
import com.lendguard.domain.PositionAlertRepository;
import com.lendguard.risk.monitor.AlertSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Stores alerts in position_alerts on the alert executor. Downstream delivery (push, e-mail) reads from there.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PersistentAlertSink implements AlertSink {

    private final PositionAlertRepository alertRepository;

    @Override
    @Async(AsyncConfig.ALERT_EXECUTOR)
    public void emit(PositionAlert alert) {
        try {
            alertRepository.save(alert);
            log.info("{} alert for position {} (health factor {}, threshold {})",
                    alert.getPriority(), alert.getPositionId(), alert.getHealthFactor(), alert.getThreshold());
        } catch (DataAccessException e) {
            log.error("Failed to store alert for position {}", alert.getPositionId(), e);
        }
    }
}
