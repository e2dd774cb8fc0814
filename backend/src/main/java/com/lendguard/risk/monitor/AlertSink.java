package com.lendguard.risk.monitor;

import com.lendguard.domain.PositionAlert;

/**
 * Destination for position alerts. Delivery is fire-and-forget: implementations must not block the monitor.
 */
public interface AlertSink {

    void emit(PositionAlert alert);
}
