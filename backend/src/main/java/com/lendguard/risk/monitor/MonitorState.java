package com.lendguard.risk.monitor;

public enum MonitorState {
    IDLE,
    SCANNING
}
