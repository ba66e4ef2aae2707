package com.accessmonitoring.domain.alert;

/**
 * Alert severity levels.
 */
public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
