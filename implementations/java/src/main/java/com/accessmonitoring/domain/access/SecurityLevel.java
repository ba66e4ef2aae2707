package com.accessmonitoring.domain.access;

/**
 * Security level attached to a role. Higher ordinal means more sensitive.
 */
public enum SecurityLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
