package com.accessmonitoring.infrastructure.audit;

public enum AuditSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
