package com.accessmonitoring.infrastructure.audit;

public enum AuditCategory {
    AUTHENTICATION,
    DATA_ACCESS,
    ACCESS_CONTROL,
    SECURITY,
    CONSENT
}
