package com.accessmonitoring.domain.alert;

import java.util.List;

/**
 * Kinds of security alert raised by the access-control path and the monitoring workers.
 */
public enum AlertType {
    ACCOUNT_LOCKED("account_locked"),
    SECURITY_VIOLATION("security_violation"),
    SUSPICIOUS_ACTIVITY("suspicious_activity"),
    DATA_BREACH("data_breach"),
    UNUSUAL_ACTIVITY("unusual_activity"),
    RAPID_ACTIVITY("rapid_activity"),
    SUSPICIOUS_PATTERN("suspicious_pattern"),
    MONITOR_DEGRADED("monitor_degraded");

    static final List<String> DEFAULT_REMEDIATION = List.of("Investigate and remediate");

    private final String code;

    AlertType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Remediation checklist attached to new alerts of this type.
     */
    public List<String> remediationSteps() {
        return switch (this) {
            case ACCOUNT_LOCKED -> List.of(
                "Verify user identity",
                "Reset password if necessary",
                "Review login attempts",
                "Consider additional authentication factors");
            case SECURITY_VIOLATION -> List.of(
                "Investigate the violation",
                "Review user permissions",
                "Consider account suspension",
                "Update security policies if needed");
            case SUSPICIOUS_ACTIVITY -> List.of(
                "Monitor user activity",
                "Review access patterns",
                "Consider additional monitoring",
                "Investigate potential threats");
            case DATA_BREACH -> List.of(
                "Contain the breach",
                "Assess affected data",
                "Notify affected users",
                "Report to authorities if required",
                "Implement additional security measures");
            case UNUSUAL_ACTIVITY, RAPID_ACTIVITY, SUSPICIOUS_PATTERN, MONITOR_DEGRADED ->
                DEFAULT_REMEDIATION;
        };
    }
}
