package com.accessmonitoring.domain.activity;

/**
 * Types of user activity tracked for monitoring.
 */
public enum ActivityType {
    LOGIN,
    LOGOUT,
    DATA_ACCESS,
    DATA_MODIFICATION,
    ACCOUNT_CREATION,
    ACCOUNT_DELETION,
    PERMISSION_CHANGE,
    ROLE_CHANGE,
    SUSPICIOUS_ACTIVITY,
    SECURITY_VIOLATION
}
