package com.accessmonitoring.infrastructure.monitoring;

import com.accessmonitoring.config.AccessMonitoringProperties.DetectorProperties;
import com.accessmonitoring.domain.activity.Activity;
import com.accessmonitoring.domain.activity.ActivityType;

/**
 * Multi-activity conditions the detector looks for within its window.
 */
public enum SuspiciousPatternKind {
    ROLE_CHANGES("role_changes"),
    FAILED_LOGINS("failed_logins"),
    DATA_ACCESS_VOLUME("data_access_volume");

    private final String code;

    SuspiciousPatternKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean matches(Activity activity) {
        return switch (this) {
            case ROLE_CHANGES -> activity.getActivityType() == ActivityType.ROLE_CHANGE;
            case FAILED_LOGINS -> activity.isFailedLogin();
            case DATA_ACCESS_VOLUME -> activity.getActivityType() == ActivityType.DATA_ACCESS;
        };
    }

    /**
     * The pattern triggers when strictly more activities than this match.
     */
    public int threshold(DetectorProperties properties) {
        return switch (this) {
            case ROLE_CHANGES -> properties.getRoleChangeThreshold();
            case FAILED_LOGINS -> properties.getFailedLoginThreshold();
            case DATA_ACCESS_VOLUME -> properties.getDataAccessThreshold();
        };
    }
}
