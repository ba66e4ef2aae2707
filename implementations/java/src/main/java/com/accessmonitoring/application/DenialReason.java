package com.accessmonitoring.application;

/**
 * Why a permission check was denied. Recorded as the {@code reason} metadata of the
 * DATA_ACCESS activity.
 */
public enum DenialReason {
    NO_ACCESS_RECORD("no_access_record"),
    ACCOUNT_LOCKED("account_locked"),
    PERMISSION_NOT_GRANTED("permission_not_granted"),
    RESOURCE_SCOPE("resource_scope"),
    CONSENT_MISSING("consent_missing"),
    INTERNAL_ERROR("internal_error");

    private final String code;

    DenialReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Denials that count as a security violation and raise an alert.
     */
    public boolean isViolation() {
        return switch (this) {
            case ACCOUNT_LOCKED, PERMISSION_NOT_GRANTED -> true;
            case NO_ACCESS_RECORD, RESOURCE_SCOPE, CONSENT_MISSING, INTERNAL_ERROR -> false;
        };
    }
}
