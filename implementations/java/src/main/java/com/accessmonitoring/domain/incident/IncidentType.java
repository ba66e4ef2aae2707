package com.accessmonitoring.domain.incident;

/**
 * Breach incident categories.
 */
public enum IncidentType {
    /** Data was accessed under a permission the user no longer holds. */
    UNAUTHORIZED_ACCESS("unauthorized_access"),
    /** Export volume above the configured threshold inside the breach window. */
    EXCESSIVE_DATA_EXPORT("excessive_data_export");

    private final String code;

    IncidentType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
