package com.accessmonitoring.domain.access;

import com.accessmonitoring.domain.exception.UnknownPermissionException;

import java.util.Locale;

/**
 * Permissions for individual operations.
 *
 * <p>This enum is the permission universe: every permission referenced by a role,
 * a user record or an activity is one of these constants.
 */
public enum Permission {
    // User management
    CREATE_USER("create_user"),
    READ_USER("read_user"),
    UPDATE_USER("update_user"),
    DELETE_USER("delete_user"),

    // Banking data
    READ_BANK_DATA("read_bank_data"),
    WRITE_BANK_DATA("write_bank_data"),
    DELETE_BANK_DATA("delete_bank_data"),
    EXPORT_BANK_DATA("export_bank_data"),

    // Financial operations
    VIEW_BALANCES("view_balances"),
    VIEW_TRANSACTIONS("view_transactions"),
    VIEW_ANALYTICS("view_analytics"),
    MANAGE_ACCOUNTS("manage_accounts"),

    // System administration
    SYSTEM_ADMIN("system_admin"),
    SECURITY_ADMIN("security_admin"),
    COMPLIANCE_ADMIN("compliance_admin"),

    // Audit and monitoring
    VIEW_AUDIT_LOGS("view_audit_logs"),
    VIEW_SECURITY_ALERTS("view_security_alerts"),
    MANAGE_MONITORING("manage_monitoring");

    private final String code;

    Permission(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolve a permission from its wire code ({@code export_bank_data}) or constant name.
     *
     * @throws UnknownPermissionException if the value names no permission
     */
    public static Permission fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new UnknownPermissionException(value);
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Permission permission : values()) {
            if (permission.code.equals(normalized)) {
                return permission;
            }
        }
        throw new UnknownPermissionException(value);
    }
}
