package com.accessmonitoring.domain.access;

import com.accessmonitoring.domain.exception.UnknownRoleException;

import java.util.Locale;

/**
 * User roles for access control. Permission sets live in {@link PermissionRegistry}.
 */
public enum Role {
    ADMIN("admin"),
    MANAGER("manager"),
    ANALYST("analyst"),
    SUPPORT("support"),
    USER("user"),
    READ_ONLY("read_only");

    private final String code;

    Role(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    static Role fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new UnknownRoleException(value);
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.code.equals(normalized)) {
                return role;
            }
        }
        throw new UnknownRoleException(value);
    }
}
