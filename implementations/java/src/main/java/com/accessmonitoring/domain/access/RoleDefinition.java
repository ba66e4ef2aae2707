package com.accessmonitoring.domain.access;

import java.util.Set;

/**
 * Immutable definition of a role: its permission set and security level.
 */
public record RoleDefinition(
    Role role,
    String description,
    Set<Permission> permissions,
    SecurityLevel securityLevel
) {
    public RoleDefinition {
        permissions = Set.copyOf(permissions);
    }
}
