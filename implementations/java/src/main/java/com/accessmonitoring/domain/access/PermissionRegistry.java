package com.accessmonitoring.domain.access;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.accessmonitoring.domain.access.Permission.*;

/**
 * Static mapping of roles to permission sets.
 *
 * <p>Built once at construction and never mutated afterwards, so lookups are safe
 * from any thread without synchronization.
 *
 * @since 1.0.0
 */
@Component
@Slf4j
public class PermissionRegistry {

    private final Map<Role, RoleDefinition> definitions;

    public PermissionRegistry() {
        EnumMap<Role, RoleDefinition> roles = new EnumMap<>(Role.class);

        roles.put(Role.ADMIN, new RoleDefinition(
            Role.ADMIN,
            "System administrator with full access",
            EnumSet.allOf(Permission.class),
            SecurityLevel.CRITICAL));

        roles.put(Role.MANAGER, new RoleDefinition(
            Role.MANAGER,
            "Manager with elevated access",
            EnumSet.of(READ_USER, UPDATE_USER,
                READ_BANK_DATA, VIEW_BALANCES, VIEW_TRANSACTIONS, VIEW_ANALYTICS,
                VIEW_AUDIT_LOGS, VIEW_SECURITY_ALERTS),
            SecurityLevel.HIGH));

        roles.put(Role.ANALYST, new RoleDefinition(
            Role.ANALYST,
            "Data analyst with read access",
            EnumSet.of(READ_BANK_DATA, VIEW_BALANCES, VIEW_TRANSACTIONS, VIEW_ANALYTICS,
                VIEW_AUDIT_LOGS),
            SecurityLevel.MEDIUM));

        roles.put(Role.SUPPORT, new RoleDefinition(
            Role.SUPPORT,
            "Customer support with limited access",
            EnumSet.of(READ_USER, READ_BANK_DATA, VIEW_BALANCES),
            SecurityLevel.MEDIUM));

        roles.put(Role.USER, new RoleDefinition(
            Role.USER,
            "Standard user with basic access",
            EnumSet.of(READ_BANK_DATA, VIEW_BALANCES, VIEW_TRANSACTIONS),
            SecurityLevel.LOW));

        roles.put(Role.READ_ONLY, new RoleDefinition(
            Role.READ_ONLY,
            "Read-only access for viewing",
            EnumSet.of(READ_BANK_DATA, VIEW_BALANCES),
            SecurityLevel.LOW));

        this.definitions = Collections.unmodifiableMap(roles);
        log.debug("Permission registry initialized with {} roles", definitions.size());
    }

    public Set<Permission> rolePermissions(Role role) {
        return definition(role).permissions();
    }

    public SecurityLevel securityLevel(Role role) {
        return definition(role).securityLevel();
    }

    public RoleDefinition definition(Role role) {
        RoleDefinition definition = definitions.get(role);
        if (definition == null) {
            // every enum constant is registered above
            throw new IllegalStateException("No definition registered for role " + role);
        }
        return definition;
    }

    /**
     * Resolve a role by name ({@code "admin"}, {@code "READ_ONLY"}).
     *
     * @throws com.accessmonitoring.domain.exception.UnknownRoleException for unrecognized input
     */
    public Role resolve(String roleName) {
        return Role.fromCode(roleName);
    }

    /**
     * @throws com.accessmonitoring.domain.exception.UnknownPermissionException for unrecognized input
     */
    public Permission resolvePermission(String permissionName) {
        return Permission.fromCode(permissionName);
    }
}
