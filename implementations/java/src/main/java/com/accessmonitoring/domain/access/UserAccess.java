package com.accessmonitoring.domain.access;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Per-user authorization state.
 *
 * <p>Immutable: every mutation produces a new instance which the owning store swaps in
 * atomically. The permission set starts as the role's set and may shrink through
 * revocation. A locked record grants nothing regardless of its permissions.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class UserAccess {

    public static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofMinutes(30);

    String userId;
    Role role;
    Set<Permission> permissions;
    SecurityLevel securityLevel;
    Instant lastLogin;
    int loginCount;
    @With
    int failedAttempts;
    @With
    boolean locked;
    boolean mfaEnabled;
    List<String> ipWhitelist;
    Duration sessionTimeout;

    /**
     * Fresh record for a role, as created on first login or explicit assignment.
     */
    public static UserAccess forRole(String userId, RoleDefinition definition, Duration sessionTimeout, Instant now) {
        return UserAccess.builder()
            .userId(userId)
            .role(definition.role())
            .permissions(definition.permissions())
            .securityLevel(definition.securityLevel())
            .lastLogin(now)
            .loginCount(0)
            .failedAttempts(0)
            .locked(false)
            .mfaEnabled(false)
            .ipWhitelist(List.of())
            .sessionTimeout(sessionTimeout)
            .build();
    }

    public boolean hasPermission(Permission permission) {
        return !locked && permissions.contains(permission);
    }

    public UserAccess withoutPermission(Permission permission) {
        Set<Permission> remaining = permissions.isEmpty()
            ? EnumSet.noneOf(Permission.class)
            : EnumSet.copyOf(permissions);
        remaining.remove(permission);
        return toBuilder().permissions(Set.copyOf(remaining)).build();
    }

    public UserAccess withSuccessfulLogin(Instant at) {
        return toBuilder()
            .lastLogin(at)
            .loginCount(loginCount + 1)
            .failedAttempts(0)
            .build();
    }
}
