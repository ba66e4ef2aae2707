package com.accessmonitoring.application;

import com.accessmonitoring.config.AccessMonitoringProperties;
import com.accessmonitoring.config.PerformanceConfiguration.SecurityMetrics;
import com.accessmonitoring.domain.access.Permission;
import com.accessmonitoring.domain.access.PermissionRegistry;
import com.accessmonitoring.domain.access.Role;
import com.accessmonitoring.domain.access.RoleDefinition;
import com.accessmonitoring.domain.access.UserAccess;
import com.accessmonitoring.domain.activity.ActivityMetadata;
import com.accessmonitoring.domain.activity.ActivityType;
import com.accessmonitoring.domain.alert.AlertSeverity;
import com.accessmonitoring.domain.alert.AlertType;
import com.accessmonitoring.domain.consent.ConsentType;
import com.accessmonitoring.infrastructure.compliance.ComplianceCollaborator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-user authorization state and the permission check path.
 *
 * <p>Records live in a {@link ConcurrentHashMap} keyed by user id. Every mutation is a
 * {@code compute} on that key, so writes to one user are serialized while different
 * users proceed in parallel, and a read after a write always sees the write.
 *
 * <p>Every {@link #checkPermission} call records exactly one DATA_ACCESS activity.
 * Failures inside the check deny.
 *
 * @since 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserAccessStore {

    static final String SYSTEM_ACTOR = "system";

    private final Map<String, UserAccess> users = new ConcurrentHashMap<>();

    private final PermissionRegistry permissionRegistry;
    private final ActivityRecorder activityRecorder;
    private final SecurityAlertManager alertManager;
    private final ConsentStore consentStore;
    private final ComplianceCollaborator complianceCollaborator;
    private final SecurityMetrics securityMetrics;
    private final AccessMonitoringProperties properties;
    private final Clock clock;

    public boolean checkPermission(String userId, Permission permission) {
        return checkPermission(userId, permission, null, null);
    }

    /**
     * Check a permission, optionally scoped to a resource.
     *
     * @param resourceType {@code bank_account} and {@code user} are scoped; other types are not
     * @return true if granted
     */
    public boolean checkPermission(String userId, Permission permission, String resourceType, String resourceId) {
        try {
            AccessDecision decision = evaluateSafely(userId, permission, resourceType, resourceId);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(ActivityMetadata.PERMISSION, permission.getCode());
            metadata.put(ActivityMetadata.GRANTED, decision.granted());
            if (!decision.granted()) {
                metadata.put(ActivityMetadata.REASON, decision.reason().getCode());
            }
            activityRecorder.logActivity(userId, ActivityType.DATA_ACCESS, resourceType, resourceId, metadata);
            securityMetrics.recordPermissionCheck(decision.granted());

            if (decision.granted()) {
                log.debug("AUTHORIZATION GRANTED [{}]: {} on {}/{}",
                    Encode.forJava(userId), permission,
                    Encode.forJava(String.valueOf(resourceType)), Encode.forJava(String.valueOf(resourceId)));
                return true;
            }

            log.warn("AUTHORIZATION DENIED [{}]: {} on {}/{} - {}",
                Encode.forJava(userId), permission,
                Encode.forJava(String.valueOf(resourceType)), Encode.forJava(String.valueOf(resourceId)),
                decision.reason().getCode());

            if (decision.reason().isViolation()) {
                recordViolation(userId, permission, resourceType, resourceId, decision.reason());
            }
            return false;

        } catch (RuntimeException e) {
            log.error("Permission check failed for user {}; denying {}",
                Encode.forJava(String.valueOf(userId)), permission, e);
            return false;
        }
    }

    /**
     * The decision {@link #checkPermission} would make, without recording anything.
     */
    public boolean isAuthorized(String userId, Permission permission, String resourceType, String resourceId) {
        return evaluateSafely(userId, permission, resourceType, resourceId).granted();
    }

    public boolean isAuthorized(String userId, Permission permission) {
        return isAuthorized(userId, permission, null, null);
    }

    /**
     * Record a login attempt. An unknown user gets a fresh USER record on first attempt.
     *
     * <p>The failure that brings the counter to the lockout threshold locks the account
     * and raises one {@code account_locked} alert; further failures only count. A
     * successful login resets the counter but does not unlock.
     *
     * @return the user's record after the attempt
     */
    public UserAccess recordLoginAttempt(String userId, String ipAddress, String userAgent, boolean success) {
        Instant now = clock.instant();
        int threshold = properties.getLockoutThreshold();
        AtomicBoolean lockedByThisAttempt = new AtomicBoolean();

        UserAccess updated = users.compute(userId, (id, current) -> {
            UserAccess base = current != null
                ? current
                : UserAccess.forRole(id, permissionRegistry.definition(Role.USER), properties.getSessionTimeout(), now);
            if (success) {
                return base.withSuccessfulLogin(now);
            }
            int failures = base.getFailedAttempts() + 1;
            UserAccess next = base.withFailedAttempts(failures);
            if (!base.isLocked() && failures >= threshold) {
                lockedByThisAttempt.set(true);
                next = next.withLocked(true);
            }
            return next;
        });

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ActivityMetadata.IP_ADDRESS, ipAddress);
        metadata.put(ActivityMetadata.USER_AGENT, userAgent);
        if (!success) {
            metadata.put(ActivityMetadata.FAILED_ATTEMPTS, updated.getFailedAttempts());
        }
        activityRecorder.logActivity(userId, ActivityType.LOGIN, SYSTEM_ACTOR, null, metadata);
        securityMetrics.recordLogin(success);

        if (lockedByThisAttempt.get()) {
            securityMetrics.recordAccountLocked();
            log.warn("Account locked for user {} after {} failed login attempts",
                Encode.forJava(userId), updated.getFailedAttempts());
            alertManager.createAlert(
                AlertType.ACCOUNT_LOCKED,
                AlertSeverity.HIGH,
                "Account locked for user " + userId,
                "Account locked due to " + updated.getFailedAttempts() + " failed login attempts",
                userId,
                ipAddress);
        }
        return updated;
    }

    /**
     * Assign a role. Requires SYSTEM_ADMIN on the caller. An existing record keeps its
     * lock state and login history; only role, permissions and security level change.
     */
    public boolean assignRole(String userId, Role role, String assignedBy) {
        if (!checkPermission(assignedBy, Permission.SYSTEM_ADMIN)) {
            return false;
        }
        RoleDefinition definition = permissionRegistry.definition(role);
        Instant now = clock.instant();

        users.compute(userId, (id, current) -> current == null
            ? UserAccess.forRole(id, definition, properties.getSessionTimeout(), now)
            : current.toBuilder()
                .role(role)
                .permissions(definition.permissions())
                .securityLevel(definition.securityLevel())
                .build());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("new_role", role.getCode());
        metadata.put("assigned_by", assignedBy);
        metadata.put(ActivityMetadata.TARGET_USER, userId);
        activityRecorder.logActivity(assignedBy, ActivityType.ROLE_CHANGE, "user", userId, metadata);

        log.info("Role {} assigned to user {} by {}", role, Encode.forJava(userId), Encode.forJava(assignedBy));
        return true;
    }

    /**
     * @throws com.accessmonitoring.domain.exception.UnknownRoleException if the name is unknown
     */
    public boolean assignRole(String userId, String roleName, String assignedBy) {
        return assignRole(userId, permissionRegistry.resolve(roleName), assignedBy);
    }

    /**
     * Remove one permission from a user's record. Requires SYSTEM_ADMIN on the caller.
     *
     * @return false if the caller is not allowed, the user is unknown, or the user did not
     *         hold the permission
     */
    public boolean revokePermission(String userId, Permission permission, String revokedBy) {
        if (!checkPermission(revokedBy, Permission.SYSTEM_ADMIN)) {
            return false;
        }

        AtomicBoolean removed = new AtomicBoolean();
        users.computeIfPresent(userId, (id, current) -> {
            if (!current.getPermissions().contains(permission)) {
                return current;
            }
            removed.set(true);
            return current.withoutPermission(permission);
        });

        if (!removed.get()) {
            return false;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("revoked_permission", permission.getCode());
        metadata.put("revoked_by", revokedBy);
        metadata.put(ActivityMetadata.TARGET_USER, userId);
        activityRecorder.logActivity(revokedBy, ActivityType.PERMISSION_CHANGE, "user", userId, metadata);

        log.info("Permission {} revoked from user {} by {}", permission, Encode.forJava(userId), Encode.forJava(revokedBy));
        return true;
    }

    /**
     * Clear the lock and failed-attempt counter. Requires SYSTEM_ADMIN or SECURITY_ADMIN
     * on the caller.
     */
    public boolean unlock(String userId, String unlockedBy) {
        Permission required = isAuthorized(unlockedBy, Permission.SYSTEM_ADMIN)
            ? Permission.SYSTEM_ADMIN
            : Permission.SECURITY_ADMIN;
        if (!checkPermission(unlockedBy, required)) {
            return false;
        }

        AtomicBoolean unlocked = new AtomicBoolean();
        users.computeIfPresent(userId, (id, current) -> {
            if (!current.isLocked()) {
                return current;
            }
            unlocked.set(true);
            return current.withLocked(false).withFailedAttempts(0);
        });

        if (!unlocked.get()) {
            return false;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("unlocked_by", unlockedBy);
        metadata.put(ActivityMetadata.TARGET_USER, userId);
        activityRecorder.logActivity(unlockedBy, ActivityType.PERMISSION_CHANGE, "user", userId, metadata);

        log.info("Account of user {} unlocked by {}", Encode.forJava(userId), Encode.forJava(unlockedBy));
        return true;
    }

    /**
     * Create a record for a user with the given role if none exists. Used for start-up
     * provisioning; no caller permission is checked.
     */
    public UserAccess provision(String userId, Role role) {
        Instant now = clock.instant();
        AtomicBoolean created = new AtomicBoolean();
        UserAccess access = users.computeIfAbsent(userId, id -> {
            created.set(true);
            return UserAccess.forRole(id, permissionRegistry.definition(role), properties.getSessionTimeout(), now);
        });

        if (created.get()) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("new_role", role.getCode());
            metadata.put(ActivityMetadata.TARGET_USER, userId);
            activityRecorder.logActivity(SYSTEM_ACTOR, ActivityType.ACCOUNT_CREATION, "user", userId, metadata);
            log.info("Provisioned user {} with role {}", Encode.forJava(userId), role);
        }
        return access;
    }

    public Optional<UserAccess> find(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    public List<UserAccess> snapshot() {
        List<UserAccess> all = new ArrayList<>(users.values());
        all.sort(Comparator.comparing(UserAccess::getUserId));
        return all;
    }

    /**
     * Reload records from a snapshot. Records already present are kept.
     */
    public void restore(Collection<UserAccess> records) {
        records.forEach(record -> users.putIfAbsent(record.getUserId(), record));
    }

    private AccessDecision evaluateSafely(
            String userId, Permission permission, String resourceType, String resourceId) {
        try {
            return evaluate(userId, permission, resourceType, resourceId);
        } catch (RuntimeException e) {
            log.error("Error evaluating {} for user {}", permission,
                Encode.forJava(String.valueOf(userId)), e);
            return AccessDecision.deny(DenialReason.INTERNAL_ERROR);
        }
    }

    private AccessDecision evaluate(String userId, Permission permission, String resourceType, String resourceId) {
        UserAccess access = userId != null ? users.get(userId) : null;
        if (access == null) {
            return AccessDecision.deny(DenialReason.NO_ACCESS_RECORD);
        }
        if (access.isLocked()) {
            return AccessDecision.deny(DenialReason.ACCOUNT_LOCKED);
        }
        if (!access.hasPermission(permission)) {
            return AccessDecision.deny(DenialReason.PERMISSION_NOT_GRANTED);
        }
        if (resourceType != null && resourceId != null
                && !resourceAllowed(access, permission, resourceType, resourceId)) {
            return AccessDecision.deny(DenialReason.RESOURCE_SCOPE);
        }

        ConsentType requiredConsent = properties.getConsent().getGatedPermissions().get(permission);
        if (requiredConsent != null) {
            String subject = "user".equals(resourceType) && resourceId != null ? resourceId : userId;
            if (!consentStore.hasConsent(subject, requiredConsent)) {
                return AccessDecision.deny(DenialReason.CONSENT_MISSING);
            }
        }
        return AccessDecision.GRANTED;
    }

    private boolean resourceAllowed(UserAccess access, Permission permission, String resourceType, String resourceId) {
        if ("bank_account".equals(resourceType)) {
            return complianceCollaborator.validateBankDataAccess(access.getUserId(), resourceId, permission);
        }
        if ("user".equals(resourceType)) {
            return access.getUserId().equals(resourceId) || access.hasPermission(Permission.SYSTEM_ADMIN);
        }
        return true;
    }

    private void recordViolation(
            String userId, Permission permission, String resourceType, String resourceId, DenialReason reason) {

        String description = reason == DenialReason.ACCOUNT_LOCKED
            ? "Locked user attempted " + permission.getCode()
            : "Unauthorized access attempt: " + permission.getCode();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ActivityMetadata.DESCRIPTION, description);
        metadata.put(ActivityMetadata.PERMISSION, permission.getCode());
        metadata.put(ActivityMetadata.REASON, reason.getCode());
        activityRecorder.logActivity(userId, ActivityType.SECURITY_VIOLATION, resourceType, resourceId, metadata);

        alertManager.createAlert(
            AlertType.SECURITY_VIOLATION,
            AlertSeverity.HIGH,
            "Security violation by user " + userId,
            description,
            userId,
            ActivityMetadata.UNKNOWN,
            Map.of(ActivityMetadata.PERMISSION, permission.getCode(), ActivityMetadata.REASON, reason.getCode()));
    }
}
