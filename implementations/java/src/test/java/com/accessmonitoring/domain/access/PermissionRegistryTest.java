package com.accessmonitoring.domain.access;

import com.accessmonitoring.domain.exception.AccessValidationException;
import com.accessmonitoring.domain.exception.UnknownPermissionException;
import com.accessmonitoring.domain.exception.UnknownRoleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;

import static com.accessmonitoring.domain.access.Permission.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Permission registry")
class PermissionRegistryTest {

    private final PermissionRegistry registry = new PermissionRegistry();

    @Nested
    @DisplayName("Role table")
    class RoleTable {

        @Test
        @DisplayName("Admin holds every permission at critical level")
        void adminHoldsEverything() {
            assertThat(registry.rolePermissions(Role.ADMIN)).containsExactlyInAnyOrder(Permission.values());
            assertThat(registry.securityLevel(Role.ADMIN)).isEqualTo(SecurityLevel.CRITICAL);
        }

        @Test
        @DisplayName("Support can read users and balances only")
        void supportPermissions() {
            assertThat(registry.rolePermissions(Role.SUPPORT))
                .containsExactlyInAnyOrder(READ_USER, READ_BANK_DATA, VIEW_BALANCES);
            assertThat(registry.securityLevel(Role.SUPPORT)).isEqualTo(SecurityLevel.MEDIUM);
        }

        @Test
        @DisplayName("Only admin may export bank data")
        void exportIsAdminOnly() {
            for (Role role : Role.values()) {
                assertThat(registry.rolePermissions(role).contains(EXPORT_BANK_DATA))
                    .as("role %s", role)
                    .isEqualTo(role == Role.ADMIN);
            }
        }

        @ParameterizedTest
        @EnumSource(Role.class)
        @DisplayName("Every role has a definition")
        void everyRoleDefined(Role role) {
            RoleDefinition definition = registry.definition(role);
            assertThat(definition.role()).isEqualTo(role);
            assertThat(definition.permissions()).isNotEmpty();
        }
    }

    @Nested
    @DisplayName("Name resolution")
    class Resolution {

        @Test
        void resolvesCodesAndConstantNames() {
            assertThat(registry.resolve("read_only")).isEqualTo(Role.READ_ONLY);
            assertThat(registry.resolve(" ADMIN ")).isEqualTo(Role.ADMIN);
            assertThat(registry.resolvePermission("export_bank_data")).isEqualTo(EXPORT_BANK_DATA);
            assertThat(registry.resolvePermission("VIEW_BALANCES")).isEqualTo(VIEW_BALANCES);
        }

        @Test
        @DisplayName("Unknown names fail explicitly")
        void unknownNamesFail() {
            assertThatThrownBy(() -> registry.resolve("superuser"))
                .isInstanceOf(UnknownRoleException.class)
                .isInstanceOf(AccessValidationException.class);
            assertThatThrownBy(() -> registry.resolvePermission("launch_missiles"))
                .isInstanceOf(UnknownPermissionException.class);
            assertThatThrownBy(() -> registry.resolve(null))
                .isInstanceOf(UnknownRoleException.class);
        }
    }

    @Nested
    @DisplayName("User access records")
    class UserAccessRecords {

        @Test
        @DisplayName("A locked record grants nothing")
        void lockedRecordGrantsNothing() {
            UserAccess access = UserAccess.forRole("u", registry.definition(Role.ADMIN),
                UserAccess.DEFAULT_SESSION_TIMEOUT, Instant.EPOCH)
                .withLocked(true);

            for (Permission permission : Permission.values()) {
                assertThat(access.hasPermission(permission)).isFalse();
            }
        }

        @Test
        @DisplayName("Revoking leaves the role's set untouched")
        void revokeDoesNotTouchRole() {
            UserAccess access = UserAccess.forRole("u", registry.definition(Role.USER),
                UserAccess.DEFAULT_SESSION_TIMEOUT, Instant.EPOCH);

            UserAccess revoked = access.withoutPermission(VIEW_BALANCES);

            assertThat(revoked.hasPermission(VIEW_BALANCES)).isFalse();
            assertThat(access.hasPermission(VIEW_BALANCES)).isTrue();
            assertThat(registry.rolePermissions(Role.USER)).contains(VIEW_BALANCES);
        }
    }
}
