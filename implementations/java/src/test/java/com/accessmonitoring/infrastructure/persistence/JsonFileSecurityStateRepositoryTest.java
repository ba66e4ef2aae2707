package com.accessmonitoring.infrastructure.persistence;

import com.accessmonitoring.domain.access.Permission;
import com.accessmonitoring.domain.access.PermissionRegistry;
import com.accessmonitoring.domain.access.Role;
import com.accessmonitoring.domain.access.UserAccess;
import com.accessmonitoring.domain.alert.AlertSeverity;
import com.accessmonitoring.domain.alert.AlertStatus;
import com.accessmonitoring.domain.alert.AlertType;
import com.accessmonitoring.domain.alert.SecurityAlert;
import com.accessmonitoring.domain.incident.BreachIncident;
import com.accessmonitoring.domain.incident.IncidentStatus;
import com.accessmonitoring.domain.incident.IncidentType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileSecurityStateRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-05T12:00:00Z");

    @TempDir
    Path dir;

    @Test
    void missingFileLoadsNothing() {
        JsonFileSecurityStateRepository repository =
            new JsonFileSecurityStateRepository(dir.resolve("state.json"), new ObjectMapper());

        assertThat(repository.load()).isEmpty();
    }

    @Test
    void savedStateIsRestored() {
        Path file = dir.resolve("nested/state.json");
        JsonFileSecurityStateRepository repository = new JsonFileSecurityStateRepository(file, new ObjectMapper());

        UserAccess alice = UserAccess.forRole("alice", new PermissionRegistry().definition(Role.ANALYST),
                UserAccess.DEFAULT_SESSION_TIMEOUT, NOW)
            .withoutPermission(Permission.VIEW_BALANCES)
            .withFailedAttempts(5)
            .withLocked(true);
        SecurityAlert alert = SecurityAlert.builder()
            .alertId("alert_1")
            .alertType(AlertType.ACCOUNT_LOCKED)
            .severity(AlertSeverity.HIGH)
            .title("Account locked")
            .description("alice locked after 5 failed attempts")
            .userId("alice")
            .ipAddress("203.0.113.7")
            .timestamp(NOW)
            .status(AlertStatus.INVESTIGATING)
            .evidence(Map.of("failed_attempts", 5))
            .remediationSteps(List.of("Verify identity"))
            .build();
        BreachIncident incident = BreachIncident.builder()
            .incidentId("breach_1")
            .incidentType(IncidentType.EXCESSIVE_DATA_EXPORT)
            .severity(AlertSeverity.CRITICAL)
            .description("exports")
            .affectedUsers(List.of("u2"))
            .affectedData(List.of("export_bank_data"))
            .detectedAt(NOW)
            .status(IncidentStatus.CONTAINED)
            .containmentActions(BreachIncident.CONTAINMENT_CHECKLIST)
            .notificationSent(true)
            .evidenceActivityIds(List.of("activity_1", "activity_2"))
            .build();

        repository.save(new SecurityStateSnapshot(List.of(alice), List.of(alert), List.of(incident), NOW));

        assertThat(file).exists();
        assertThat(file.resolveSibling("state.json.tmp")).doesNotExist();

        SecurityStateSnapshot loaded = new JsonFileSecurityStateRepository(file, new ObjectMapper()).load().orElseThrow();
        assertThat(loaded.savedAt()).isEqualTo(NOW);
        assertThat(loaded.users()).singleElement().satisfies(user -> {
            assertThat(user.getRole()).isEqualTo(Role.ANALYST);
            assertThat(user.isLocked()).isTrue();
            assertThat(user.getFailedAttempts()).isEqualTo(5);
            assertThat(user.getPermissions()).doesNotContain(Permission.VIEW_BALANCES).contains(Permission.READ_BANK_DATA);
            assertThat(user.getSessionTimeout()).isEqualTo(UserAccess.DEFAULT_SESSION_TIMEOUT);
        });
        assertThat(loaded.alerts()).singleElement().satisfies(a -> {
            assertThat(a.getStatus()).isEqualTo(AlertStatus.INVESTIGATING);
            assertThat(a.getTimestamp()).isEqualTo(NOW);
            assertThat(a.getEvidence()).containsEntry("failed_attempts", 5);
        });
        assertThat(loaded.incidents()).singleElement().satisfies(i -> {
            assertThat(i.getStatus()).isEqualTo(IncidentStatus.CONTAINED);
            assertThat(i.isNotificationSent()).isTrue();
            assertThat(i.isRegulatoryReporting()).isFalse();
            assertThat(i.getEvidenceActivityIds()).containsExactly("activity_1", "activity_2");
        });
    }

    @Test
    void corruptFileIsReported() throws Exception {
        Path file = dir.resolve("state.json");
        Files.writeString(file, "{ not json");

        JsonFileSecurityStateRepository repository = new JsonFileSecurityStateRepository(file, new ObjectMapper());

        assertThatThrownBy(repository::load)
            .isInstanceOf(SecurityStatePersistenceException.class)
            .hasMessageContaining("state.json");
    }
}
