package com.accessmonitoring.application;

import com.accessmonitoring.domain.alert.AlertSeverity;
import com.accessmonitoring.domain.alert.AlertStatus;
import com.accessmonitoring.domain.alert.AlertType;
import com.accessmonitoring.domain.alert.SecurityAlert;
import com.accessmonitoring.domain.exception.AlertNotFoundException;
import com.accessmonitoring.domain.exception.InvalidStatusTransitionException;
import com.accessmonitoring.support.SecurityTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Security alert manager")
class SecurityAlertManagerTest {

    private SecurityTestFixture fixture;
    private SecurityAlertManager manager;

    @BeforeEach
    void setUp() {
        fixture = new SecurityTestFixture();
        manager = fixture.alertManager;
    }

    private SecurityAlert raise(AlertType type, AlertSeverity severity) {
        return manager.createAlert(type, severity, "title", "description", "alice", "203.0.113.7");
    }

    @Nested
    @DisplayName("Creation")
    class Creation {

        @Test
        @DisplayName("New alerts are open, timestamped and carry their remediation")
        void newAlert() {
            SecurityAlert alert = manager.createAlert(AlertType.DATA_BREACH, AlertSeverity.CRITICAL,
                "Breach", "Too many exports", "u2", null, Map.of("incident_id", "breach_1"));

            assertThat(alert.getAlertId()).startsWith("alert_");
            assertThat(alert.getStatus()).isEqualTo(AlertStatus.OPEN);
            assertThat(alert.getTimestamp()).isEqualTo(SecurityTestFixture.START);
            assertThat(alert.getIpAddress()).isEqualTo("unknown");
            assertThat(alert.getEvidence())
                .containsEntry("incident_id", "breach_1")
                .containsEntry("alert_type", "data_breach");
            assertThat(alert.getRemediationSteps()).isEqualTo(AlertType.DATA_BREACH.remediationSteps());
            assertThat(manager.find(alert.getAlertId())).contains(alert);
        }

        @Test
        @DisplayName("Alerts are audited and counted")
        void auditedAndCounted() {
            raise(AlertType.RAPID_ACTIVITY, AlertSeverity.HIGH);

            assertThat(fixture.auditSink.eventsWithAction("SECURITY_ALERT")).hasSize(1);
            assertThat(fixture.meterRegistry.counter("security.alerts.created",
                "type", "rapid_activity", "severity", "high").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("A failing audit sink does not lose the alert")
        void auditFailureContained() {
            fixture.auditSink.failWrites();

            SecurityAlert alert = raise(AlertType.SECURITY_VIOLATION, AlertSeverity.HIGH);

            assertThat(manager.find(alert.getAlertId())).isPresent();
        }

        @Test
        @DisplayName("Severity evidence does not depend on the default locale")
        void severityEvidenceIgnoresLocale() {
            Locale previous = Locale.getDefault();
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            try {
                SecurityAlert alert = raise(AlertType.SECURITY_VIOLATION, AlertSeverity.CRITICAL);

                assertThat(alert.getEvidence()).containsEntry("severity", "critical");
            } finally {
                Locale.setDefault(previous);
            }
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        void forwardTransitions() {
            SecurityAlert alert = raise(AlertType.UNUSUAL_ACTIVITY, AlertSeverity.MEDIUM);

            manager.transition(alert.getAlertId(), AlertStatus.INVESTIGATING);
            SecurityAlert resolved = manager.transition(alert.getAlertId(), AlertStatus.RESOLVED);

            assertThat(resolved.getStatus()).isEqualTo(AlertStatus.RESOLVED);
            assertThat(manager.countOpen()).isZero();
            assertThat(manager.findByStatus(AlertStatus.RESOLVED)).containsExactly(resolved);
        }

        @Test
        @DisplayName("Terminal alerts cannot be reopened")
        void terminalIsFinal() {
            SecurityAlert alert = raise(AlertType.UNUSUAL_ACTIVITY, AlertSeverity.MEDIUM);
            manager.transition(alert.getAlertId(), AlertStatus.FALSE_POSITIVE);

            assertThatThrownBy(() -> manager.transition(alert.getAlertId(), AlertStatus.OPEN))
                .isInstanceOf(InvalidStatusTransitionException.class);
            assertThatThrownBy(() -> manager.transition(alert.getAlertId(), AlertStatus.RESOLVED))
                .isInstanceOf(InvalidStatusTransitionException.class);
            assertThat(manager.find(alert.getAlertId())).get()
                .extracting(SecurityAlert::getStatus).isEqualTo(AlertStatus.FALSE_POSITIVE);
        }

        @Test
        void unknownAlert() {
            assertThatThrownBy(() -> manager.transition("alert_missing", AlertStatus.RESOLVED))
                .isInstanceOf(AlertNotFoundException.class);
        }
    }

    @Test
    @DisplayName("Counts by severity and open state")
    void counts() {
        raise(AlertType.DATA_BREACH, AlertSeverity.CRITICAL);
        raise(AlertType.DATA_BREACH, AlertSeverity.CRITICAL);
        SecurityAlert high = raise(AlertType.ACCOUNT_LOCKED, AlertSeverity.HIGH);
        manager.transition(high.getAlertId(), AlertStatus.RESOLVED);

        assertThat(manager.size()).isEqualTo(3);
        assertThat(manager.countBySeverity(AlertSeverity.CRITICAL)).isEqualTo(2);
        assertThat(manager.countOpen()).isEqualTo(2);
        assertThat(manager.findByType(AlertType.ACCOUNT_LOCKED)).hasSize(1);
    }
}
