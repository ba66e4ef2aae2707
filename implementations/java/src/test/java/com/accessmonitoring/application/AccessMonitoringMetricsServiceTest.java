package com.accessmonitoring.application;

import com.accessmonitoring.domain.access.Permission;
import com.accessmonitoring.domain.access.Role;
import com.accessmonitoring.domain.consent.ConsentType;
import com.accessmonitoring.support.SecurityTestFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AccessMonitoringMetricsServiceTest {

    @Test
    @DisplayName("Metrics summarize users, alerts, activities and consents")
    void summary() {
        SecurityTestFixture fixture = new SecurityTestFixture();
        fixture.provision("root", Role.ADMIN);
        fixture.provision("ana", Role.ANALYST);
        for (int i = 0; i < 5; i++) {
            fixture.userAccessStore.recordLoginAttempt("bob", "203.0.113.7", "ua", false);
        }
        fixture.userAccessStore.checkPermission("ana", Permission.EXPORT_BANK_DATA);
        fixture.consentStore.manageConsent("ana", ConsentType.DATA_PROCESSING, true, null, null, null);
        fixture.clock.advance(Duration.ofMinutes(1));

        AccessControlMetrics metrics = fixture.metricsService.getMetrics();

        assertThat(metrics.users().total()).isEqualTo(3);
        assertThat(metrics.users().locked()).isEqualTo(1);
        assertThat(metrics.users().active()).isEqualTo(2);
        assertThat(metrics.users().roleDistribution())
            .containsEntry("admin", 1L).containsEntry("analyst", 1L).containsEntry("user", 1L);
        // account_locked + security_violation
        assertThat(metrics.security().totalAlerts()).isEqualTo(2);
        assertThat(metrics.security().openAlerts()).isEqualTo(2);
        assertThat(metrics.security().criticalAlerts()).isZero();
        // 2 provisions, 5 logins, 1 check, 1 violation
        assertThat(metrics.security().recentActivities()).isEqualTo(9);
        // failed logins three to five, and the violation
        assertThat(metrics.security().highRiskActivities()).isEqualTo(4);
        assertThat(metrics.consents().active()).isEqualTo(1);
        assertThat(metrics.incidents().total()).isZero();
        assertThat(metrics.lastUpdated()).isEqualTo(SecurityTestFixture.START.plus(Duration.ofMinutes(1)));
    }
}
