package com.accessmonitoring.integration;

import com.accessmonitoring.application.UserAccessStore;
import com.accessmonitoring.domain.access.Permission;
import com.accessmonitoring.domain.access.Role;
import com.accessmonitoring.infrastructure.audit.AuditCategory;
import com.accessmonitoring.infrastructure.audit.AuditOutboxRelay;
import com.accessmonitoring.infrastructure.audit.AuditSeverity;
import com.accessmonitoring.infrastructure.audit.OutboxEvent;
import com.accessmonitoring.infrastructure.audit.OutboxEventRepository;
import com.accessmonitoring.infrastructure.monitoring.ActivityMonitor;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class AccessMonitoringIntegrationTest {

    @Autowired
    UserAccessStore userAccessStore;

    @Autowired
    ActivityMonitor activityMonitor;

    @Autowired
    MeterRegistry meterRegistry;

    @Autowired
    OutboxEventRepository outboxEventRepository;

    @Autowired
    AuditOutboxRelay auditOutboxRelay;

    @Test
    void bootstrapAdminIsProvisioned() {
        assertEquals(Role.ADMIN, userAccessStore.find("root-admin").orElseThrow().getRole());
        assertFalse(activityMonitor.isAutoStartup());
        assertFalse(activityMonitor.isRunning());
    }

    @Test
    void permissionChecksAreTimed() {
        assertTrue(userAccessStore.checkPermission("root-admin", Permission.EXPORT_BANK_DATA));
        assertFalse(userAccessStore.checkPermission("nobody", Permission.EXPORT_BANK_DATA));

        assertNotNull(meterRegistry.find("security.authorization").tag("outcome", "granted").timer());
        assertNotNull(meterRegistry.find("security.authorization").tag("outcome", "denied").timer());
    }

    @Test
    void relayMarksOutboxRowsProcessed() {
        OutboxEvent saved = outboxEventRepository.save(OutboxEvent.builder()
                .category(AuditCategory.SECURITY)
                .action("SECURITY_ALERT")
                .severity(AuditSeverity.CRITICAL)
                .resourceType("alert")
                .resourceId("alert_test")
                .principalId("root-admin")
                .detail("{}")
                .createdAt(Instant.now())
                .processed(false)
                .build());

        assertTrue(auditOutboxRelay.publish() >= 1);

        assertTrue(outboxEventRepository.findById(saved.getId()).orElseThrow().isProcessed());
    }
}
