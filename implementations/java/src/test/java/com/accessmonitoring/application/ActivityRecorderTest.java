package com.accessmonitoring.application;

import com.accessmonitoring.config.AccessMonitoringProperties;
import com.accessmonitoring.domain.activity.Activity;
import com.accessmonitoring.domain.activity.ActivityMetadata;
import com.accessmonitoring.domain.activity.ActivityType;
import com.accessmonitoring.infrastructure.audit.AuditCategory;
import com.accessmonitoring.infrastructure.audit.AuditEvent;
import com.accessmonitoring.support.SecurityTestFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Activity recorder")
class ActivityRecorderTest {

    @Test
    @DisplayName("Records to the log, the monitor queue and the audit sink")
    void recordsEverywhere() {
        SecurityTestFixture fixture = new SecurityTestFixture();

        Activity activity = fixture.activityRecorder.logActivity("alice", ActivityType.DATA_ACCESS,
            "bank_account", "acc-1", Map.of(ActivityMetadata.IP_ADDRESS, "203.0.113.7", "permission", "read_bank_data"));

        assertThat(activity.getActivityId()).startsWith("activity_");
        assertThat(activity.getIpAddress()).isEqualTo("203.0.113.7");
        assertThat(activity.getUserAgent()).isEqualTo(ActivityMetadata.UNKNOWN);
        assertThat(activity.getTimestamp()).isEqualTo(SecurityTestFixture.START);
        assertThat(activity.getRiskScore()).isEqualTo(2.0);
        assertThat(fixture.activityLog.snapshot()).containsExactly(activity);
        assertThat(fixture.activityQueue.drain()).containsExactly(activity);

        AuditEvent audit = fixture.auditSink.events().get(0);
        assertThat(audit.getCategory()).isEqualTo(AuditCategory.DATA_ACCESS);
        assertThat(audit.getPrincipalId()).isEqualTo("alice");
        assertThat(audit.getResourceId()).isEqualTo("acc-1");
    }

    @Test
    @DisplayName("Metadata is copied, not shared with the caller")
    void metadataCopied() {
        SecurityTestFixture fixture = new SecurityTestFixture();
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("note", "before");

        Activity activity = fixture.activityRecorder.logActivity("alice", ActivityType.LOGOUT, null, null, metadata);
        metadata.put("note", "after");

        assertThat(activity.getMetadata()).containsEntry("note", "before");
    }

    @Test
    @DisplayName("A failing audit sink does not fail the recording")
    void auditFailureIsContained() {
        SecurityTestFixture fixture = new SecurityTestFixture();
        fixture.auditSink.failWrites();

        Activity activity = fixture.activityRecorder.logActivity("alice", ActivityType.LOGIN, "system", null, null);

        assertThat(activity).isNotNull();
        assertThat(fixture.activityLog.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Queue overflow drops the oldest activity but keeps the log complete")
    void overflowDropsOldest() {
        AccessMonitoringProperties properties = new AccessMonitoringProperties();
        properties.getQueue().setCapacity(3);
        SecurityTestFixture fixture = new SecurityTestFixture(properties);

        for (int i = 0; i < 5; i++) {
            fixture.activityRecorder.logActivity("alice", ActivityType.DATA_ACCESS, "doc", "d" + i, Map.of());
        }

        assertThat(fixture.activityQueue.droppedCount()).isEqualTo(2);
        assertThat(fixture.activityQueue.drain()).extracting(Activity::getResourceId).containsExactly("d2", "d3", "d4");
        assertThat(fixture.activityLog.size()).isEqualTo(5);
    }
}
