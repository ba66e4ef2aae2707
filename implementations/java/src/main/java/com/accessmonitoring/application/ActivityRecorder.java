package com.accessmonitoring.application;

import com.accessmonitoring.domain.activity.Activity;
import com.accessmonitoring.domain.activity.ActivityLog;
import com.accessmonitoring.domain.activity.ActivityMetadata;
import com.accessmonitoring.domain.activity.ActivityType;
import com.accessmonitoring.domain.activity.BoundedActivityQueue;
import com.accessmonitoring.infrastructure.audit.AuditCategory;
import com.accessmonitoring.infrastructure.audit.AuditEvent;
import com.accessmonitoring.infrastructure.audit.AuditSeverity;
import com.accessmonitoring.infrastructure.audit.AuditSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Records access-relevant actions.
 *
 * <p>Each activity is scored, appended to the shared {@link ActivityLog}, offered to the
 * activity monitor's bounded queue and forwarded to the audit sink. The audit write is
 * fire-and-forget; a failing sink never fails the recording.
 *
 * @since 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActivityRecorder {

    private final ActivityLog activityLog;
    private final BoundedActivityQueue activityQueue;
    private final RiskScorer riskScorer;
    private final AuditSink auditSink;
    private final Clock clock;

    public Activity logActivity(
            String userId,
            ActivityType activityType,
            String resourceType,
            String resourceId,
            Map<String, ?> metadata) {

        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(activityType, "activityType");

        Instant now = clock.instant();
        String ipAddress = metadataString(metadata, ActivityMetadata.IP_ADDRESS);
        String userAgent = metadataString(metadata, ActivityMetadata.USER_AGENT);

        Map<String, Object> copied = metadata != null ? new LinkedHashMap<>(metadata) : Map.of();

        Activity activity = Activity.builder()
            .activityId("activity_" + UUID.randomUUID())
            .userId(userId)
            .activityType(activityType)
            .resourceType(resourceType)
            .resourceId(resourceId)
            .ipAddress(ipAddress)
            .userAgent(userAgent)
            .timestamp(now)
            .metadata(copied)
            .riskScore(riskScorer.score(activityType, metadata, ipAddress, now))
            .build();

        activityLog.append(activity);

        Activity evicted = activityQueue.offer(activity);
        if (evicted != null) {
            long dropped = activityQueue.droppedCount();
            if (dropped == 1 || dropped % 1000 == 0) {
                log.warn("Activity queue full (capacity {}); dropped oldest activity, {} dropped so far",
                    activityQueue.capacity(), dropped);
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Activity recorded: id={} user={} type={} risk={}",
                activity.getActivityId(), Encode.forJava(userId), activityType, activity.getRiskScore());
        }

        forwardToAudit(activity);
        return activity;
    }

    private void forwardToAudit(Activity activity) {
        try {
            auditSink.logEvent(AuditEvent.builder()
                .category(categoryOf(activity.getActivityType()))
                .action(activity.getActivityType().name())
                .severity(activity.getActivityType() == ActivityType.SECURITY_VIOLATION
                    ? AuditSeverity.WARNING
                    : AuditSeverity.INFO)
                .description("User activity: " + activity.getActivityType().name().toLowerCase(Locale.ROOT))
                .resourceType(activity.getResourceType())
                .resourceId(activity.getResourceId())
                .principalId(activity.getUserId())
                .ipAddress(activity.getIpAddress())
                .occurredAt(activity.getTimestamp())
                .metadata(activity.getMetadata())
                .build());
        } catch (RuntimeException e) {
            log.error("Audit sink rejected activity {}", activity.getActivityId(), e);
        }
    }

    private static AuditCategory categoryOf(ActivityType type) {
        return switch (type) {
            case LOGIN, LOGOUT -> AuditCategory.AUTHENTICATION;
            case DATA_ACCESS, DATA_MODIFICATION -> AuditCategory.DATA_ACCESS;
            case ACCOUNT_CREATION, ACCOUNT_DELETION, PERMISSION_CHANGE, ROLE_CHANGE -> AuditCategory.ACCESS_CONTROL;
            case SUSPICIOUS_ACTIVITY, SECURITY_VIOLATION -> AuditCategory.SECURITY;
        };
    }

    private static String metadataString(Map<String, ?> metadata, String key) {
        if (metadata == null) {
            return ActivityMetadata.UNKNOWN;
        }
        Object value = metadata.get(key);
        return value != null ? value.toString() : ActivityMetadata.UNKNOWN;
    }
}
