package com.accessmonitoring.domain.activity;

import com.accessmonitoring.domain.access.Permission;
import com.accessmonitoring.domain.exception.UnknownPermissionException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A single access-relevant action. Immutable once created.
 *
 * @since 1.0.0
 */
@Value
public class Activity {

    String activityId;
    String userId;
    ActivityType activityType;
    String resourceType;
    String resourceId;
    String ipAddress;
    String userAgent;
    Instant timestamp;
    Map<String, Object> metadata;
    double riskScore;

    @Builder
    private Activity(
            String activityId,
            String userId,
            ActivityType activityType,
            String resourceType,
            String resourceId,
            String ipAddress,
            String userAgent,
            Instant timestamp,
            Map<String, Object> metadata,
            double riskScore) {

        this.activityId = activityId;
        this.userId = userId;
        this.activityType = activityType;
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.ipAddress = ipAddress != null ? ipAddress : ActivityMetadata.UNKNOWN;
        this.userAgent = userAgent != null ? userAgent : ActivityMetadata.UNKNOWN;
        this.timestamp = timestamp;
        this.metadata = metadata != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
            : Map.of();
        this.riskScore = riskScore;
    }

    /**
     * Permission recorded by a permission check, if any and if recognizable.
     */
    public Optional<Permission> permission() {
        Object value = metadata.get(ActivityMetadata.PERMISSION);
        if (value instanceof Permission permission) {
            return Optional.of(permission);
        }
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Permission.fromCode(value.toString()));
        } catch (UnknownPermissionException e) {
            return Optional.empty();
        }
    }

    /**
     * True for a permission check that was granted.
     */
    public boolean isGrantedAccess() {
        return activityType == ActivityType.DATA_ACCESS
            && Boolean.TRUE.equals(metadata.get(ActivityMetadata.GRANTED));
    }

    public int failedAttempts() {
        return metadataInt(metadata, ActivityMetadata.FAILED_ATTEMPTS);
    }

    public boolean isFailedLogin() {
        return activityType == ActivityType.LOGIN && failedAttempts() > 0;
    }

    /**
     * Reads an integer metadata value, tolerating numbers and numeric strings. Values
     * outside the {@code int} range saturate; anything else counts as zero.
     */
    public static int metadataInt(Map<String, ?> metadata, String key) {
        if (metadata == null) {
            return 0;
        }
        Object value = metadata.get(key);
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return saturatedInt(((Number) value).longValue());
        }
        if (value instanceof Number number) {
            return saturatedInt((long) number.doubleValue());
        }
        if (value instanceof String text) {
            try {
                return saturatedInt(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    private static int saturatedInt(long value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }
}
