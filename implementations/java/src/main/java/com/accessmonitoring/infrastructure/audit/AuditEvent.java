package com.accessmonitoring.infrastructure.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Security-relevant event handed to the durable audit trail.
 */
@Value
@Builder
public class AuditEvent {
    AuditCategory category;
    String action;
    AuditSeverity severity;
    String description;
    String resourceType;
    String resourceId;
    String principalId;
    String ipAddress;
    Instant occurredAt;
    Map<String, Object> metadata;
}
