package com.accessmonitoring.infrastructure.audit;

/**
 * Durable audit trail. Fire-and-forget: implementations must not throw back into the
 * caller and must not block the request path.
 */
public interface AuditSink {
    void logEvent(AuditEvent event);
}
