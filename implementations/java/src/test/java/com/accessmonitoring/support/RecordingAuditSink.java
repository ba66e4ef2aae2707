package com.accessmonitoring.support;

import com.accessmonitoring.infrastructure.audit.AuditEvent;
import com.accessmonitoring.infrastructure.audit.AuditSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingAuditSink implements AuditSink {

    private final List<AuditEvent> events = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    @Override
    public void logEvent(AuditEvent event) {
        if (failing) {
            throw new IllegalStateException("audit store unavailable");
        }
        events.add(event);
    }

    public void failWrites() {
        failing = true;
    }

    public List<AuditEvent> events() {
        return List.copyOf(events);
    }

    public List<AuditEvent> eventsWithAction(String action) {
        return events.stream().filter(e -> action.equals(e.getAction())).toList();
    }
}
