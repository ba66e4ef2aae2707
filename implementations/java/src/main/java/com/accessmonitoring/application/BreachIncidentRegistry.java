package com.accessmonitoring.application;

import com.accessmonitoring.config.PerformanceConfiguration.SecurityMetrics;
import com.accessmonitoring.domain.alert.AlertSeverity;
import com.accessmonitoring.domain.exception.IncidentNotFoundException;
import com.accessmonitoring.domain.exception.InvalidStatusTransitionException;
import com.accessmonitoring.domain.incident.BreachIncident;
import com.accessmonitoring.domain.incident.IncidentStatus;
import com.accessmonitoring.domain.incident.IncidentType;
import com.accessmonitoring.infrastructure.audit.AuditCategory;
import com.accessmonitoring.infrastructure.audit.AuditEvent;
import com.accessmonitoring.infrastructure.audit.AuditSeverity;
import com.accessmonitoring.infrastructure.audit.AuditSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holds breach incidents and their forward-only lifecycle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BreachIncidentRegistry {

    private final Map<String, BreachIncident> incidents = new ConcurrentHashMap<>();

    private final AuditSink auditSink;
    private final SecurityMetrics securityMetrics;
    private final Clock clock;

    public BreachIncident open(
            IncidentType type,
            String description,
            List<String> affectedUsers,
            List<String> affectedData,
            List<String> evidenceActivityIds) {

        if (affectedUsers == null || affectedUsers.isEmpty()) {
            throw new IllegalArgumentException("A breach incident needs at least one affected user");
        }

        BreachIncident incident = BreachIncident.builder()
            .incidentId("breach_" + UUID.randomUUID())
            .incidentType(type)
            .severity(AlertSeverity.CRITICAL)
            .description(description)
            .affectedUsers(List.copyOf(affectedUsers))
            .affectedData(List.copyOf(affectedData))
            .detectedAt(clock.instant())
            .status(IncidentStatus.DETECTED)
            .containmentActions(BreachIncident.CONTAINMENT_CHECKLIST)
            .notificationSent(false)
            .regulatoryReporting(false)
            .evidenceActivityIds(List.copyOf(evidenceActivityIds))
            .build();

        incidents.put(incident.getIncidentId(), incident);
        securityMetrics.recordIncident(type);

        log.error("BREACH INCIDENT [{}]: type={} users={} data={}",
            incident.getIncidentId(), type.getCode(), affectedUsers, affectedData);

        try {
            auditSink.logEvent(AuditEvent.builder()
                .category(AuditCategory.SECURITY)
                .action("DATA_BREACH_DETECTED")
                .severity(AuditSeverity.CRITICAL)
                .description("Data breach incident detected: " + incident.getIncidentId())
                .resourceType("data_breach")
                .resourceId(incident.getIncidentId())
                .principalId(affectedUsers.get(0))
                .occurredAt(incident.getDetectedAt())
                .metadata(Map.of("incident_type", type.getCode(), "severity", incident.getSeverity().name()))
                .build());
        } catch (RuntimeException e) {
            log.error("Audit sink rejected incident {}", incident.getIncidentId(), e);
        }

        return incident;
    }

    /**
     * @throws IncidentNotFoundException if no such incident exists
     * @throws InvalidStatusTransitionException if the move is not forward
     */
    public BreachIncident transition(String incidentId, IncidentStatus target) {
        AtomicReference<IncidentStatus> rejectedFrom = new AtomicReference<>();
        BreachIncident updated = update(incidentId, current -> {
            if (!current.getStatus().canTransitionTo(target)) {
                rejectedFrom.set(current.getStatus());
                return current;
            }
            return current.withStatus(target);
        });
        if (rejectedFrom.get() != null) {
            throw new InvalidStatusTransitionException("incident", incidentId, rejectedFrom.get(), target);
        }
        log.info("Breach incident {} moved to {}", incidentId, target);
        return updated;
    }

    public BreachIncident markNotificationSent(String incidentId) {
        return update(incidentId, current -> current.withNotificationSent(true));
    }

    public BreachIncident markRegulatoryReported(String incidentId) {
        return update(incidentId, current -> current.withRegulatoryReporting(true));
    }

    public Optional<BreachIncident> find(String incidentId) {
        return Optional.ofNullable(incidents.get(incidentId));
    }

    public List<BreachIncident> findAll() {
        List<BreachIncident> all = new ArrayList<>(incidents.values());
        all.sort(Comparator.comparing(BreachIncident::getDetectedAt));
        return all;
    }

    public long countOpen() {
        return incidents.values().stream().filter(BreachIncident::isOpen).count();
    }

    public int size() {
        return incidents.size();
    }

    public void restore(Collection<BreachIncident> snapshot) {
        snapshot.forEach(incident -> incidents.putIfAbsent(incident.getIncidentId(), incident));
    }

    private BreachIncident update(String incidentId, UnaryOperator<BreachIncident> change) {
        BreachIncident updated = incidents.computeIfPresent(incidentId, (id, current) -> change.apply(current));
        if (updated == null) {
            throw new IncidentNotFoundException(incidentId);
        }
        return updated;
    }
}
