package com.accessmonitoring.application;

import com.accessmonitoring.config.PerformanceConfiguration.SecurityMetrics;
import com.accessmonitoring.domain.alert.AlertSeverity;
import com.accessmonitoring.domain.alert.AlertStatus;
import com.accessmonitoring.domain.alert.AlertType;
import com.accessmonitoring.domain.alert.SecurityAlert;
import com.accessmonitoring.domain.exception.AlertNotFoundException;
import com.accessmonitoring.domain.exception.InvalidStatusTransitionException;
import com.accessmonitoring.infrastructure.audit.AuditCategory;
import com.accessmonitoring.infrastructure.audit.AuditEvent;
import com.accessmonitoring.infrastructure.audit.AuditSeverity;
import com.accessmonitoring.infrastructure.audit.AuditSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Creates security alerts and enforces their one-way status lifecycle.
 *
 * <p>Alerts are immutable; {@link #transition} swaps in a copy under the map's per-key
 * lock, so concurrent transitions of the same alert are serialized and a terminal alert
 * can never be reopened.
 *
 * @since 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SecurityAlertManager {

    private final Map<String, SecurityAlert> alerts = new ConcurrentHashMap<>();

    private final AuditSink auditSink;
    private final SecurityMetrics securityMetrics;
    private final Clock clock;

    public SecurityAlert createAlert(
            AlertType type,
            AlertSeverity severity,
            String title,
            String description,
            String userId,
            String ipAddress) {
        return createAlert(type, severity, title, description, userId, ipAddress, Map.of());
    }

    public SecurityAlert createAlert(
            AlertType type,
            AlertSeverity severity,
            String title,
            String description,
            String userId,
            String ipAddress,
            Map<String, ?> evidence) {

        Map<String, Object> fullEvidence = new LinkedHashMap<>();
        fullEvidence.put("alert_type", type.getCode());
        fullEvidence.put("severity", severity.name().toLowerCase(Locale.ROOT));
        if (evidence != null) {
            fullEvidence.putAll(evidence);
        }

        SecurityAlert alert = SecurityAlert.builder()
            .alertId("alert_" + UUID.randomUUID())
            .alertType(type)
            .severity(severity)
            .title(title)
            .description(description)
            .userId(userId)
            .ipAddress(ipAddress != null ? ipAddress : "unknown")
            .timestamp(clock.instant())
            .status(AlertStatus.OPEN)
            .evidence(Collections.unmodifiableMap(fullEvidence))
            .remediationSteps(type.remediationSteps())
            .build();

        alerts.put(alert.getAlertId(), alert);
        securityMetrics.recordAlert(type, severity);

        log.warn("SECURITY ALERT [{}]: type={} severity={} user={} - {}",
            alert.getAlertId(), type.getCode(), severity,
            Encode.forJava(String.valueOf(userId)), Encode.forJava(String.valueOf(title)));

        try {
            auditSink.logEvent(AuditEvent.builder()
                .category(AuditCategory.SECURITY)
                .action("SECURITY_ALERT")
                .severity(severity == AlertSeverity.LOW || severity == AlertSeverity.MEDIUM
                    ? AuditSeverity.WARNING
                    : AuditSeverity.ERROR)
                .description("Security alert: " + title)
                .resourceType("security_alert")
                .resourceId(alert.getAlertId())
                .principalId(userId)
                .ipAddress(alert.getIpAddress())
                .occurredAt(alert.getTimestamp())
                .metadata(Map.of("alert_type", type.getCode(), "severity", severity.name()))
                .build());
        } catch (RuntimeException e) {
            log.error("Audit sink rejected alert {}", alert.getAlertId(), e);
        }

        return alert;
    }

    /**
     * Move an alert forward in its lifecycle.
     *
     * @throws AlertNotFoundException if no such alert exists
     * @throws InvalidStatusTransitionException if the move is not forward
     */
    public SecurityAlert transition(String alertId, AlertStatus target) {
        AtomicReference<AlertStatus> rejectedFrom = new AtomicReference<>();
        SecurityAlert updated = alerts.computeIfPresent(alertId, (id, current) -> {
            if (!current.getStatus().canTransitionTo(target)) {
                rejectedFrom.set(current.getStatus());
                return current;
            }
            return current.withStatus(target);
        });

        if (updated == null) {
            throw new AlertNotFoundException(alertId);
        }
        if (rejectedFrom.get() != null) {
            throw new InvalidStatusTransitionException("alert", alertId, rejectedFrom.get(), target);
        }

        log.info("Security alert {} moved to {}", alertId, target);
        return updated;
    }

    public Optional<SecurityAlert> find(String alertId) {
        return Optional.ofNullable(alerts.get(alertId));
    }

    public List<SecurityAlert> findAll() {
        List<SecurityAlert> all = new ArrayList<>(alerts.values());
        all.sort(Comparator.comparing(SecurityAlert::getTimestamp));
        return all;
    }

    public List<SecurityAlert> findByType(AlertType type) {
        return findAll().stream().filter(a -> a.getAlertType() == type).toList();
    }

    public List<SecurityAlert> findByStatus(AlertStatus status) {
        return findAll().stream().filter(a -> a.getStatus() == status).toList();
    }

    public long countOpen() {
        return alerts.values().stream().filter(SecurityAlert::isOpen).count();
    }

    public long countBySeverity(AlertSeverity severity) {
        return alerts.values().stream().filter(a -> a.getSeverity() == severity).count();
    }

    public int size() {
        return alerts.size();
    }

    /**
     * Reload alerts from a snapshot. Existing alerts with the same id are kept.
     */
    public void restore(Collection<SecurityAlert> snapshot) {
        snapshot.forEach(alert -> alerts.putIfAbsent(alert.getAlertId(), alert));
    }
}
