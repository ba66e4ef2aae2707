package com.accessmonitoring.infrastructure.monitoring;

import com.accessmonitoring.application.BreachIncidentRegistry;
import com.accessmonitoring.application.SecurityAlertManager;
import com.accessmonitoring.application.UserAccessStore;
import com.accessmonitoring.config.AccessMonitoringProperties;
import com.accessmonitoring.config.AccessMonitoringProperties.BreachProperties;
import com.accessmonitoring.config.PerformanceConfiguration.SecurityMetrics;
import com.accessmonitoring.domain.access.Permission;
import com.accessmonitoring.domain.activity.Activity;
import com.accessmonitoring.domain.activity.ActivityLog;
import com.accessmonitoring.domain.alert.AlertSeverity;
import com.accessmonitoring.domain.alert.AlertType;
import com.accessmonitoring.domain.incident.BreachIncident;
import com.accessmonitoring.domain.incident.IncidentStatus;
import com.accessmonitoring.domain.incident.IncidentType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Periodic breach checks over the trailing window of granted data access.
 *
 * <p>Each granted access is re-validated against the user's current record, which
 * catches access that was legitimate when recorded but whose permission was revoked
 * before the scan. Export volume above the configured threshold is treated as likely
 * exfiltration. Activities already covered by an incident of a kind are not reported
 * for that kind again.
 */
@Component
@Slf4j
public class BreachPreventionSystem extends MonitoringWorker {

    private final ActivityLog activityLog;
    private final UserAccessStore userAccessStore;
    private final BreachIncidentRegistry incidentRegistry;
    private final BreachProperties breachProperties;
    private final Clock clock;
    private final Cache<String, IncidentType> reported;

    public BreachPreventionSystem(
            ActivityLog activityLog,
            UserAccessStore userAccessStore,
            BreachIncidentRegistry incidentRegistry,
            SecurityAlertManager alertManager,
            SecurityMetrics securityMetrics,
            AccessMonitoringProperties properties,
            Clock clock,
            @Qualifier("monitoringTaskScheduler") TaskScheduler scheduler) {
        super("breach-prevention-system", scheduler, properties.getBreach().getScanInterval(),
            properties.getWorkers(), alertManager, securityMetrics);
        this.activityLog = activityLog;
        this.userAccessStore = userAccessStore;
        this.incidentRegistry = incidentRegistry;
        this.breachProperties = properties.getBreach();
        this.clock = clock;
        // entries outlive every scan window that can still contain the activity
        this.reported = Caffeine.newBuilder()
            .expireAfterWrite(breachProperties.getWindow().multipliedBy(2))
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .build();
    }

    @Override
    protected void doIteration() {
        scan();
    }

    /**
     * @return incidents opened by this scan
     */
    public List<BreachIncident> scan() {
        Instant now = clock.instant();
        List<Activity> granted = activityLog.window(now.minus(breachProperties.getWindow()), now).stream()
            .filter(Activity::isGrantedAccess)
            .toList();

        List<BreachIncident> opened = new ArrayList<>();
        opened.addAll(checkUnauthorizedAccess(granted));
        opened.addAll(checkExcessiveExports(granted));

        if (!opened.isEmpty()) {
            log.error("Breach scan opened {} incidents", opened.size());
        }
        return opened;
    }

    public BreachIncident transitionIncident(String incidentId, IncidentStatus status) {
        return incidentRegistry.transition(incidentId, status);
    }

    public BreachIncident markNotificationSent(String incidentId) {
        return incidentRegistry.markNotificationSent(incidentId);
    }

    public BreachIncident markRegulatoryReported(String incidentId) {
        return incidentRegistry.markRegulatoryReported(incidentId);
    }

    private List<BreachIncident> checkUnauthorizedAccess(List<Activity> granted) {
        Map<String, List<Activity>> failuresByUser = new LinkedHashMap<>();
        for (Activity activity : granted) {
            if (isReported(activity, IncidentType.UNAUTHORIZED_ACCESS)) {
                continue;
            }
            Optional<Permission> permission = activity.permission();
            if (permission.isEmpty()) {
                continue;
            }
            boolean stillAuthorized = userAccessStore.isAuthorized(
                activity.getUserId(), permission.get(), activity.getResourceType(), activity.getResourceId());
            if (!stillAuthorized) {
                failuresByUser.computeIfAbsent(activity.getUserId(), k -> new ArrayList<>()).add(activity);
            }
        }

        List<BreachIncident> opened = new ArrayList<>();
        failuresByUser.forEach((userId, activities) -> openSafely(
            IncidentType.UNAUTHORIZED_ACCESS,
            userId,
            activities,
            "Unauthorized access detected for user " + userId + ": "
                + activities.size() + " accesses no longer authorized")
            .ifPresent(opened::add));
        return opened;
    }

    private List<BreachIncident> checkExcessiveExports(List<Activity> granted) {
        Map<String, List<Activity>> exportsByUser = new LinkedHashMap<>();
        for (Activity activity : granted) {
            if (activity.permission().filter(p -> p == Permission.EXPORT_BANK_DATA).isPresent()
                    && !isReported(activity, IncidentType.EXCESSIVE_DATA_EXPORT)) {
                exportsByUser.computeIfAbsent(activity.getUserId(), k -> new ArrayList<>()).add(activity);
            }
        }

        List<BreachIncident> opened = new ArrayList<>();
        exportsByUser.forEach((userId, exports) -> {
            if (exports.size() > breachProperties.getExportThreshold()) {
                openSafely(
                    IncidentType.EXCESSIVE_DATA_EXPORT,
                    userId,
                    exports,
                    "Excessive data export detected for user " + userId + ": "
                        + exports.size() + " exports in " + breachProperties.getWindow().toMinutes() + " minutes")
                    .ifPresent(opened::add);
            }
        });
        return opened;
    }

    private Optional<BreachIncident> openSafely(
            IncidentType type, String userId, List<Activity> evidence, String description) {
        try {
            Optional<BreachIncident> incident = Optional.of(open(type, userId, evidence, description));
            evidence.forEach(activity -> markReported(activity, type));
            return incident;
        } catch (RuntimeException e) {
            log.error("Could not open {} incident for user {}", type.getCode(), Encode.forJava(userId), e);
            return Optional.empty();
        }
    }

    private BreachIncident open(IncidentType type, String userId, List<Activity> evidence, String description) {
        LinkedHashSet<String> affectedData = new LinkedHashSet<>();
        List<String> activityIds = new ArrayList<>(evidence.size());
        for (Activity activity : evidence) {
            activity.permission().ifPresent(p -> affectedData.add(p.getCode()));
            activityIds.add(activity.getActivityId());
        }

        BreachIncident incident = incidentRegistry.open(
            type, description, List.of(userId), new ArrayList<>(affectedData), activityIds);

        Map<String, Object> alertEvidence = new LinkedHashMap<>();
        alertEvidence.put("incident_id", incident.getIncidentId());
        alertEvidence.put("incident_type", type.getCode());
        alertEvidence.put("activity_count", evidence.size());

        alertManager.createAlert(
            AlertType.DATA_BREACH,
            AlertSeverity.CRITICAL,
            "Data breach incident detected: " + type.getCode(),
            description,
            userId,
            evidence.get(evidence.size() - 1).getIpAddress(),
            alertEvidence);

        return incident;
    }

    private boolean isReported(Activity activity, IncidentType type) {
        return reported.getIfPresent(reportKey(activity, type)) != null;
    }

    private void markReported(Activity activity, IncidentType type) {
        reported.put(reportKey(activity, type), type);
    }

    private static String reportKey(Activity activity, IncidentType type) {
        return type.getCode() + ":" + activity.getActivityId();
    }
}
