package com.accessmonitoring.application;

import com.accessmonitoring.domain.access.UserAccess;
import com.accessmonitoring.domain.activity.Activity;
import com.accessmonitoring.domain.activity.ActivityLog;
import com.accessmonitoring.domain.activity.BoundedActivityQueue;
import com.accessmonitoring.domain.alert.AlertSeverity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds {@link AccessControlMetrics} from the live stores.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessMonitoringMetricsService {

    static final Duration RECENT_ACTIVITY_WINDOW = Duration.ofDays(7);
    static final double HIGH_RISK_THRESHOLD = 7.0;

    private final UserAccessStore userAccessStore;
    private final SecurityAlertManager alertManager;
    private final BreachIncidentRegistry incidentRegistry;
    private final ConsentStore consentStore;
    private final ActivityLog activityLog;
    private final BoundedActivityQueue activityQueue;
    private final Clock clock;

    public AccessControlMetrics getMetrics() {
        Instant now = clock.instant();

        List<UserAccess> users = userAccessStore.snapshot();
        long locked = users.stream().filter(UserAccess::isLocked).count();
        Map<String, Long> roleDistribution = users.stream()
            .collect(Collectors.groupingBy(u -> u.getRole().getCode(), TreeMap::new, Collectors.counting()));

        List<Activity> recent = activityLog.window(now.minus(RECENT_ACTIVITY_WINDOW), now);
        long highRisk = recent.stream().filter(a -> a.getRiskScore() >= HIGH_RISK_THRESHOLD).count();

        AccessControlMetrics metrics = new AccessControlMetrics(
            new AccessControlMetrics.UserMetrics(users.size(), users.size() - locked, locked, roleDistribution),
            new AccessControlMetrics.SecurityMetricsSummary(
                alertManager.size(),
                alertManager.countOpen(),
                alertManager.countBySeverity(AlertSeverity.CRITICAL),
                recent.size(),
                highRisk),
            new AccessControlMetrics.ConsentMetrics(consentStore.countTotal(), consentStore.countActive()),
            new AccessControlMetrics.IncidentMetrics(incidentRegistry.size(), incidentRegistry.countOpen()),
            activityQueue.droppedCount(),
            now);

        log.debug("Access control metrics computed: {} users, {} alerts", users.size(), alertManager.size());
        return metrics;
    }
}
