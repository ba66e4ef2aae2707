package com.accessmonitoring.infrastructure.monitoring;

import com.accessmonitoring.application.SecurityAlertManager;
import com.accessmonitoring.config.AccessMonitoringProperties;
import com.accessmonitoring.config.AccessMonitoringProperties.DetectorProperties;
import com.accessmonitoring.config.PerformanceConfiguration.SecurityMetrics;
import com.accessmonitoring.domain.activity.Activity;
import com.accessmonitoring.domain.activity.ActivityLog;
import com.accessmonitoring.domain.alert.AlertSeverity;
import com.accessmonitoring.domain.alert.AlertType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Scans the trailing window of activity per user for suspicious patterns.
 *
 * <p>A user gets at most one {@code suspicious_pattern} alert per scan. The alert is only
 * raised when some triggered pattern has evidence appended after the last alert for that
 * (user, pattern) pair. The pair remembers the id of the latest matching activity it was
 * alerted on; entries expire together with the window.
 */
@Component
@Slf4j
public class SuspiciousActivityDetector extends MonitoringWorker {

    private final ActivityLog activityLog;
    private final DetectorProperties detectorProperties;
    private final Clock clock;
    private final Cache<PatternKey, String> lastAlerted;

    public SuspiciousActivityDetector(
            ActivityLog activityLog,
            SecurityAlertManager alertManager,
            SecurityMetrics securityMetrics,
            AccessMonitoringProperties properties,
            Clock clock,
            @Qualifier("monitoringTaskScheduler") TaskScheduler scheduler) {
        super("suspicious-activity-detector", scheduler, properties.getDetector().getScanInterval(),
            properties.getWorkers(), alertManager, securityMetrics);
        this.activityLog = activityLog;
        this.detectorProperties = properties.getDetector();
        this.clock = clock;
        this.lastAlerted = Caffeine.newBuilder()
            .expireAfterWrite(detectorProperties.getWindow())
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .build();
    }

    @Override
    protected void doIteration() {
        scan();
    }

    /**
     * @return number of alerts raised
     */
    public int scan() {
        Instant now = clock.instant();
        List<Activity> window = activityLog.window(now.minus(detectorProperties.getWindow()), now);

        Map<String, List<Activity>> byUser = new LinkedHashMap<>();
        for (Activity activity : window) {
            byUser.computeIfAbsent(activity.getUserId(), k -> new ArrayList<>()).add(activity);
        }

        int raised = 0;
        for (Map.Entry<String, List<Activity>> entry : byUser.entrySet()) {
            try {
                if (evaluateUser(entry.getKey(), entry.getValue())) {
                    raised++;
                }
            } catch (RuntimeException e) {
                log.error("Pattern evaluation failed for user {}", Encode.forJava(entry.getKey()), e);
            }
        }

        if (raised > 0) {
            log.info("Suspicious activity scan raised {} alerts over {} users", raised, byUser.size());
        }
        return raised;
    }

    private boolean evaluateUser(String userId, List<Activity> activities) {
        Map<SuspiciousPatternKind, Integer> counts = new LinkedHashMap<>();
        Map<SuspiciousPatternKind, String> latestEvidence = new LinkedHashMap<>();
        boolean fresh = false;

        for (SuspiciousPatternKind kind : SuspiciousPatternKind.values()) {
            int count = 0;
            String latest = null;
            for (Activity activity : activities) {
                if (kind.matches(activity)) {
                    count++;
                    latest = activity.getActivityId();
                }
            }
            if (count <= kind.threshold(detectorProperties)) {
                continue;
            }
            counts.put(kind, count);
            latestEvidence.put(kind, latest);

            String previous = lastAlerted.getIfPresent(new PatternKey(userId, kind));
            if (!latest.equals(previous)) {
                fresh = true;
            }
        }

        if (!fresh) {
            return false;
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        List<String> patterns = new ArrayList<>();
        counts.forEach((kind, count) -> {
            patterns.add(kind.getCode());
            evidence.put(kind.getCode() + "_count", count);
        });
        evidence.put("patterns", patterns);
        evidence.put("window_minutes", detectorProperties.getWindow().toMinutes());

        alertManager.createAlert(
            AlertType.SUSPICIOUS_PATTERN,
            AlertSeverity.HIGH,
            "Suspicious activity pattern for user " + userId,
            "Detected patterns: " + String.join(", ", patterns),
            userId,
            activities.get(activities.size() - 1).getIpAddress(),
            evidence);

        latestEvidence.forEach((kind, latest) -> lastAlerted.put(new PatternKey(userId, kind), latest));
        return true;
    }

    private record PatternKey(String userId, SuspiciousPatternKind kind) {
    }
}
