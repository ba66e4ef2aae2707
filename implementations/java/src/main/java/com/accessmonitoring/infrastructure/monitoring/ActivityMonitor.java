package com.accessmonitoring.infrastructure.monitoring;

import com.accessmonitoring.application.RiskScorer;
import com.accessmonitoring.application.SecurityAlertManager;
import com.accessmonitoring.config.AccessMonitoringProperties;
import com.accessmonitoring.config.PerformanceConfiguration.SecurityMetrics;
import com.accessmonitoring.domain.activity.Activity;
import com.accessmonitoring.domain.activity.ActivityLog;
import com.accessmonitoring.domain.activity.BoundedActivityQueue;
import com.accessmonitoring.domain.alert.AlertSeverity;
import com.accessmonitoring.domain.alert.AlertType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drains the activity queue in arrival order and raises per-activity alerts.
 *
 * <p>An activity is unusual when it happens outside business hours, comes from a
 * suspicious address, or carries a risk score at or above the configured threshold.
 * It is rapid when its user logged more than the configured number of activities in
 * the trailing window ending at the activity's own timestamp.
 */
@Component
@Slf4j
public class ActivityMonitor extends MonitoringWorker {

    private final BoundedActivityQueue activityQueue;
    private final ActivityLog activityLog;
    private final RiskScorer riskScorer;
    private final double unusualRiskThreshold;
    private final Duration rapidWindow;
    private final int rapidThreshold;

    private volatile long processedCount;

    public ActivityMonitor(
            BoundedActivityQueue activityQueue,
            ActivityLog activityLog,
            RiskScorer riskScorer,
            SecurityAlertManager alertManager,
            SecurityMetrics securityMetrics,
            AccessMonitoringProperties properties,
            @Qualifier("monitoringTaskScheduler") TaskScheduler scheduler) {
        super("activity-monitor", scheduler, properties.getMonitor().getPollInterval(),
            properties.getWorkers(), alertManager, securityMetrics);
        this.activityQueue = activityQueue;
        this.activityLog = activityLog;
        this.riskScorer = riskScorer;
        this.unusualRiskThreshold = properties.getMonitor().getUnusualRiskThreshold();
        this.rapidWindow = properties.getMonitor().getRapidWindow();
        this.rapidThreshold = properties.getMonitor().getRapidThreshold();
    }

    @Override
    protected void doIteration() {
        List<Activity> batch = activityQueue.drain();
        for (Activity activity : batch) {
            try {
                process(activity);
            } catch (RuntimeException e) {
                log.error("Failed to process activity {}", activity.getActivityId(), e);
            }
            processedCount++;
        }
        if (!batch.isEmpty()) {
            log.debug("Activity monitor processed {} activities", batch.size());
        }
    }

    public long getProcessedCount() {
        return processedCount;
    }

    void process(Activity activity) {
        List<String> reasons = unusualReasons(activity);
        if (!reasons.isEmpty()) {
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("activity_id", activity.getActivityId());
            evidence.put("activity_type", activity.getActivityType().name());
            evidence.put("risk_score", activity.getRiskScore());
            evidence.put("reasons", reasons);
            alertManager.createAlert(
                AlertType.UNUSUAL_ACTIVITY,
                AlertSeverity.MEDIUM,
                "Unusual activity detected for user " + activity.getUserId(),
                "Unusual activity: " + String.join(", ", reasons),
                activity.getUserId(),
                activity.getIpAddress(),
                evidence);
        }

        int recent = activityLog.windowForUser(
            activity.getUserId(), activity.getTimestamp().minus(rapidWindow), activity.getTimestamp()).size();
        if (recent > rapidThreshold) {
            alertManager.createAlert(
                AlertType.RAPID_ACTIVITY,
                AlertSeverity.HIGH,
                "Rapid activity detected for user " + activity.getUserId(),
                "User performed " + recent + " activities in " + rapidWindow.toSeconds() + " seconds",
                activity.getUserId(),
                activity.getIpAddress(),
                Map.of("activity_id", activity.getActivityId(), "activity_count", recent));
        }
    }

    private List<String> unusualReasons(Activity activity) {
        List<String> reasons = new ArrayList<>(3);
        if (riskScorer.isOutsideBusinessHours(activity.getTimestamp())) {
            reasons.add("outside business hours");
        }
        if (riskScorer.isSuspiciousIp(activity.getIpAddress())) {
            reasons.add("suspicious ip address");
        }
        if (activity.getRiskScore() >= unusualRiskThreshold) {
            reasons.add("high risk score");
        }
        return reasons;
    }
}
