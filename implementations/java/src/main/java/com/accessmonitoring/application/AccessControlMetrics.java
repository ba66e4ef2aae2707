package com.accessmonitoring.application;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time summary of access control and monitoring state.
 */
public record AccessControlMetrics(
        UserMetrics users,
        SecurityMetricsSummary security,
        ConsentMetrics consents,
        IncidentMetrics incidents,
        long droppedQueueEvents,
        Instant lastUpdated) {

    public record UserMetrics(long total, long active, long locked, Map<String, Long> roleDistribution) {
    }

    public record SecurityMetricsSummary(
            long totalAlerts,
            long openAlerts,
            long criticalAlerts,
            long recentActivities,
            long highRiskActivities) {
    }

    public record ConsentMetrics(long total, long active) {
    }

    public record IncidentMetrics(long total, long open) {
    }
}
