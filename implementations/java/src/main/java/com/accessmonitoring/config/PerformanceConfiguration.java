package com.accessmonitoring.config;

import com.accessmonitoring.domain.activity.BoundedActivityQueue;
import com.accessmonitoring.domain.alert.AlertSeverity;
import com.accessmonitoring.domain.alert.AlertType;
import com.accessmonitoring.domain.incident.IncidentType;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Performance and security metrics.
 *
 * Tracks:
 * - Permission check latency and outcome
 * - Monitoring worker iteration latency and failures
 * - Alerts and incidents raised, by type
 * - Activity queue depth and drops
 *
 * No user identifiers are used as tags.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    @Bean
    public SecurityMetrics securityMetrics(MeterRegistry meterRegistry, BoundedActivityQueue activityQueue) {
        SecurityMetrics metrics = new SecurityMetrics(meterRegistry);
        metrics.bindQueue(activityQueue);
        return metrics;
    }

    /**
     * Aspect for timing permission checks.
     */
    @Aspect
    @Component
    @Slf4j
    public static class AuthorizationPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public AuthorizationPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(boolean com.accessmonitoring.application.UserAccessStore.checkPermission(..))")
        public Object timePermissionCheck(ProceedingJoinPoint joinPoint) throws Throwable {
            Timer.Sample sample = Timer.start(meterRegistry);

            Object result = joinPoint.proceed();

            sample.stop(Timer.builder("security.authorization")
                .tag("outcome", Boolean.TRUE.equals(result) ? "granted" : "denied")
                .description("Permission check timing")
                .register(meterRegistry));

            return result;
        }
    }

    /**
     * Counters for security events.
     */
    @Slf4j
    public static class SecurityMetrics {

        private final MeterRegistry meterRegistry;

        public SecurityMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized security metrics");
        }

        void bindQueue(BoundedActivityQueue queue) {
            Gauge.builder("activity.queue.size", queue, BoundedActivityQueue::size)
                .description("Activities waiting for the activity monitor")
                .register(meterRegistry);
            Gauge.builder("activity.queue.dropped", queue, q -> (double) q.droppedCount())
                .description("Activities dropped from the monitor queue on overflow")
                .register(meterRegistry);
        }

        public void recordPermissionCheck(boolean granted) {
            meterRegistry.counter("access.permission.checks",
                "outcome", granted ? "granted" : "denied").increment();
        }

        public void recordLogin(boolean success) {
            meterRegistry.counter("access.logins",
                "outcome", success ? "success" : "failure").increment();
        }

        public void recordAccountLocked() {
            meterRegistry.counter("access.accounts.locked").increment();
        }

        public void recordAlert(AlertType type, AlertSeverity severity) {
            meterRegistry.counter("security.alerts.created",
                "type", type.getCode(),
                "severity", severity.name().toLowerCase(Locale.ROOT)).increment();
        }

        public void recordIncident(IncidentType type) {
            meterRegistry.counter("security.incidents.created",
                "type", type.getCode()).increment();
        }

        public Timer.Sample startIteration() {
            return Timer.start(meterRegistry);
        }

        public void recordWorkerIteration(Timer.Sample sample, String worker, boolean success) {
            sample.stop(Timer.builder("monitor.iterations")
                .tag("worker", worker)
                .tag("outcome", success ? "success" : "failure")
                .description("Monitoring worker iteration timing")
                .register(meterRegistry));
        }
    }
}
