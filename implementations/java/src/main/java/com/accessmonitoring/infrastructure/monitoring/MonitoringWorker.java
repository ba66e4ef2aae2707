package com.accessmonitoring.infrastructure.monitoring;

import com.accessmonitoring.application.SecurityAlertManager;
import com.accessmonitoring.config.AccessMonitoringProperties.WorkerProperties;
import com.accessmonitoring.config.PerformanceConfiguration.SecurityMetrics;
import com.accessmonitoring.domain.alert.AlertSeverity;
import com.accessmonitoring.domain.alert.AlertType;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base for the periodic security workers.
 *
 * <p>Each worker runs {@link #doIteration()} on the shared monitoring scheduler with a
 * fixed delay between iterations. Stopping sets a cancellation flag that is checked
 * before every iteration, so an iteration in progress finishes but no new one starts.
 * Errors never leave the worker: they are logged and counted, and after a configured
 * number of consecutive failures one {@code monitor_degraded} alert is raised. A
 * successful iteration re-arms that alert.
 *
 * <p>{@link #runIteration()} is public so an iteration can be driven synchronously.
 */
@Slf4j
public abstract class MonitoringWorker implements SmartLifecycle {

    private final String name;
    private final TaskScheduler scheduler;
    private final Duration interval;
    private final WorkerProperties workerProperties;

    protected final SecurityAlertManager alertManager;
    protected final SecurityMetrics securityMetrics;

    private final AtomicBoolean cancelled = new AtomicBoolean(true);
    private volatile ScheduledFuture<?> scheduled;

    private int consecutiveFailures;
    private boolean degradedAlertRaised;

    protected MonitoringWorker(
            String name,
            TaskScheduler scheduler,
            Duration interval,
            WorkerProperties workerProperties,
            SecurityAlertManager alertManager,
            SecurityMetrics securityMetrics) {
        this.name = name;
        this.scheduler = scheduler;
        this.interval = interval;
        this.workerProperties = workerProperties;
        this.alertManager = alertManager;
        this.securityMetrics = securityMetrics;
    }

    /**
     * One unit of work. Runtime exceptions are handled by the caller.
     */
    protected abstract void doIteration();

    @Override
    public synchronized void start() {
        if (!cancelled.compareAndSet(true, false)) {
            return;
        }
        scheduled = scheduler.scheduleWithFixedDelay(this::tick, interval);
        log.info("Started {} (every {})", name, interval);
    }

    @Override
    public synchronized void stop() {
        cancelled.set(true);
        ScheduledFuture<?> current = scheduled;
        if (current != null) {
            current.cancel(false);
            scheduled = null;
        }
        log.info("Stopped {}", name);
    }

    @Override
    public boolean isRunning() {
        return !cancelled.get();
    }

    @Override
    public boolean isAutoStartup() {
        return workerProperties.isEnabled();
    }

    /**
     * Run one iteration now.
     *
     * @return true if the iteration completed without error
     */
    public synchronized boolean runIteration() {
        Timer.Sample sample = securityMetrics.startIteration();
        try {
            doIteration();
            securityMetrics.recordWorkerIteration(sample, name, true);
            consecutiveFailures = 0;
            degradedAlertRaised = false;
            return true;
        } catch (RuntimeException e) {
            securityMetrics.recordWorkerIteration(sample, name, false);
            consecutiveFailures++;
            log.error("{} iteration failed ({} consecutive)", name, consecutiveFailures, e);
            if (consecutiveFailures >= workerProperties.getDegradedAfterFailures() && !degradedAlertRaised) {
                raiseDegraded(e);
            }
            return false;
        }
    }

    int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    private void tick() {
        if (cancelled.get()) {
            return;
        }
        runIteration();
    }

    private void raiseDegraded(RuntimeException cause) {
        try {
            alertManager.createAlert(
                AlertType.MONITOR_DEGRADED,
                AlertSeverity.HIGH,
                "Monitoring worker degraded: " + name,
                name + " failed " + consecutiveFailures + " consecutive iterations: " + cause.getMessage(),
                null,
                null,
                Map.of("worker", name, "consecutive_failures", consecutiveFailures));
            degradedAlertRaised = true;
        } catch (RuntimeException e) {
            log.error("Could not raise degraded alert for {}", name, e);
        }
    }
}
