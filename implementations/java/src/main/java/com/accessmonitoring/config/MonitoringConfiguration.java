package com.accessmonitoring.config;

import com.accessmonitoring.domain.activity.ActivityLog;
import com.accessmonitoring.domain.activity.BoundedActivityQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Shared infrastructure for the monitoring workers: the clock, the activity log and
 * queue they share with the request path, and the thread pools they run on.
 */
@Configuration
@EnableAsync
@EnableScheduling
@Slf4j
public class MonitoringConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ActivityLog activityLog(AccessMonitoringProperties properties) {
        return new ActivityLog(properties.getActivityLog().getRetention());
    }

    @Bean
    public BoundedActivityQueue activityQueue(AccessMonitoringProperties properties) {
        return new BoundedActivityQueue(properties.getQueue().getCapacity());
    }

    /**
     * One platform thread per background worker, plus one for the audit relay.
     */
    @Bean(name = "monitoringTaskScheduler")
    public TaskScheduler monitoringTaskScheduler() {
        log.info("Configuring monitoring task scheduler");

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("security-monitor-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        scheduler.setErrorHandler(t -> log.error("Unhandled error in monitoring task", t));
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Bounded pool for fire-and-forget audit writes. When saturated the caller runs the
     * write itself rather than dropping audit events.
     */
    @Bean(name = "auditExecutor")
    public Executor auditExecutor() {
        log.info("Configuring audit executor");

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("audit-sink-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
