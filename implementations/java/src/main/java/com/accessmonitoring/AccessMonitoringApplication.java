package com.accessmonitoring;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Access control and real-time security monitoring service.
 *
 * <ul>
 *   <li><strong>Role-based access control</strong>: permission checks with lockout,
 *       resource scoping and consent gating</li>
 *   <li><strong>Activity monitoring</strong>: risk-scored activity stream with per-activity
 *       and windowed pattern alerts</li>
 *   <li><strong>Breach prevention</strong>: re-validation of recent access and export
 *       volume checks</li>
 *   <li><strong>Audit trail</strong>: transactional outbox of audit events</li>
 * </ul>
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class AccessMonitoringApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccessMonitoringApplication.class, args);
        log.info("Access monitoring service started");
    }
}
