package com.accessmonitoring.infrastructure.persistence;

import com.accessmonitoring.application.BreachIncidentRegistry;
import com.accessmonitoring.application.SecurityAlertManager;
import com.accessmonitoring.application.UserAccessStore;
import com.accessmonitoring.config.AccessMonitoringProperties;
import com.accessmonitoring.domain.access.Role;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Restores the security state before the monitoring workers start and saves it after
 * they stop. Bootstrap admins are provisioned after the restore.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SecurityStateLifecycle implements SmartLifecycle {

    /** Starts before and stops after the workers, which use the default phase. */
    static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 1000;

    private final SecurityStateRepository repository;
    private final UserAccessStore userAccessStore;
    private final SecurityAlertManager alertManager;
    private final BreachIncidentRegistry incidentRegistry;
    private final AccessMonitoringProperties properties;
    private final Clock clock;

    private volatile boolean running;

    @Override
    public void start() {
        repository.load().ifPresent(snapshot -> {
            userAccessStore.restore(snapshot.users());
            alertManager.restore(snapshot.alerts());
            incidentRegistry.restore(snapshot.incidents());
            log.info("Restored security state saved at {}: {} users, {} alerts, {} incidents",
                snapshot.savedAt(), snapshot.users().size(), snapshot.alerts().size(), snapshot.incidents().size());
        });

        for (String admin : properties.getBootstrapAdmins()) {
            if (userAccessStore.find(admin).isEmpty()) {
                userAccessStore.provision(admin, Role.ADMIN);
                log.info("Bootstrap admin {} provisioned", Encode.forJava(admin));
            }
        }
        running = true;
    }

    @Override
    public void stop() {
        try {
            repository.save(new SecurityStateSnapshot(
                userAccessStore.snapshot(),
                alertManager.findAll(),
                incidentRegistry.findAll(),
                clock.instant()));
        } catch (SecurityStatePersistenceException e) {
            log.error("Security state was not saved on shutdown", e);
        } finally {
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
