package com.accessmonitoring.infrastructure.persistence;

import com.accessmonitoring.domain.access.UserAccess;
import com.accessmonitoring.domain.alert.SecurityAlert;
import com.accessmonitoring.domain.incident.BreachIncident;

import java.time.Instant;
import java.util.List;

/**
 * Durable part of the security state: access records, alerts and incidents.
 * Activities are not snapshotted.
 */
public record SecurityStateSnapshot(
        List<UserAccess> users,
        List<SecurityAlert> alerts,
        List<BreachIncident> incidents,
        Instant savedAt) {

    public SecurityStateSnapshot {
        users = users != null ? List.copyOf(users) : List.of();
        alerts = alerts != null ? List.copyOf(alerts) : List.of();
        incidents = incidents != null ? List.copyOf(incidents) : List.of();
    }
}
