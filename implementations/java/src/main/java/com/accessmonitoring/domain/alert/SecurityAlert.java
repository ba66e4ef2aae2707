package com.accessmonitoring.domain.alert;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A single actionable security notification.
 *
 * <p>Immutable; status changes are applied by {@code SecurityAlertManager} which swaps in
 * a copy carrying the new status.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SecurityAlert {
    String alertId;
    AlertType alertType;
    AlertSeverity severity;
    String title;
    String description;
    String userId;
    String ipAddress;
    Instant timestamp;
    @With
    AlertStatus status;
    Map<String, Object> evidence;
    List<String> remediationSteps;

    @JsonIgnore
    public boolean isOpen() {
        return status == AlertStatus.OPEN;
    }
}
