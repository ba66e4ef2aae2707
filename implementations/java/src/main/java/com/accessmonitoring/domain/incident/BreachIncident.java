package com.accessmonitoring.domain.incident;

import com.accessmonitoring.domain.alert.AlertSeverity;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Record opened when re-validated access or export volume indicates likely
 * unauthorized data exposure.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BreachIncident {

    public static final List<String> CONTAINMENT_CHECKLIST = List.of(
        "Immediate account suspension",
        "Review access logs",
        "Assess data exposure",
        "Implement additional monitoring");

    String incidentId;
    IncidentType incidentType;
    AlertSeverity severity;
    String description;
    List<String> affectedUsers;
    List<String> affectedData;
    Instant detectedAt;
    @With
    IncidentStatus status;
    List<String> containmentActions;
    @With
    boolean notificationSent;
    @With
    boolean regulatoryReporting;
    List<String> evidenceActivityIds;

    @JsonIgnore
    public boolean isOpen() {
        return status != IncidentStatus.RESOLVED;
    }
}
