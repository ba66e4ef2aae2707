package com.accessmonitoring.domain.incident;

/**
 * Breach incident lifecycle: {@code DETECTED -> INVESTIGATING -> CONTAINED -> RESOLVED}.
 * Forward-only; steps may be skipped.
 */
public enum IncidentStatus {
    DETECTED,
    INVESTIGATING,
    CONTAINED,
    RESOLVED;

    public boolean canTransitionTo(IncidentStatus target) {
        return target.ordinal() > this.ordinal();
    }
}
