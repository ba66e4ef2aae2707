package com.accessmonitoring.domain.alert;

/**
 * Alert lifecycle: {@code OPEN -> INVESTIGATING -> (RESOLVED | FALSE_POSITIVE)}.
 *
 * <p>Transitions only move forward; forward jumps (e.g. straight from OPEN to
 * FALSE_POSITIVE) are allowed. RESOLVED and FALSE_POSITIVE are terminal.
 */
public enum AlertStatus {
    OPEN,
    INVESTIGATING,
    RESOLVED,
    FALSE_POSITIVE;

    public boolean isTerminal() {
        return this == RESOLVED || this == FALSE_POSITIVE;
    }

    public boolean canTransitionTo(AlertStatus target) {
        return switch (this) {
            case OPEN -> target == INVESTIGATING || target.isTerminal();
            case INVESTIGATING -> target.isTerminal();
            case RESOLVED, FALSE_POSITIVE -> false;
        };
    }
}
