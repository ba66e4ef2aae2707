package com.accessmonitoring.application;

/**
 * Outcome of evaluating a permission; {@code reason} is null when granted.
 */
record AccessDecision(boolean granted, DenialReason reason) {

    static final AccessDecision GRANTED = new AccessDecision(true, null);

    static AccessDecision deny(DenialReason reason) {
        return new AccessDecision(false, reason);
    }
}
