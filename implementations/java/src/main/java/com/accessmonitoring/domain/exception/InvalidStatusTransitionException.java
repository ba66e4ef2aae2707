package com.accessmonitoring.domain.exception;

/**
 * Thrown when an alert or incident is asked to move backwards in its lifecycle.
 */
public class InvalidStatusTransitionException extends AccessValidationException {

    public InvalidStatusTransitionException(String entity, String id, Enum<?> from, Enum<?> to) {
        super(String.format("Illegal %s status transition for %s: %s -> %s", entity, id, from, to));
    }
}
