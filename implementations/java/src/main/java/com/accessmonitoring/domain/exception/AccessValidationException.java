package com.accessmonitoring.domain.exception;

/**
 * Base type for invalid input reported straight back to the caller: unknown roles,
 * permissions or identifiers, and illegal lifecycle transitions.
 */
public class AccessValidationException extends RuntimeException {

    public AccessValidationException(String message) {
        super(message);
    }
}
