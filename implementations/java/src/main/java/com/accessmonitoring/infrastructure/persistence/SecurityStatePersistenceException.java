package com.accessmonitoring.infrastructure.persistence;

public class SecurityStatePersistenceException extends RuntimeException {

    public SecurityStatePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
