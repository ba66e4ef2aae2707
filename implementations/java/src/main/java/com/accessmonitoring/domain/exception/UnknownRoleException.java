package com.accessmonitoring.domain.exception;

import org.owasp.encoder.Encode;

public class UnknownRoleException extends AccessValidationException {

    public UnknownRoleException(String roleName) {
        super("Unknown role: " + Encode.forJava(String.valueOf(roleName)));
    }
}
