package com.accessmonitoring.domain.exception;

import org.owasp.encoder.Encode;

public class UnknownPermissionException extends AccessValidationException {

    public UnknownPermissionException(String permissionName) {
        super("Unknown permission: " + Encode.forJava(String.valueOf(permissionName)));
    }
}
