package com.accessmonitoring.domain.exception;

import org.owasp.encoder.Encode;

public class AlertNotFoundException extends AccessValidationException {

    public AlertNotFoundException(String alertId) {
        super("Security alert not found: " + Encode.forJava(String.valueOf(alertId)));
    }
}
