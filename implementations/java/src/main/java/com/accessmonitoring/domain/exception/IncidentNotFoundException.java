package com.accessmonitoring.domain.exception;

import org.owasp.encoder.Encode;

public class IncidentNotFoundException extends AccessValidationException {

    public IncidentNotFoundException(String incidentId) {
        super("Breach incident not found: " + Encode.forJava(String.valueOf(incidentId)));
    }
}
