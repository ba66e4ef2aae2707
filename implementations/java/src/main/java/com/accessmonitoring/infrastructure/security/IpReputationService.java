package com.accessmonitoring.infrastructure.security;

/**
 * IP reputation lookup. Threat-intelligence feeds can be plugged in behind this
 * interface; the built-in implementation is a local heuristic.
 */
public interface IpReputationService {

    boolean isSuspicious(String ipAddress);
}
