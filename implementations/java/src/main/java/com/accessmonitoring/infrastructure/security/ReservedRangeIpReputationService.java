package com.accessmonitoring.infrastructure.security;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Flags reserved, loopback and private IPv4 ranges. Traffic from these ranges should
 * never reach the public API directly, so seeing one usually means a proxy bypass or a
 * spoofed header.
 */
public class ReservedRangeIpReputationService implements IpReputationService {

    private static final List<Pattern> SUSPICIOUS_PATTERNS = List.of(
        Pattern.compile("^0\\.0\\.0\\."),                   // reserved
        Pattern.compile("^127\\."),                         // loopback
        Pattern.compile("^10\\."),                          // private
        Pattern.compile("^172\\.(1[6-9]|2[0-9]|3[0-1])\\."), // private
        Pattern.compile("^192\\.168\\.")                    // private
    );

    @Override
    public boolean isSuspicious(String ipAddress) {
        if (ipAddress == null || ipAddress.isBlank()) {
            return false;
        }
        String candidate = ipAddress.trim();
        for (Pattern pattern : SUSPICIOUS_PATTERNS) {
            if (pattern.matcher(candidate).find()) {
                return true;
            }
        }
        return false;
    }
}
