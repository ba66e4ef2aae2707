package com.accessmonitoring.domain.consent;

import lombok.Getter;

import java.time.Instant;
import java.util.Objects;

/**
 * A grant or withdrawal of consent. Records are never edited; a newer record for the
 * same user and type supersedes older ones.
 */
@Getter
public class ConsentRecord {

    private final String consentId;
    private final String userId;
    private final ConsentType consentType;
    private final boolean granted;
    private final Instant grantedAt;
    private final Instant expiresAt;
    private final String version;
    private final String ipAddress;
    private final String userAgent;

    public ConsentRecord(
            String consentId,
            String userId,
            ConsentType consentType,
            boolean granted,
            Instant grantedAt,
            Instant expiresAt,
            String version,
            String ipAddress,
            String userAgent) {

        this.consentId = Objects.requireNonNull(consentId, "consentId");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.consentType = Objects.requireNonNull(consentType, "consentType");
        this.granted = granted;
        this.grantedAt = Objects.requireNonNull(grantedAt, "grantedAt");
        this.expiresAt = expiresAt;
        this.version = version;
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * Granted and not expired.
     */
    public boolean isActive(Instant now) {
        return granted && !isExpired(now);
    }
}
