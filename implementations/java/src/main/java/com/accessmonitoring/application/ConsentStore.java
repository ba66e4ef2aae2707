package com.accessmonitoring.application;

import com.accessmonitoring.domain.consent.ConsentRecord;
import com.accessmonitoring.domain.consent.ConsentType;
import com.accessmonitoring.infrastructure.audit.AuditCategory;
import com.accessmonitoring.infrastructure.audit.AuditEvent;
import com.accessmonitoring.infrastructure.audit.AuditSeverity;
import com.accessmonitoring.infrastructure.audit.AuditSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Record of granted and withdrawn consent.
 *
 * <p>History is kept per (user, consent type); the newest record is authoritative and an
 * expired record counts as not granted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsentStore {

    static final String CONSENT_VERSION = "1.0";

    private final Map<ConsentKey, List<ConsentRecord>> history = new ConcurrentHashMap<>();

    private final AuditSink auditSink;
    private final Clock clock;

    /**
     * Record a grant or withdrawal.
     *
     * @param expiresAt optional expiry; {@code null} means open-ended
     * @return the new consent id
     */
    public String manageConsent(
            String userId,
            ConsentType consentType,
            boolean granted,
            String ipAddress,
            String userAgent,
            Instant expiresAt) {

        ConsentRecord record = new ConsentRecord(
            "consent_" + UUID.randomUUID(),
            userId,
            consentType,
            granted,
            clock.instant(),
            expiresAt,
            CONSENT_VERSION,
            ipAddress,
            userAgent);

        history.computeIfAbsent(new ConsentKey(userId, consentType), k -> new CopyOnWriteArrayList<>())
            .add(record);

        log.info("Consent {} for user {}: type={}", granted ? "granted" : "withdrawn",
            Encode.forJava(userId), consentType);

        try {
            auditSink.logEvent(AuditEvent.builder()
                .category(AuditCategory.CONSENT)
                .action(granted ? "CONSENT_GRANTED" : "CONSENT_WITHDRAWN")
                .severity(AuditSeverity.INFO)
                .description("Consent change: " + consentType)
                .resourceType("consent")
                .resourceId(record.getConsentId())
                .principalId(userId)
                .ipAddress(ipAddress)
                .occurredAt(record.getGrantedAt())
                .metadata(Map.of("consent_type", consentType.name(), "granted", granted))
                .build());
        } catch (RuntimeException e) {
            log.error("Audit sink rejected consent record {}", record.getConsentId(), e);
        }

        return record.getConsentId();
    }

    /**
     * True if the newest record for the pair is a grant that has not expired.
     */
    public boolean checkConsent(String userId, ConsentType consentType) {
        return hasConsent(userId, consentType);
    }

    public boolean hasConsent(String userId, ConsentType consentType) {
        return latest(userId, consentType)
            .map(record -> record.isActive(clock.instant()))
            .orElse(false);
    }

    /**
     * The authoritative record: newest grant time, later insertion winning ties.
     */
    public Optional<ConsentRecord> latest(String userId, ConsentType consentType) {
        List<ConsentRecord> records = history.get(new ConsentKey(userId, consentType));
        if (records == null || records.isEmpty()) {
            return Optional.empty();
        }
        ConsentRecord newest = null;
        for (ConsentRecord record : records) {
            if (newest == null || !record.getGrantedAt().isBefore(newest.getGrantedAt())) {
                newest = record;
            }
        }
        return Optional.of(newest);
    }

    public List<ConsentRecord> history(String userId) {
        List<ConsentRecord> records = new ArrayList<>();
        history.forEach((key, list) -> {
            if (key.userId().equals(userId)) {
                records.addAll(list);
            }
        });
        records.sort(Comparator.comparing(ConsentRecord::getGrantedAt));
        return records;
    }

    public long countTotal() {
        return history.values().stream().mapToLong(Collection::size).sum();
    }

    public long countActive() {
        Instant now = clock.instant();
        return history.values().stream()
            .flatMap(Collection::stream)
            .filter(record -> record.isActive(now))
            .count();
    }

    private record ConsentKey(String userId, ConsentType consentType) {
    }
}
