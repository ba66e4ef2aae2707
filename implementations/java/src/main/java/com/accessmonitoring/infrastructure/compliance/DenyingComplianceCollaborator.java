package com.accessmonitoring.infrastructure.compliance;

import com.accessmonitoring.domain.access.Permission;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;

/**
 * Fallback used when no banking compliance service is wired in: bank-account scoped
 * access is denied.
 */
@Slf4j
public class DenyingComplianceCollaborator implements ComplianceCollaborator {

    @Override
    public boolean validateBankDataAccess(String userId, String bankAccountId, Permission accessType) {
        log.warn("No compliance service configured; denying {} on bank account {} for user {}",
            accessType, Encode.forJava(String.valueOf(bankAccountId)), Encode.forJava(String.valueOf(userId)));
        return false;
    }
}
