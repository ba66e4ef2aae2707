package com.accessmonitoring.infrastructure.compliance;

import com.accessmonitoring.domain.access.Permission;

/**
 * Banking compliance service consulted for ownership of bank-account resources.
 */
public interface ComplianceCollaborator {

    /**
     * @return true if {@code userId} may exercise {@code accessType} on the bank account
     */
    boolean validateBankDataAccess(String userId, String bankAccountId, Permission accessType);
}
