package com.accessmonitoring.domain.consent;

/**
 * Types of user consent for processing personal data.
 */
public enum ConsentType {
    DATA_COLLECTION,
    DATA_PROCESSING,
    DATA_SHARING,
    MARKETING,
    THIRD_PARTY,
    AUTOMATED_DECISIONS
}
