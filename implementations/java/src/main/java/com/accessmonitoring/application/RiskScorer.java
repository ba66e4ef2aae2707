package com.accessmonitoring.application;

import com.accessmonitoring.domain.activity.Activity;
import com.accessmonitoring.domain.activity.ActivityMetadata;
import com.accessmonitoring.domain.activity.ActivityType;
import com.accessmonitoring.domain.activity.BusinessHours;
import com.accessmonitoring.infrastructure.security.IpReputationService;

import java.time.Instant;
import java.util.Map;

/**
 * Bounded [0, 10] risk heuristic for a single activity.
 *
 * <pre>
 *   base(activity type)
 * + 2 x failed_attempts            (from metadata)
 * + 5 if the IP looks suspicious
 * + 3 if outside business hours
 *   clamped to [0, 10]
 * </pre>
 */
public class RiskScorer {

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 10.0;

    static final double FAILED_ATTEMPT_WEIGHT = 2.0;
    static final double SUSPICIOUS_IP_PENALTY = 5.0;
    static final double OFF_HOURS_PENALTY = 3.0;

    private final IpReputationService ipReputation;
    private final BusinessHours businessHours;

    public RiskScorer(IpReputationService ipReputation, BusinessHours businessHours) {
        this.ipReputation = ipReputation;
        this.businessHours = businessHours;
    }

    public double score(ActivityType type, Map<String, ?> metadata, String ipAddress, Instant at) {
        double score = baseScore(type);

        int failedAttempts = Activity.metadataInt(metadata, ActivityMetadata.FAILED_ATTEMPTS);
        if (failedAttempts > 0) {
            score += failedAttempts * FAILED_ATTEMPT_WEIGHT;
        }
        if (isSuspiciousIp(ipAddress)) {
            score += SUSPICIOUS_IP_PENALTY;
        }
        if (isOutsideBusinessHours(at)) {
            score += OFF_HOURS_PENALTY;
        }
        return clamp(score);
    }

    public boolean isSuspiciousIp(String ipAddress) {
        return ipAddress != null
            && !ActivityMetadata.UNKNOWN.equals(ipAddress)
            && ipReputation.isSuspicious(ipAddress);
    }

    public boolean isOutsideBusinessHours(Instant at) {
        return businessHours.isOutside(at);
    }

    static double baseScore(ActivityType type) {
        return switch (type) {
            case LOGIN, LOGOUT -> 1.0;
            case DATA_ACCESS -> 2.0;
            case DATA_MODIFICATION -> 5.0;
            case ACCOUNT_CREATION -> 3.0;
            case ACCOUNT_DELETION -> 8.0;
            case PERMISSION_CHANGE -> 7.0;
            case ROLE_CHANGE -> 8.0;
            case SUSPICIOUS_ACTIVITY, SECURITY_VIOLATION -> 10.0;
        };
    }

    static double clamp(double score) {
        if (Double.isNaN(score)) {
            return MAX_SCORE;
        }
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
