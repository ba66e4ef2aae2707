package com.accessmonitoring.domain.activity;

/**
 * Well-known metadata keys carried by activities.
 */
public final class ActivityMetadata {

    public static final String PERMISSION = "permission";
    public static final String GRANTED = "granted";
    public static final String REASON = "reason";
    public static final String FAILED_ATTEMPTS = "failed_attempts";
    public static final String IP_ADDRESS = "ip_address";
    public static final String USER_AGENT = "user_agent";
    public static final String DESCRIPTION = "description";
    public static final String TARGET_USER = "target_user";

    public static final String UNKNOWN = "unknown";

    private ActivityMetadata() {
    }
}
