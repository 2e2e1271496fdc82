package com.mimecast.listrunner.config.list;

/**
 * Who decides subscription and unsubscription requests.
 */
public enum SubscriptionPolicy {
    // Requests take effect immediately.
    OPEN,
    // Requests wait for a moderator.
    MODERATE,
    // Requests are refused.
    CLOSED;

    /**
     * Parses a configuration value, case insensitive.
     *
     * @param value        Configuration value.
     * @param defaultValue Value used when missing or unknown.
     * @return SubscriptionPolicy.
     */
    public static SubscriptionPolicy parse(String value, SubscriptionPolicy defaultValue) {
        if (value != null) {
            for (SubscriptionPolicy policy : values()) {
                if (policy.name().equalsIgnoreCase(value.trim())) {
                    return policy;
                }
            }
        }
        return defaultValue;
    }
}
