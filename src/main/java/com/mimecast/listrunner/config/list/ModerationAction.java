package com.mimecast.listrunner.config.list;

/**
 * Action taken on a post from a member whose moderation flag is on.
 */
public enum ModerationAction {
    HOLD,
    REJECT,
    DISCARD;

    /**
     * Parses a configuration value, case insensitive.
     *
     * @param value        Configuration value.
     * @param defaultValue Value used when missing or unknown.
     * @return ModerationAction.
     */
    public static ModerationAction parse(String value, ModerationAction defaultValue) {
        if (value != null) {
            for (ModerationAction action : values()) {
                if (action.name().equalsIgnoreCase(value.trim())) {
                    return action;
                }
            }
        }
        return defaultValue;
    }
}
