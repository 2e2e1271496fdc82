package com.mimecast.listrunner.config.list;

/**
 * Action taken on a post from an address that is not a list member.
 */
public enum NonMemberAction {
    ACCEPT,
    HOLD,
    REJECT,
    DISCARD;

    /**
     * Parses a configuration value, case insensitive.
     *
     * @param value        Configuration value.
     * @param defaultValue Value used when missing or unknown.
     * @return NonMemberAction.
     */
    public static NonMemberAction parse(String value, NonMemberAction defaultValue) {
        if (value != null) {
            for (NonMemberAction action : values()) {
                if (action.name().equalsIgnoreCase(value.trim())) {
                    return action;
                }
            }
        }
        return defaultValue;
    }
}
