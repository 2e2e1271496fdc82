package com.mimecast.listrunner.config.site;

import com.mimecast.listrunner.config.BasicConfig;

import java.util.Map;

/**
 * Bounce detection configuration.
 */
public class BounceConfig extends BasicConfig {

    /**
     * Default VERP pattern matching {@code list-bounces+mailbox=host@site}.
     */
    public static final String DEFAULT_VERP_REGEX = "^(?<bounces>[^+]+?)\\+(?<mailbox>[^=]+)=(?<host>[^@]+)@.*$";

    /**
     * Constructs a new BounceConfig instance.
     *
     * @param map Configuration map.
     */
    public BounceConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets VERP regular expression.
     * <p>Must define the named groups bounces, mailbox and host.
     *
     * @return Regex string.
     */
    public String getVerpRegex() {
        return getStringProperty("verpRegex", DEFAULT_VERP_REGEX);
    }

    /**
     * Gets score weight of a hard bounce.
     *
     * @return Weight.
     */
    public double getHardWeight() {
        return getDoubleProperty("hardWeight", 1.0);
    }

    /**
     * Gets score weight of a soft bounce.
     *
     * @return Weight.
     */
    public double getSoftWeight() {
        return getDoubleProperty("softWeight", 0.5);
    }
}
