package com.mimecast.listrunner.config.site;

import com.mimecast.listrunner.config.BasicConfig;

import java.util.Map;

/**
 * Periodic maintenance configuration.
 */
public class MaintenanceConfig extends BasicConfig {

    /**
     * Constructs a new MaintenanceConfig instance.
     *
     * @param map Configuration map.
     */
    public MaintenanceConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets hold expiry sweep interval.
     *
     * @return Seconds.
     */
    public long getHoldExpiryIntervalSeconds() {
        return getLongProperty("holdExpiryIntervalSeconds", 3600L);
    }

    /**
     * Gets bounce maintenance interval.
     *
     * @return Seconds.
     */
    public long getBounceMaintenanceIntervalSeconds() {
        return getLongProperty("bounceMaintenanceIntervalSeconds", 86400L);
    }

    /**
     * Gets age after which orphaned queue files are repaired.
     *
     * @return Seconds.
     */
    public long getOrphanGraceSeconds() {
        return getLongProperty("orphanGraceSeconds", 300L);
    }
}
