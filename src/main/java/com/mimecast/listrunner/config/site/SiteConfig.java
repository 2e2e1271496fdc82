package com.mimecast.listrunner.config.site;

import com.mimecast.listrunner.config.ConfigFoundation;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Site configuration.
 *
 * <p>This class provides type safe access to site wide configuration.
 * <p>It maps the queue runner definitions, bounce detection and maintenance settings to corresponding objects.
 *
 * @see RunnerConfig
 * @see BounceConfig
 * @see MaintenanceConfig
 */
public class SiteConfig extends ConfigFoundation {

    /**
     * Constructs a new SiteConfig instance.
     */
    public SiteConfig() {
        super();
    }

    /**
     * Constructs a new SiteConfig instance.
     *
     * @param map Configuration map.
     */
    public SiteConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new SiteConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public SiteConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets hostname.
     *
     * @return Hostname.
     */
    public String getHostname() {
        return getStringProperty("hostname", "example.com");
    }

    /**
     * Gets site owner address.
     * <p>Receives mail nobody else can take.
     *
     * @return Address string.
     */
    public String getSiteOwner() {
        return getStringProperty("siteOwner", "postmaster@" + getHostname());
    }

    /**
     * Gets queue root directory.
     *
     * @return Directory path.
     */
    public String getQueueDir() {
        return getStringProperty("queueDir", "/var/lib/listrunner/queue");
    }

    /**
     * Gets list directory root.
     *
     * @return Directory path.
     */
    public String getListsDir() {
        return getStringProperty("listsDir", "/var/lib/listrunner/lists");
    }

    /**
     * Gets held messages directory root.
     *
     * @return Directory path.
     */
    public String getHoldsDir() {
        return getStringProperty("holdsDir", "/var/lib/listrunner/holds");
    }

    /**
     * Gets queue runner definitions.
     *
     * @return List of RunnerConfig.
     */
    public List<RunnerConfig> getRunners() {
        List<RunnerConfig> runners = new ArrayList<>();
        for (Object entry : getListProperty("runners")) {
            if (entry instanceof Map) {
                @SuppressWarnings("unchecked")
                Map<String, Object> runnerMap = (Map<String, Object>) entry;
                runners.add(new RunnerConfig(runnerMap));
            }
        }
        return runners;
    }

    /**
     * Gets queue runner definition by name.
     *
     * @param name Runner name.
     * @return Optional of RunnerConfig.
     */
    public Optional<RunnerConfig> getRunner(String name) {
        return getRunners().stream()
                .filter(runner -> runner.getName().equals(name))
                .findFirst();
    }

    /**
     * Gets bounce detection configuration.
     *
     * @return BounceConfig instance.
     */
    public BounceConfig getBounce() {
        return new BounceConfig(getMapProperty("bounce"));
    }

    /**
     * Gets maintenance configuration.
     *
     * @return MaintenanceConfig instance.
     */
    public MaintenanceConfig getMaintenance() {
        return new MaintenanceConfig(getMapProperty("maintenance"));
    }
}
