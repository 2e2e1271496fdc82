package com.mimecast.listrunner.main;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Foundation for the command line tools.
 *
 * <p>Ensures the configuration is loaded just once.
 */
public abstract class Foundation {
    protected static final Logger log = LogManager.getLogger(Foundation.class);

    /**
     * Site configuration file name.
     */
    public static final String SITE_FILE = "site.json5";

    private static String loaded;

    /**
     * Initializes configuration from the given directory.
     *
     * @param path Directory path.
     * @throws ConfigurationException Unable to read or parse the configuration.
     */
    public static synchronized void init(String path) throws ConfigurationException {
        Path dir = Paths.get(path).toAbsolutePath().normalize();
        if (dir.toString().equals(loaded)) {
            return;
        }

        Path site = dir.resolve(SITE_FILE);
        if (!Files.isReadable(site)) {
            throw new ConfigurationException("Site config not found: " + site);
        }

        try {
            Config.initSite(site.toString());
        } catch (IOException e) {
            log.error("Site config error: path={}, error={}", site, e.getMessage());
            throw new ConfigurationException("Unable to load site config: " + e.getMessage());
        }
        loaded = dir.toString();
        log.info("Configuration initialized: dir={}", dir);
    }
}
