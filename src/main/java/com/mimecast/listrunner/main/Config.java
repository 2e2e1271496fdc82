package com.mimecast.listrunner.main;

import com.mimecast.listrunner.config.site.SiteConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Site configuration container.
 *
 * <p>Holds the site config loaded from {@code site.json5}.
 *
 * @see SiteConfig
 */
public class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    /**
     * Protected constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Site configuration.
     */
    private static SiteConfig site = new SiteConfig();

    /**
     * Init site configuration.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public static void initSite(String path) throws IOException {
        site = new SiteConfig(path);
        log.debug("Site config loaded: path={}, hostname={}", path, site.getHostname());
    }

    /**
     * Gets site configuration.
     *
     * @return SiteConfig instance.
     */
    public static SiteConfig getSite() {
        return site;
    }

    /**
     * Sets site configuration.
     *
     * @param siteConfig SiteConfig instance.
     */
    public static void setSite(SiteConfig siteConfig) {
        site = siteConfig;
    }
}
