package com.mimecast.listrunner.config.site;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SiteConfigTest {

    @Test
    void readsSiteFile() throws IOException {
        SiteConfig site = new SiteConfig("src/test/resources/cfg/site.json5");

        assertEquals("lists.example.com", site.getHostname());
        assertEquals("postmaster@example.com", site.getSiteOwner());
        assertEquals("target/listrunner/queue", site.getQueueDir());
        assertEquals(1.0, site.getBounce().getHardWeight(), 0.0001);
        assertEquals(0.5, site.getBounce().getSoftWeight(), 0.0001);
        assertEquals(3600L, site.getMaintenance().getHoldExpiryIntervalSeconds());
        assertEquals(300L, site.getMaintenance().getOrphanGraceSeconds());
    }

    @Test
    void readsRunners() throws IOException {
        SiteConfig site = new SiteConfig("src/test/resources/cfg/site.json5");

        List<RunnerConfig> runners = site.getRunners();
        assertEquals(4, runners.size());

        RunnerConfig bounce = site.getRunner("bounce").orElseThrow();
        assertEquals("bounces", bounce.getQueue());
        assertEquals("bounce", bounce.getPipeline());
        assertEquals(5000L, bounce.getPollIntervalMillis());
        assertEquals(3, bounce.getMaxFailures());
        assertEquals(100, bounce.getBatchSize());
        assertTrue(bounce.isEnabled());

        assertTrue(site.getRunner("outgoing").isEmpty());
    }

    @Test
    void defaults() {
        SiteConfig site = new SiteConfig(Map.of("hostname", "lists.example.org"));

        assertEquals("postmaster@lists.example.org", site.getSiteOwner());
        assertTrue(site.getRunners().isEmpty());
        assertEquals(BounceConfig.DEFAULT_VERP_REGEX, site.getBounce().getVerpRegex());
        assertEquals(86400L, site.getMaintenance().getBounceMaintenanceIntervalSeconds());
    }

    @Test
    void runnerDefaults() {
        RunnerConfig runner = new RunnerConfig(Map.of("queue", "virgin", "instances", 0, "maxFailures", "5"));

        assertEquals("virgin", runner.getName());
        assertEquals("post", runner.getPipeline());
        assertEquals(1, runner.getInstances());
        assertEquals(5, runner.getMaxFailures());
        assertEquals(1000L, runner.getPollIntervalMillis());
    }

    @Test
    void missingFileFails() {
        assertThrows(IOException.class, () -> new SiteConfig("src/test/resources/cfg/missing.json5"));
    }
}
