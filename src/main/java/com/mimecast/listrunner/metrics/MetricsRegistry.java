package com.mimecast.listrunner.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Global access to the meter registry.
 */
public final class MetricsRegistry {
    private static volatile MeterRegistry registry = new SimpleMeterRegistry();

    /**
     * Private constructor for utility class.
     */
    private MetricsRegistry() {
    }

    /**
     * Register the meter registry.
     *
     * @param meterRegistry Registry instance.
     */
    public static void register(MeterRegistry meterRegistry) {
        registry = meterRegistry;
    }

    /**
     * Get the meter registry.
     *
     * @return MeterRegistry instance.
     */
    public static MeterRegistry getRegistry() {
        return registry;
    }
}
