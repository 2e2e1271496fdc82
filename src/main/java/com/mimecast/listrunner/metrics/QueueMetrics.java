package com.mimecast.listrunner.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Queue, pipeline and bounce Micrometer counters.
 *
 * <p>Counter failures are logged and never interrupt message processing.
 */
public final class QueueMetrics {
    private static final Logger log = LogManager.getLogger(QueueMetrics.class);

    public static final String ENQUEUED = "listrunner.queue.enqueued";
    public static final String SHUNTED = "listrunner.queue.shunted";
    public static final String OUTCOME = "listrunner.pipeline.outcome";
    public static final String FAILURE = "listrunner.pipeline.failure";
    public static final String BOUNCE_REGISTERED = "listrunner.bounce.registered";
    public static final String BOUNCE_UNRECOGNIZED = "listrunner.bounce.unrecognized";

    /**
     * Private constructor for utility class.
     */
    private QueueMetrics() {
    }

    /**
     * Increment the enqueued counter.
     *
     * @param queue Queue directory name.
     */
    public static void incrementEnqueued(String queue) {
        increment(ENQUEUED, "queue", queue);
    }

    /**
     * Increment the shunted counter.
     *
     * @param queue Queue directory name the message was shunted from.
     */
    public static void incrementShunted(String queue) {
        increment(SHUNTED, "queue", queue);
    }

    /**
     * Increment the pipeline outcome counter.
     *
     * @param pipeline Pipeline name.
     * @param outcome  Outcome kind.
     */
    public static void incrementOutcome(String pipeline, String outcome) {
        increment(OUTCOME, "pipeline", pipeline, "outcome", outcome);
    }

    /**
     * Increment the pipeline failure counter.
     *
     * @param pipeline Pipeline name.
     */
    public static void incrementFailure(String pipeline) {
        increment(FAILURE, "pipeline", pipeline);
    }

    /**
     * Increment the registered bounce counter.
     *
     * @param severity Bounce severity.
     */
    public static void incrementBounce(String severity) {
        increment(BOUNCE_REGISTERED, "severity", severity);
    }

    /**
     * Increment the unrecognized bounce counter.
     */
    public static void incrementUnrecognizedBounce() {
        increment(BOUNCE_UNRECOGNIZED);
    }

    private static void increment(String name, String... tags) {
        try {
            MeterRegistry registry = MetricsRegistry.getRegistry();
            if (registry != null) {
                registry.counter(name, tags).increment();
            }
        } catch (Exception e) {
            log.warn("Failed to increment counter: name={}, error={}", name, e.getMessage());
        }
    }
}
