package com.mimecast.listrunner.config.site;

import com.mimecast.listrunner.config.BasicConfig;

import java.util.Map;

/**
 * Queue runner definition.
 *
 * <p>Names the queue consumed, the pipeline executed by default and the cycle limits.
 */
public class RunnerConfig extends BasicConfig {

    /**
     * Constructs a new RunnerConfig instance.
     *
     * @param map Configuration map.
     */
    public RunnerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets runner name.
     *
     * @return Name string.
     */
    public String getName() {
        return getStringProperty("name", getQueue());
    }

    /**
     * Gets consumed queue name.
     *
     * @return Queue directory name.
     */
    public String getQueue() {
        return getStringProperty("queue", "in");
    }

    /**
     * Gets default pipeline.
     * <p>Used when the message metadata does not name one.
     *
     * @return Pipeline name.
     */
    public String getPipeline() {
        return getStringProperty("pipeline", "post");
    }

    /**
     * Gets idle polling interval.
     *
     * @return Milliseconds.
     */
    public long getPollIntervalMillis() {
        return getLongProperty("pollIntervalMillis", 1000L);
    }

    /**
     * Gets failure count at which a message is shunted.
     *
     * @return Count.
     */
    public int getMaxFailures() {
        return Math.toIntExact(getLongProperty("maxFailures", 3L));
    }

    /**
     * Gets per cycle batch size cap.
     *
     * @return Count, 0 for unbounded.
     */
    public int getBatchSize() {
        return Math.toIntExact(getLongProperty("batchSize", 100L));
    }

    /**
     * Gets number of runner instances sharing the queue.
     *
     * @return Count.
     */
    public int getInstances() {
        return Math.max(1, Math.toIntExact(getLongProperty("instances", 1L)));
    }

    /**
     * Is runner enabled.
     *
     * @return Boolean.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", true);
    }
}
