package com.mimecast.listrunner.runner;

import com.mimecast.listrunner.config.site.RunnerConfig;
import com.mimecast.listrunner.directory.ListDirectory;
import com.mimecast.listrunner.main.Services;
import com.mimecast.listrunner.queue.Switchboard;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Queue runner of the bounces queue.
 *
 * <p>Between cycles it also runs the bounce ledger maintenance pass, once per configured interval.
 */
public class BounceRunner extends QueueRunner {
    private static final Logger log = LogManager.getLogger(BounceRunner.class);

    private final Maintenance maintenance;
    private final long intervalMillis;
    private long lastMaintenanceMillis = 0L;

    /**
     * Constructs a new BounceRunner instance.
     *
     * @param config      Runner config.
     * @param switchboard Bounces switchboard.
     * @param directory   List directory.
     * @param services    Shared collaborators.
     */
    public BounceRunner(RunnerConfig config, Switchboard switchboard, ListDirectory directory, Services services) {
        super(config, switchboard, directory, services);
        this.maintenance = new Maintenance(directory, services);
        this.intervalMillis = services.getSite().getMaintenance().getBounceMaintenanceIntervalSeconds() * 1000L;
    }

    @Override
    protected void doPeriodic() {
        long now = services.getClock().millis();
        if (intervalMillis <= 0 || now - lastMaintenanceMillis < intervalMillis) {
            return;
        }
        lastMaintenanceMillis = now;

        int changed = maintenance.bounces();
        log.debug("Bounce maintenance pass: name={}, changed={}", getName(), changed);
    }
}
