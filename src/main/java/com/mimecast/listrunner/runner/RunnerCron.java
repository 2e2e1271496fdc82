package com.mimecast.listrunner.runner;

import com.mimecast.listrunner.config.site.MaintenanceConfig;
import com.mimecast.listrunner.config.site.RunnerConfig;
import com.mimecast.listrunner.config.site.SiteConfig;
import com.mimecast.listrunner.main.Config;
import com.mimecast.listrunner.main.Factories;
import com.mimecast.listrunner.queue.QueueException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Starts the configured queue runners and the maintenance schedule.
 *
 * <p>Each runner instance gets its own thread.
 * <p>A shutdown hook stops every runner and waits for the in-flight cycles to drain.
 */
public class RunnerCron {
    private static final Logger log = LogManager.getLogger(RunnerCron.class);

    // Seconds allowed for runners to drain on shutdown.
    private static final long DRAIN_SECONDS = 30L;

    private static final List<QueueRunner> runners = new ArrayList<>();
    private static volatile ExecutorService runnerExecutor;
    private static volatile ScheduledExecutorService scheduler;

    /**
     * Private constructor.
     */
    private RunnerCron() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Starts runners and maintenance.
     *
     * @param only Runner name to start, null for every enabled runner.
     * @throws QueueException Unable to open a queue.
     */
    public static synchronized void run(String only) throws QueueException {
        if (runnerExecutor != null) {
            return; // Already running.
        }

        SiteConfig site = Config.getSite();
        for (RunnerConfig config : site.getRunners()) {
            if (only != null ? !config.getName().equals(only) : !config.isEnabled()) {
                continue;
            }
            for (int i = 0; i < config.getInstances(); i++) {
                runners.add(Factories.getRunner(config));
            }
        }
        if (runners.isEmpty()) {
            log.warn("No runners to start: only={}", only);
            return;
        }

        runnerExecutor = Executors.newFixedThreadPool(runners.size());
        for (QueueRunner runner : runners) {
            runnerExecutor.execute(runner);
        }
        log.info("RunnerCron started: runners={}", runners.size());

        schedule(site.getMaintenance(), new Maintenance(Factories.getListDirectory(), Factories.getServices()));

        Runtime.getRuntime().addShutdownHook(new Thread(RunnerCron::shutdown));
    }

    private static void schedule(MaintenanceConfig config, Maintenance maintenance) {
        scheduler = Executors.newScheduledThreadPool(1);

        long expiry = config.getHoldExpiryIntervalSeconds();
        if (expiry > 0) {
            scheduler.scheduleAtFixedRate(() -> {
                try {
                    maintenance.expireHolds();
                } catch (Exception e) {
                    log.error("Hold expiry task error: {}", e.getMessage());
                }
            }, expiry, expiry, TimeUnit.SECONDS);
        }

        long grace = config.getOrphanGraceSeconds();
        if (grace > 0) {
            scheduler.scheduleAtFixedRate(() -> {
                try {
                    maintenance.recoverQueues(grace * 1000L);
                } catch (Exception e) {
                    log.error("Queue recovery task error: {}", e.getMessage());
                }
            }, 0L, grace, TimeUnit.SECONDS);
        }
        log.info("Maintenance scheduled: holdExpiryIntervalSeconds={}, orphanGraceSeconds={}", expiry, grace);
    }

    /**
     * Stops runners and waits for them to drain.
     */
    public static synchronized void shutdown() {
        log.info("RunnerCron shutdown initiated");
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        for (QueueRunner runner : runners) {
            runner.stop();
        }
        if (runnerExecutor != null) {
            runnerExecutor.shutdown();
            try {
                if (!runnerExecutor.awaitTermination(DRAIN_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Runners did not drain in {} seconds", DRAIN_SECONDS);
                    runnerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                runnerExecutor.shutdownNow();
            }
            runnerExecutor = null;
        }
        runners.clear();
        log.info("RunnerCron shutdown complete");
    }
}
