package com.mimecast.listrunner.main;

import com.mimecast.listrunner.config.site.RunnerConfig;
import com.mimecast.listrunner.config.site.SiteConfig;
import com.mimecast.listrunner.directory.ListDirectory;
import com.mimecast.listrunner.directory.files.FilesListDirectory;
import com.mimecast.listrunner.queue.FileSwitchboard;
import com.mimecast.listrunner.queue.QueueException;
import com.mimecast.listrunner.queue.QueueKind;
import com.mimecast.listrunner.queue.SwitchboardProvider;
import com.mimecast.listrunner.runner.BounceRunner;
import com.mimecast.listrunner.runner.QueueRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.Callable;

/**
 * Factories for pluggable components.
 *
 * <p>Every component has a default built from the site config.
 * <p>Tests and embedders may inject their own through the setters.
 */
public class Factories {
    private static final Logger log = LogManager.getLogger(Factories.class);

    /**
     * List directory.
     * <p>Resolves list names to policy, roster and bounce ledger.
     */
    private static Callable<ListDirectory> listDirectory;

    /**
     * Switchboard provider.
     * <p>Opens the backing store of each queue kind.
     */
    private static SwitchboardProvider switchboards;

    /**
     * Clock.
     * <p>Decides calendar days for bounce scoring and hold expiry.
     */
    private static Callable<Clock> clock;

    /**
     * Shared services, built on first use.
     */
    private static Services services;

    /**
     * Private constructor.
     */
    private Factories() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Sets ListDirectory.
     *
     * @param callable ListDirectory callable.
     */
    public static void setListDirectory(Callable<ListDirectory> callable) {
        listDirectory = callable;
    }

    /**
     * Gets ListDirectory.
     *
     * @return ListDirectory instance.
     */
    public static ListDirectory getListDirectory() {
        if (listDirectory != null) {
            try {
                return listDirectory.call();
            } catch (Exception e) {
                log.error("Error calling list directory: {}", e.getMessage());
            }
        }
        SiteConfig site = Config.getSite();
        return new FilesListDirectory(Paths.get(site.getListsDir()), site.getHostname());
    }

    /**
     * Sets SwitchboardProvider.
     *
     * @param provider SwitchboardProvider instance.
     */
    public static synchronized void setSwitchboards(SwitchboardProvider provider) {
        switchboards = provider;
        services = null;
    }

    /**
     * Gets SwitchboardProvider.
     *
     * @return SwitchboardProvider instance.
     */
    public static SwitchboardProvider getSwitchboards() {
        if (switchboards != null) {
            return switchboards;
        }
        return kind -> new FileSwitchboard(Paths.get(Config.getSite().getQueueDir()), kind, getClock());
    }

    /**
     * Sets Clock.
     *
     * @param callable Clock callable.
     */
    public static synchronized void setClock(Callable<Clock> callable) {
        clock = callable;
        services = null;
    }

    /**
     * Gets Clock.
     *
     * @return Clock instance.
     */
    public static Clock getClock() {
        if (clock != null) {
            try {
                return clock.call();
            } catch (Exception e) {
                log.error("Error calling clock: {}", e.getMessage());
            }
        }
        return Clock.systemUTC();
    }

    /**
     * Gets shared Services.
     * <p>Built once from the current site config, switchboards and clock.
     *
     * @return Services instance.
     */
    public static synchronized Services getServices() {
        if (services == null) {
            services = new Services(Config.getSite(), getSwitchboards(), getClock());
        }
        return services;
    }

    /**
     * Builds a queue runner.
     *
     * @param config Runner config.
     * @return QueueRunner instance, a BounceRunner for the bounces queue.
     * @throws QueueException Unknown queue or unable to open it.
     */
    public static QueueRunner getRunner(RunnerConfig config) throws QueueException {
        QueueKind kind = QueueKind.fromDirectory(config.getQueue())
                .orElseThrow(() -> new QueueException("Unknown queue " + config.getQueue() + " for runner " + config.getName()));

        Services shared = getServices();
        if (kind == QueueKind.BOUNCES) {
            return new BounceRunner(config, shared.switchboard(kind), getListDirectory(), shared);
        }
        return new QueueRunner(config, shared.switchboard(kind), getListDirectory(), shared);
    }

    /**
     * Drops every injected component.
     */
    public static synchronized void reset() {
        listDirectory = null;
        switchboards = null;
        clock = null;
        services = null;
    }
}
