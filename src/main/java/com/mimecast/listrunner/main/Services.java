package com.mimecast.listrunner.main;

import com.mimecast.listrunner.bounce.BounceMaintenance;
import com.mimecast.listrunner.bounce.BounceProcessor;
import com.mimecast.listrunner.bounce.BounceScanner;
import com.mimecast.listrunner.config.site.SiteConfig;
import com.mimecast.listrunner.hold.HoldStore;
import com.mimecast.listrunner.notice.Notifier;
import com.mimecast.listrunner.queue.QueueException;
import com.mimecast.listrunner.queue.QueueKind;
import com.mimecast.listrunner.queue.Switchboard;
import com.mimecast.listrunner.queue.SwitchboardProvider;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Shared collaborators of runners and handlers.
 *
 * <p>Switchboards are opened once per queue kind and reused.
 */
public class Services {

    private final SiteConfig site;
    private final SwitchboardProvider provider;
    private final Clock clock;
    private final Map<QueueKind, Switchboard> switchboards = new EnumMap<>(QueueKind.class);

    private final Notifier notifier;
    private final HoldStore holdStore;
    private final BounceProcessor bounceProcessor;
    private final BounceScanner bounceScanner;
    private final BounceMaintenance bounceMaintenance;

    /**
     * Constructs a new Services instance.
     *
     * @param site     Site config.
     * @param provider Switchboard provider.
     * @param clock    Clock.
     */
    public Services(SiteConfig site, SwitchboardProvider provider, Clock clock) {
        this.site = site;
        this.provider = provider;
        this.clock = clock;

        this.notifier = new Notifier(this::switchboard, clock);
        this.holdStore = new HoldStore(Paths.get(site.getHoldsDir()), this::switchboard, notifier, clock);
        this.bounceProcessor = new BounceProcessor(site.getBounce(), notifier, clock);
        this.bounceScanner = new BounceScanner(site.getBounce());
        this.bounceMaintenance = new BounceMaintenance(bounceProcessor, clock);
    }

    /**
     * Gets switchboard of a queue kind.
     *
     * @param kind Queue kind.
     * @return Switchboard instance.
     * @throws QueueException Unable to open the queue.
     */
    public synchronized Switchboard switchboard(QueueKind kind) throws QueueException {
        Switchboard switchboard = switchboards.get(kind);
        if (switchboard == null) {
            switchboard = provider.get(kind);
            switchboards.put(kind, switchboard);
        }
        return switchboard;
    }

    public SiteConfig getSite() {
        return site;
    }

    public Clock getClock() {
        return clock;
    }

    public Notifier getNotifier() {
        return notifier;
    }

    public HoldStore getHoldStore() {
        return holdStore;
    }

    public BounceProcessor getBounceProcessor() {
        return bounceProcessor;
    }

    public BounceScanner getBounceScanner() {
        return bounceScanner;
    }

    public BounceMaintenance getBounceMaintenance() {
        return bounceMaintenance;
    }
}
