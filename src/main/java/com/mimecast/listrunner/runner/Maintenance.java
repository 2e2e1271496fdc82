package com.mimecast.listrunner.runner;

import com.mimecast.listrunner.directory.ListDirectory;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.main.Services;
import com.mimecast.listrunner.queue.QueueKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Periodic housekeeping across every list and queue.
 *
 * <p>A failing list or queue is logged and skipped, the others still run.
 */
public class Maintenance {
    private static final Logger log = LogManager.getLogger(Maintenance.class);

    private final ListDirectory directory;
    private final Services services;

    /**
     * Constructs a new Maintenance instance.
     *
     * @param directory List directory.
     * @param services  Shared collaborators.
     */
    public Maintenance(ListDirectory directory, Services services) {
        this.directory = directory;
        this.services = services;
    }

    /**
     * Auto-discards pending holds older than each list's {@code maxDaysToHold}
     * and deletes decided records past {@code holdRecordRetentionDays}.
     *
     * @return Number of holds expired.
     */
    public int expireHolds() {
        int expired = 0;
        for (MailingList list : lists()) {
            try {
                expired += services.getHoldStore().expire(list, list.getPolicy().getMaxDaysToHold(), services.getClock().instant());
                services.getHoldStore().prune(list, list.getPolicy().getHoldRecordRetentionDays(), services.getClock().instant());
            } catch (Exception e) {
                log.error("Hold expiry failed: list={}, error={}", list.getName(), e.getMessage());
            }
        }
        if (expired > 0) {
            log.info("Holds expired: count={}", expired);
        }
        return expired;
    }

    /**
     * Runs the bounce ledger pass for every list.
     *
     * @return Number of records changed.
     */
    public int bounces() {
        int changed = 0;
        for (MailingList list : lists()) {
            try {
                changed += services.getBounceMaintenance().run(list);
            } catch (Exception e) {
                log.error("Bounce maintenance failed: list={}, error={}", list.getName(), e.getMessage());
            }
        }
        return changed;
    }

    /**
     * Repairs interrupted writes in every queue but the shunt.
     *
     * @param graceMillis Minimum age of a leftover before it is touched.
     * @return Number of entries repaired.
     */
    public int recoverQueues(long graceMillis) {
        int repaired = 0;
        for (QueueKind kind : QueueKind.values()) {
            if (kind == QueueKind.SHUNT) {
                continue;
            }
            try {
                repaired += services.switchboard(kind).recover(graceMillis);
            } catch (Exception e) {
                log.error("Queue recovery failed: queue={}, error={}", kind.getDirectory(), e.getMessage());
            }
        }
        if (repaired > 0) {
            log.warn("Queue entries repaired: count={}", repaired);
        }
        return repaired;
    }

    /**
     * Runs every task once.
     */
    public void runAll() {
        long grace = services.getSite().getMaintenance().getOrphanGraceSeconds() * 1000L;
        int repaired = recoverQueues(grace);
        int expired = expireHolds();
        int changed = bounces();
        log.info("Maintenance done: repaired={}, expired={}, bounceRecordsChanged={}", repaired, expired, changed);
    }

    private List<MailingList> lists() {
        List<MailingList> lists = new ArrayList<>();
        try {
            for (String name : directory.listNames()) {
                directory.resolve(name).ifPresent(lists::add);
            }
        } catch (Exception e) {
            log.error("Unable to enumerate lists: error={}", e.getMessage());
        }
        return lists;
    }
}
