package com.mimecast.listrunner.bounce;

import com.mimecast.listrunner.config.list.ListConfig;
import com.mimecast.listrunner.config.site.BounceConfig;
import com.mimecast.listrunner.directory.DeliveryStatus;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.directory.Member;
import com.mimecast.listrunner.metrics.QueueMetrics;
import com.mimecast.listrunner.notice.Notifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scores bounces against the bounce ledger.
 *
 * <p>At most one increment per member per calendar day.
 * Reaching the list threshold disables delivery and starts the warning cycle.
 */
public class BounceProcessor {
    private static final Logger log = LogManager.getLogger(BounceProcessor.class);

    /**
     * Result of registering a bounce.
     */
    public enum Result {
        NON_MEMBER,
        ALREADY_DISABLED,
        ALREADY_SCORED_TODAY,
        SCORED,
        DISABLED
    }

    /**
     * Result of sending the next disable notification.
     */
    public enum Notification {
        WARNED,
        REMOVED
    }

    private final BounceConfig config;
    private final Notifier notifier;
    private final Clock clock;

    /**
     * Constructs a new BounceProcessor instance.
     *
     * @param config   Bounce config with severity weights.
     * @param notifier Notifier.
     * @param clock    Clock deciding the calendar day.
     */
    public BounceProcessor(BounceConfig config, Notifier notifier, Clock clock) {
        this.config = config;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * Registers a bounce for an address.
     *
     * @param list     Mailing list.
     * @param address  Bouncing address.
     * @param severity Severity.
     * @param bounce   Bounce message, attached to owner notices.
     * @return Result.
     * @throws IOException Unable to read or update the ledger or roster.
     */
    public Result register(MailingList list, String address, BounceSeverity severity, byte[] bounce) throws IOException {
        Optional<Member> member = list.getRoster().getMember(address);
        if (member.isEmpty()) {
            log.info("Bounce for non-member ignored: list={}, address={}", list.getName(), address);
            return Result.NON_MEMBER;
        }
        if (!member.get().isEnabled()) {
            log.info("Residual bounce ignored: list={}, address={}, status={}",
                    list.getName(), address, member.get().getDeliveryStatus());
            return Result.ALREADY_DISABLED;
        }

        ListConfig policy = list.getPolicy();
        LocalDate today = LocalDate.now(clock);
        double weight = severity == BounceSeverity.HARD ? config.getHardWeight() : config.getSoftWeight();
        AtomicReference<Result> result = new AtomicReference<>(Result.SCORED);

        BounceRecord record = list.getLedger().update(address, current -> {
            BounceRecord updated = current;
            if (updated == null) {
                updated = new BounceRecord(Member.normalize(address), policy.getBounceInfoStaleAfterDays())
                        .setScore(weight);
            } else if (updated.scoredOn(today)) {
                // Still enabled at the threshold: an earlier disable did not complete.
                if (updated.getScore() >= policy.getBounceScoreThreshold()) {
                    updated.setWarningsSent(0).setLastWarningDate(null);
                    result.set(Result.DISABLED);
                } else {
                    result.set(Result.ALREADY_SCORED_TODAY);
                }
                return updated;
            } else if (updated.isStale(today)) {
                updated.setScore(weight);
            } else {
                updated.setScore(updated.getScore() + weight);
            }
            updated.setLastBounceDate(today).setStaleAfterDays(policy.getBounceInfoStaleAfterDays());

            if (updated.getScore() >= policy.getBounceScoreThreshold()) {
                updated.setWarningsSent(0).setLastWarningDate(null);
                result.set(Result.DISABLED);
            }
            return updated;
        });

        switch (result.get()) {
            case ALREADY_SCORED_TODAY -> log.info("Bounce already scored today: list={}, address={}, score={}",
                    list.getName(), address, record.getScore());
            case SCORED -> {
                QueueMetrics.incrementBounce(severity.name());
                log.info("Bounce scored: list={}, address={}, severity={}, score={}",
                        list.getName(), address, severity, record.getScore());
                if (policy.isBounceNotifyOwnerOnIncrement()) {
                    notifier.ownerBounceNotice(list, address, "bounce score incremented to " + record.getScore(), bounce);
                }
            }
            case DISABLED -> {
                QueueMetrics.incrementBounce(severity.name());
                disable(list, address, record, bounce);
            }
            default -> {
            }
        }
        return result.get();
    }

    /**
     * Sends the next disable warning, or removes the member once every warning was sent.
     *
     * @param list    Mailing list.
     * @param address Member address.
     * @return Notification.
     * @throws IOException Unable to update the ledger or roster.
     */
    public Notification sendNextNotification(MailingList list, String address) throws IOException {
        ListConfig policy = list.getPolicy();
        LocalDate today = LocalDate.now(clock);
        int warningsSent = list.getLedger().get(address).map(BounceRecord::getWarningsSent).orElse(0);
        int noticesLeft = policy.getBounceWarningsCount() - warningsSent;

        if (noticesLeft <= 0) {
            list.getRoster().removeMember(address);
            list.getLedger().remove(address);
            log.info("Member removed after bounce warnings: list={}, address={}, warnings={}",
                    list.getName(), address, warningsSent);
            if (policy.isBounceNotifyOwnerOnRemoval()) {
                notifier.ownerBounceNotice(list, address, "removed after " + warningsSent + " disable warnings", null);
            }
            return Notification.REMOVED;
        }

        notifier.disableWarning(list, address, noticesLeft - 1);
        list.getLedger().update(address, current -> current == null ? null :
                current.setWarningsSent(current.getWarningsSent() + 1).setLastWarningDate(today));
        log.info("Disable warning sent: list={}, address={}, noticesLeft={}", list.getName(), address, noticesLeft - 1);
        return Notification.WARNED;
    }

    /**
     * Re-enables a member disabled by bounces and forgets their bounce record.
     *
     * @param list    Mailing list.
     * @param address Member address.
     * @return True when the member exists.
     * @throws IOException Unable to update the ledger or roster.
     */
    public boolean reenable(MailingList list, String address) throws IOException {
        boolean updated = list.getRoster().setDeliveryStatus(address, DeliveryStatus.ENABLED);
        list.getLedger().remove(address);
        if (updated) {
            log.info("Member re-enabled: list={}, address={}", list.getName(), address);
        }
        return updated;
    }

    private void disable(MailingList list, String address, BounceRecord record, byte[] bounce) throws IOException {
        list.getRoster().setDeliveryStatus(address, DeliveryStatus.BY_BOUNCE);
        log.info("Member disabled by bounces: list={}, address={}, score={}, threshold={}",
                list.getName(), address, record.getScore(), list.getPolicy().getBounceScoreThreshold());

        if (list.getPolicy().isBounceNotifyOwnerOnDisable()) {
            notifier.ownerBounceNotice(list, address, "delivery disabled, bounce score " + record.getScore() +
                    " reached " + list.getPolicy().getBounceScoreThreshold(), bounce);
        }
        sendNextNotification(list, address);
    }
}
