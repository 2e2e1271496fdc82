package com.mimecast.listrunner.bounce;

import com.mimecast.listrunner.directory.DeliveryStatus;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.directory.Member;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Periodic bounce ledger pass.
 *
 * <ul>
 *     <li>Enabled members: stale scores drop to zero, zero scores stale for a second window are deleted.</li>
 *     <li>Members disabled by bounces: the next warning is sent when due, removal follows the last one.</li>
 *     <li>Records of former members are deleted.</li>
 * </ul>
 */
public class BounceMaintenance {
    private static final Logger log = LogManager.getLogger(BounceMaintenance.class);

    private final BounceProcessor processor;
    private final Clock clock;

    /**
     * Constructs a new BounceMaintenance instance.
     *
     * @param processor Bounce processor sending warnings.
     * @param clock     Clock.
     */
    public BounceMaintenance(BounceProcessor processor, Clock clock) {
        this.processor = processor;
        this.clock = clock;
    }

    /**
     * Runs maintenance for one list.
     *
     * @param list Mailing list.
     * @return Number of records changed.
     * @throws IOException Unable to read or update the ledger or roster.
     */
    public int run(MailingList list) throws IOException {
        LocalDate today = LocalDate.now(clock);
        int interval = Math.max(1, list.getPolicy().getBounceWarningsIntervalDays());
        int changed = 0;

        for (BounceRecord record : list.getLedger().records()) {
            String address = record.getAddress();
            Optional<Member> member = list.getRoster().getMember(address);

            if (member.isEmpty()) {
                list.getLedger().remove(address);
                changed++;
                continue;
            }

            DeliveryStatus status = member.get().getDeliveryStatus();
            if (status == DeliveryStatus.ENABLED) {
                if (decay(list, address, today)) {
                    changed++;
                }
            } else if (status == DeliveryStatus.BY_BOUNCE) {
                LocalDate lastWarning = record.getLastWarningDate();
                if (lastWarning == null || !lastWarning.plusDays(interval).isAfter(today)) {
                    processor.sendNextNotification(list, address);
                    changed++;
                }
            }
        }

        log.debug("Bounce maintenance done: list={}, changed={}", list.getName(), changed);
        return changed;
    }

    private boolean decay(MailingList list, String address, LocalDate today) throws IOException {
        boolean[] changed = {false};
        list.getLedger().update(address, current -> {
            if (current == null || !current.isStale(today)) {
                return current;
            }
            if (current.getScore() > 0) {
                log.info("Stale bounce score reset: list={}, address={}, score={}",
                        list.getName(), address, current.getScore());
                changed[0] = true;
                return current.setScore(0);
            }
            LocalDate last = current.getLastBounceDate();
            if (last.plusDays(2L * current.getStaleAfterDays()).isBefore(today)) {
                log.info("Stale bounce record deleted: list={}, address={}", list.getName(), address);
                changed[0] = true;
                return null;
            }
            return current;
        });
        return changed[0];
    }
}
