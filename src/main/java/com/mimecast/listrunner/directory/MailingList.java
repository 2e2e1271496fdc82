package com.mimecast.listrunner.directory;

import com.mimecast.listrunner.bounce.BounceLedger;
import com.mimecast.listrunner.config.list.ListConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Resolved mailing list.
 *
 * <p>Bundles the list policy with its roster and bounce ledger partition.
 * <p>Role addresses follow the {@code name-role@host} convention.
 */
public class MailingList {

    private final String name;
    private final String hostname;
    private final ListConfig policy;
    private final Roster roster;
    private final BounceLedger ledger;

    /**
     * Constructs a new MailingList instance.
     *
     * @param name     List name.
     * @param hostname Site host name, overridden by the list policy when it sets one.
     * @param policy   List policy.
     * @param roster   Membership.
     * @param ledger   Bounce ledger.
     */
    public MailingList(String name, String hostname, ListConfig policy, Roster roster, BounceLedger ledger) {
        this.name = name.toLowerCase(Locale.ROOT);
        this.hostname = policy.getHostname(hostname);
        this.policy = policy;
        this.roster = roster;
        this.ledger = ledger;
    }

    public String getName() {
        return name;
    }

    public String getHostname() {
        return hostname;
    }

    public ListConfig getPolicy() {
        return policy;
    }

    public Roster getRoster() {
        return roster;
    }

    public BounceLedger getLedger() {
        return ledger;
    }

    public String getRealName() {
        return policy.getRealName(name);
    }

    public String getPostingAddress() {
        return name + "@" + hostname;
    }

    public String getBouncesAddress() {
        return roleAddress("bounces");
    }

    public String getOwnerAddress() {
        return roleAddress("owner");
    }

    public String getRequestAddress() {
        return roleAddress("request");
    }

    public String getJoinAddress() {
        return roleAddress("join");
    }

    public String getLeaveAddress() {
        return roleAddress("leave");
    }

    /**
     * Gets List-Id header value.
     *
     * @return List-Id string.
     */
    public String getListId() {
        return getRealName() + " <" + name + "." + hostname + ">";
    }

    /**
     * Gets owners and moderators, without duplicates.
     * <p>Falls back to the owner role address when none are configured.
     *
     * @return List of addresses.
     */
    public List<String> getModerationRecipients() {
        List<String> recipients = new ArrayList<>();
        for (String address : policy.getOwners()) {
            addUnique(recipients, address);
        }
        for (String address : policy.getModerators()) {
            addUnique(recipients, address);
        }
        if (recipients.isEmpty()) {
            recipients.add(getOwnerAddress());
        }
        return recipients;
    }

    private String roleAddress(String role) {
        return name + "-" + role + "@" + hostname;
    }

    private static void addUnique(List<String> list, String address) {
        for (String existing : list) {
            if (Member.normalize(existing).equals(Member.normalize(address))) {
                return;
            }
        }
        list.add(address);
    }

    @Override
    public String toString() {
        return name;
    }
}
