package com.mimecast.listrunner.directory;

import java.util.Locale;

/**
 * List member.
 *
 * <p>Serialized by Gson into the roster file.
 */
public class Member {

    private String address;
    private String name;
    private boolean moderated;
    private boolean digest;
    private DeliveryStatus deliveryStatus = DeliveryStatus.ENABLED;

    /**
     * Constructs a new Member instance for Gson.
     */
    public Member() {
    }

    /**
     * Constructs a new Member instance.
     *
     * @param address Email address.
     */
    public Member(String address) {
        this.address = address;
    }

    /**
     * Normalizes an address for comparison.
     *
     * @param address Email address.
     * @return Lower case trimmed address, empty for null.
     */
    public static String normalize(String address) {
        return address == null ? "" : address.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Is this member the given address.
     *
     * @param other Email address.
     * @return Boolean.
     */
    public boolean matches(String other) {
        return normalize(address).equals(normalize(other));
    }

    public String getAddress() {
        return address;
    }

    public String getName() {
        return name;
    }

    public Member setName(String name) {
        this.name = name;
        return this;
    }

    public boolean isModerated() {
        return moderated;
    }

    public Member setModerated(boolean moderated) {
        this.moderated = moderated;
        return this;
    }

    public boolean isDigest() {
        return digest;
    }

    public Member setDigest(boolean digest) {
        this.digest = digest;
        return this;
    }

    public DeliveryStatus getDeliveryStatus() {
        return deliveryStatus == null ? DeliveryStatus.ENABLED : deliveryStatus;
    }

    public Member setDeliveryStatus(DeliveryStatus deliveryStatus) {
        this.deliveryStatus = deliveryStatus;
        return this;
    }

    /**
     * Is regular delivery enabled.
     *
     * @return Boolean.
     */
    public boolean isEnabled() {
        return getDeliveryStatus() == DeliveryStatus.ENABLED;
    }

    @Override
    public String toString() {
        return address;
    }
}
