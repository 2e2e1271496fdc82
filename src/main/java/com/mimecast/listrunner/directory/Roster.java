package com.mimecast.listrunner.directory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * List membership.
 *
 * <p>Address lookups are case insensitive.
 */
public interface Roster {

    /**
     * Gets member by address.
     *
     * @param address Email address.
     * @return Optional of Member.
     * @throws IOException Unable to read roster.
     */
    Optional<Member> getMember(String address) throws IOException;

    /**
     * Is address a member.
     *
     * @param address Email address.
     * @return Boolean.
     * @throws IOException Unable to read roster.
     */
    default boolean isMember(String address) throws IOException {
        return getMember(address).isPresent();
    }

    /**
     * Gets all members.
     *
     * @return List of Member.
     * @throws IOException Unable to read roster.
     */
    List<Member> members() throws IOException;

    /**
     * Adds or replaces a member.
     *
     * @param member Member instance.
     * @throws IOException Unable to write roster.
     */
    void addMember(Member member) throws IOException;

    /**
     * Removes a member.
     *
     * @param address Email address.
     * @return True if the member existed.
     * @throws IOException Unable to write roster.
     */
    boolean removeMember(String address) throws IOException;

    /**
     * Changes the delivery status of a member.
     *
     * @param address Email address.
     * @param status  New status.
     * @return True if the member existed.
     * @throws IOException Unable to write roster.
     */
    boolean setDeliveryStatus(String address, DeliveryStatus status) throws IOException;
}
