package com.mimecast.listrunner.config.list;

import com.mimecast.listrunner.config.ConfigFoundation;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * List moderation and delivery policy.
 *
 * <p>Read from {@code list.json5} in the list directory.
 * <p>Consumed, never mutated, by the handler pipeline.
 */
public class ListConfig extends ConfigFoundation {

    /**
     * Constructs a new ListConfig instance.
     *
     * @param map Configuration map.
     */
    public ListConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ListConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ListConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets list host name.
     *
     * @param siteHostname Site host name used when the list does not define one.
     * @return Host name.
     */
    public String getHostname(String siteHostname) {
        return getStringProperty("hostname", siteHostname);
    }

    /**
     * Gets display name.
     *
     * @param listName List name used when no display name is set.
     * @return Display name.
     */
    public String getRealName(String listName) {
        return getStringProperty("realName", listName);
    }

    /**
     * Gets description.
     *
     * @return Description string.
     */
    public String getDescription() {
        return getStringProperty("description", "");
    }

    // Roles.

    public List<String> getOwners() {
        return getStringListProperty("owners");
    }

    public List<String> getModerators() {
        return getStringListProperty("moderators");
    }

    /**
     * Gets moderator password.
     * <p>A post carrying it in an Approved header skips every hold criterion.
     *
     * @return Password or empty string when approval by header is disabled.
     */
    public String getModeratorPassword() {
        return getStringProperty("moderatorPassword", "");
    }

    // Moderation.

    /**
     * Gets moderation flag given to new members.
     *
     * @return Boolean.
     */
    public boolean isDefaultMemberModeration() {
        return getBooleanProperty("defaultMemberModeration", false);
    }

    public ModerationAction getMemberModerationAction() {
        return ModerationAction.parse(getStringProperty("memberModerationAction"), ModerationAction.HOLD);
    }

    public NonMemberAction getNonMemberAction() {
        return NonMemberAction.parse(getStringProperty("nonMemberAction"), NonMemberAction.HOLD);
    }

    /**
     * Gets non-member address patterns for a given action.
     * <p>Entries starting with {@code ^} are regular expressions, others are exact addresses.
     *
     * @param action Action.
     * @return List of patterns.
     */
    public List<String> getNonMemberPatterns(NonMemberAction action) {
        return switch (action) {
            case ACCEPT -> getStringListProperty("acceptNonMembers");
            case HOLD -> getStringListProperty("holdNonMembers");
            case REJECT -> getStringListProperty("rejectNonMembers");
            case DISCARD -> getStringListProperty("discardNonMembers");
        };
    }

    /**
     * Gets custom rejection text for non-member posts.
     *
     * @return Text or empty string.
     */
    public String getNonMemberRejectionNotice() {
        return getStringProperty("nonMemberRejectionNotice", "");
    }

    /**
     * Gets custom rejection text for moderated member posts.
     *
     * @return Text or empty string.
     */
    public String getMemberModerationNotice() {
        return getStringProperty("memberModerationNotice", "");
    }

    public boolean isEmergency() {
        return getBooleanProperty("emergency", false);
    }

    public boolean isAdministrivia() {
        return getBooleanProperty("administrivia", true);
    }

    /**
     * Gets body size limit.
     *
     * @return Kilobytes, 0 for unlimited.
     */
    public long getMaxMessageSizeKb() {
        return getLongProperty("maxMessageSizeKb", 40L);
    }

    /**
     * Gets recipient count at which a post is held.
     *
     * @return Count, 0 for unlimited.
     */
    public int getMaxNumRecipients() {
        return Math.toIntExact(getLongProperty("maxNumRecipients", 10L));
    }

    public boolean isRequireExplicitDestination() {
        return getBooleanProperty("requireExplicitDestination", true);
    }

    /**
     * Gets alternative addresses accepted as explicit destination.
     * <p>Entries starting with {@code ^} are regular expressions.
     *
     * @return List of aliases.
     */
    public List<String> getAcceptableAliases() {
        return getStringListProperty("acceptableAliases");
    }

    /**
     * Gets suspicious header rules.
     * <p>Each entry reads {@code Header-Name: regex}.
     *
     * @return List of rules.
     */
    public List<String> getBounceMatchingHeaders() {
        return getStringListProperty("bounceMatchingHeaders");
    }

    // Holds.

    /**
     * Gets pending hold capacity.
     *
     * @return Count, 0 for unlimited.
     */
    public int getMaxHeldMessages() {
        return Math.toIntExact(getLongProperty("maxHeldMessages", 0L));
    }

    /**
     * Gets age after which pending holds are discarded.
     *
     * @return Days, 0 to keep forever.
     */
    public int getMaxDaysToHold() {
        return Math.toIntExact(getLongProperty("maxDaysToHold", 0L));
    }

    /**
     * Gets age after which decided hold records are deleted.
     *
     * @return Days, 0 to keep forever.
     */
    public int getHoldRecordRetentionDays() {
        return Math.toIntExact(getLongProperty("holdRecordRetentionDays", 30L));
    }

    /**
     * Should senders of held posts be told.
     *
     * @return Boolean.
     */
    public boolean isRespondToPostRequests() {
        return getBooleanProperty("respondToPostRequests", true);
    }

    /**
     * Should moderators be told of each new hold.
     *
     * @return Boolean.
     */
    public boolean isAdminImmedNotify() {
        return getBooleanProperty("adminImmedNotify", true);
    }

    // Membership.

    public SubscriptionPolicy getSubscribePolicy() {
        return SubscriptionPolicy.parse(getStringProperty("subscribePolicy"), SubscriptionPolicy.MODERATE);
    }

    public SubscriptionPolicy getUnsubscribePolicy() {
        return SubscriptionPolicy.parse(getStringProperty("unsubscribePolicy"), SubscriptionPolicy.OPEN);
    }

    /**
     * Gets number of body lines scanned for commands.
     *
     * @return Count.
     */
    public int getMaxCommandLines() {
        return Math.toIntExact(getLongProperty("maxCommandLines", 25L));
    }

    // Content.

    public String getSubjectPrefix() {
        return getStringProperty("subjectPrefix", "");
    }

    public String getMsgHeader() {
        return getStringProperty("msgHeader", "");
    }

    public String getMsgFooter() {
        return getStringProperty("msgFooter", "");
    }

    public boolean isReplyGoesToList() {
        return getBooleanProperty("replyGoesToList", false);
    }

    public boolean isArchive() {
        return getBooleanProperty("archive", true);
    }

    public boolean isDigestable() {
        return getBooleanProperty("digestable", true);
    }

    /**
     * Should outgoing mail use per-recipient VERP envelopes.
     *
     * @return Boolean.
     */
    public boolean isVerpDelivery() {
        return getBooleanProperty("verpDelivery", false);
    }

    // Bounces.

    public boolean isBounceProcessing() {
        return getBooleanProperty("bounceProcessing", true);
    }

    /**
     * Gets score at which delivery to a member is disabled.
     *
     * @return Threshold.
     */
    public double getBounceScoreThreshold() {
        return getDoubleProperty("bounceScoreThreshold", 5.0);
    }

    /**
     * Gets days without bounces after which a score is stale.
     *
     * @return Days.
     */
    public int getBounceInfoStaleAfterDays() {
        return Math.toIntExact(getLongProperty("bounceInfoStaleAfterDays", 7L));
    }

    /**
     * Gets number of disable warnings sent before removal.
     *
     * @return Count.
     */
    public int getBounceWarningsCount() {
        return Math.toIntExact(getLongProperty("bounceWarningsCount", 3L));
    }

    /**
     * Gets days between disable warnings.
     *
     * @return Days.
     */
    public int getBounceWarningsIntervalDays() {
        return Math.toIntExact(getLongProperty("bounceWarningsIntervalDays", 7L));
    }

    public boolean isBounceUnrecognizedGoesToOwner() {
        return getBooleanProperty("bounceUnrecognizedGoesToOwner", true);
    }

    public boolean isBounceNotifyOwnerOnDisable() {
        return getBooleanProperty("bounceNotifyOwnerOnDisable", true);
    }

    public boolean isBounceNotifyOwnerOnRemoval() {
        return getBooleanProperty("bounceNotifyOwnerOnRemoval", true);
    }

    public boolean isBounceNotifyOwnerOnIncrement() {
        return getBooleanProperty("bounceNotifyOwnerOnIncrement", false);
    }
}
