package com.mimecast.listrunner.hold;

import java.util.Optional;

/**
 * Why a message waits for a moderator.
 *
 * <p>Each reason carries the text shown to moderators and the default text sent to the sender on rejection.
 */
public enum HoldReason {
    EMERGENCY("Emergency hold on all list traffic is in effect",
            "Your message was deemed inappropriate by the moderator."),
    MODERATED_POST("Post to moderated list",
            "Your message was deemed inappropriate by the moderator."),
    NON_MEMBER_POST("Post by non-member to a members-only list",
            "Non-members are not allowed to post messages to this list."),
    ADMINISTRIVIA("Message may contain administrivia",
            "Please do *not* post administrative requests to the mailing list. " +
                    "Send a message with the word `help' in it to the request address for further instructions."),
    TOO_MANY_RECIPIENTS("Too many recipients to the message",
            "Please trim the recipient list; it is too long."),
    IMPLICIT_DESTINATION("Message has implicit destination",
            "Blind carbon copies or other implicit destinations are not allowed. " +
                    "Try reposting your message by explicitly including the list address in the To: or Cc: fields."),
    SUSPICIOUS_HEADERS("Message has a suspicious header",
            "Your message had a suspicious header."),
    MESSAGE_TOO_BIG("Message body is too big",
            "Your message was too big; please trim it."),
    HTML_VIEWER_REQUIRED("Message contains HTML viewer required text",
            "Your message contains text indicating it requires an HTML viewer, which is not allowed."),
    SUBSCRIPTION_APPROVAL("Subscription requires moderator approval",
            "Your subscription request was rejected by the list moderator."),
    UNSUBSCRIPTION_APPROVAL("Unsubscription requires moderator approval",
            "Your unsubscription request was rejected by the list moderator.");

    private final String description;
    private final String rejection;

    HoldReason(String description, String rejection) {
        this.description = description;
        this.rejection = rejection;
    }

    /**
     * Gets moderator facing description.
     *
     * @return Description.
     */
    public String getDescription() {
        return description;
    }

    /**
     * Gets default rejection text.
     *
     * @return Text.
     */
    public String getRejection() {
        return rejection;
    }

    /**
     * Finds reason by name.
     *
     * @param name Enum name.
     * @return Optional of HoldReason.
     */
    public static Optional<HoldReason> fromName(String name) {
        for (HoldReason reason : values()) {
            if (reason.name().equalsIgnoreCase(name)) {
                return Optional.of(reason);
            }
        }
        return Optional.empty();
    }
}
