package com.mimecast.listrunner.bounce;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Known non-DSN bounce formats.
 *
 * <p>Each template has a start pattern, an end pattern and an address pattern with a named {@code addr} group.
 * Addresses are collected from the line matching the start pattern until the end pattern.
 */
public final class BounceTemplates {

    /**
     * Bounce template.
     *
     * @param start   Start of the recipient section.
     * @param end     End of the recipient section.
     * @param address Address pattern with an {@code addr} group.
     */
    public record Template(Pattern start, Pattern end, Pattern address) {
    }

    /**
     * Addresses worth scoring.
     */
    public static final Pattern VALID = compile("^[\\x21-\\x3d\\x3f\\x41-\\x7e]+@[a-z0-9._-]+$");

    /**
     * Permanent failure formats.
     */
    public static final List<Template> PERMANENT = List.of(
            template("here is your list of failed recipients", "here is your returned mail", "<(?<addr>[^>]*)>"),
            template("the following addresses had", "transcript of session follows",
                    "^ *(\\(expanded from: )?<?(?<addr>[^\\s@]+@[^\\s@>]+?)>?\\)?\\s*$"),
            template("this message was created automatically by mail delivery software", "original message follows",
                    "rcpt to:\\s*<(?<addr>[^>]*)>"),
            template("failed addresses follow:", "message text follows:", "\\s*(?<addr>\\S+@\\S+)"),
            template("The following addresses did NOT receive a copy of your message:", "--- Session Transcript ---",
                    "[>]\\s*(?<addr>.*)$"),
            template("Intended recipient:\\s*(?<addr>.*)$", "--------RETURNED MAIL FOLLOWS--------",
                    "Intended recipient:\\s*(?<addr>.*)$"),
            template("Undeliverable Address:\\s*(?<addr>.*)$", "Original message attached",
                    "Undeliverable Address:\\s*(?<addr>.*)$"),
            template("The email below could not be delivered to the following user:", "Old message:",
                    "<(?<addr>[^>]*)>"),
            template("Unable to deliver message to the following address\\(es\\)\\.", "--- Original message follows\\.",
                    "<(?<addr>[^>]*)>:"),
            template("Delivery to the following recipient(s)? failed", "----- Original message -----",
                    "^\\s*(?<addr>[^\\s@]+@[^\\s@]+)\\s*$"),
            template("A message that you( have)? sent could not be delivered", "^---", "<(?<addr>[^>]*)>"),
            template("A message that you( have)? sent could not be delivered", "^---", "^(?<addr>[^\\s@]+@[^\\s@:]+):"),
            template("^Sorry, unable to deliver your message to", "^A copy of the original message",
                    "\\s*(?<addr>[^\\s@]+@[^\\s@]+)\\s+"),
            template("^A message could not be delivered to:", "^Subject:", "^\\s*(?<addr>[^\\s@]+@[^\\s@]+)\\s*$"),
            template("---- Failed Recipients ----", " Mail ----", "<(?<addr>[^>]*)>"),
            template("Your message could not be delivered", "^-", "<(?<addr>[^>]*)>:"),
            template("Could not deliver message to", "^\\s*--", "^Failed Recipient:\\s*(?<addr>[^\\s@]+@[^\\s@]+)\\s*$"),
            template("Message could not be delivered to some recipients.", "Message headers follow",
                    "Recipient: \\[SMTP:(?<addr>[^\\s@]+@[^\\s@]+)\\]"),
            template("This is a delivery failure notification message", "The problem appears to be",
                    "-- (?<addr>[^\\s@]+@[^\\s@]+)")
    );

    /**
     * Transient warning formats.
     */
    public static final List<Template> TRANSIENT = List.of(
            template("The address to which the message has not yet been delivered is", "No action is required on your part",
                    "\\s*(?<addr>\\S+@\\S+)\\s*"),
            template("This is just a warning, you do not need to take any action", "^\\s*--", "(?<addr>\\S+@\\S+)"),
            template("Delivery attempts will continue to be made", "^\\s*--", "(?<addr>\\S+@\\S+)"),
            template("THIS IS A WARNING MESSAGE ONLY", "Message will be retried", "\\s*(?<addr>\\S+@\\S+)\\s*"),
            template("We will continue to try to deliver", "^\\s*--", "(?<addr>\\S+@\\S+)"),
            template("User's mailbox is full:", "Unable to deliver mail.", "User's mailbox is full:\\s*<(?<addr>[^>]*)>")
    );

    /**
     * Private constructor for utility class.
     */
    private BounceTemplates() {
        throw new IllegalStateException("Static class");
    }

    private static Template template(String start, String end, String address) {
        return new Template(compile(start), compile(end), compile(address));
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
