package com.mimecast.listrunner.notice;

import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.hold.HoldReason;
import com.mimecast.listrunner.hold.HoldRecord;
import com.mimecast.listrunner.metrics.QueueMetrics;
import com.mimecast.listrunner.queue.MessageMetadata;
import com.mimecast.listrunner.queue.QueueKind;
import com.mimecast.listrunner.queue.SwitchboardProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Crafts notices and hands them to the virgin queue.
 *
 * <p>Notices skip list decoration and carry their own recipient set.
 */
public class Notifier {
    private static final Logger log = LogManager.getLogger(Notifier.class);

    public static final String VIRGIN_PIPELINE = "virgin";

    private final SwitchboardProvider switchboards;
    private final Clock clock;

    /**
     * Constructs a new Notifier instance.
     *
     * @param switchboards Switchboard provider.
     * @param clock        Clock.
     */
    public Notifier(SwitchboardProvider switchboards, Clock clock) {
        this.switchboards = switchboards;
        this.clock = clock;
    }

    /**
     * Tells a sender their post was rejected.
     *
     * @param list     Mailing list.
     * @param sender   Original sender.
     * @param subject  Original subject.
     * @param reason   Explanation.
     * @param original Original message, attached unchanged.
     * @throws IOException Unable to enqueue.
     */
    public void rejection(MailingList list, String sender, String subject, String reason, byte[] original) throws IOException {
        String text = "Your message entitled\n\n    " + subject(subject) + "\n\n" +
                "was rejected by the " + list.getRealName() + " mailing list for the following reason:\n\n" +
                reason + "\n\n" +
                "Questions about this can be sent to " + list.getOwnerAddress() + "\n";
        send(list, list.getOwnerAddress(), List.of(sender), "Request to mailing list " + list.getRealName() + " rejected",
                text, original);
    }

    /**
     * Tells a sender their post awaits moderator approval.
     *
     * @param list    Mailing list.
     * @param record  Hold record.
     * @throws IOException Unable to enqueue.
     */
    public void heldToSender(MailingList list, HoldRecord record) throws IOException {
        String text = "Your mail to '" + list.getRealName() + "' with the subject\n\n    " + subject(record.getSubject()) + "\n\n" +
                "Is being held until the list moderator can review it for approval.\n\n" +
                "The reason it is being held:\n\n" + describe(record.getHoldReasons()) + "\n" +
                "Either the message will get posted to the list, or you will receive notification of the moderator's decision.\n";
        send(list, list.getOwnerAddress(), List.of(record.getSender()),
                "Your message to " + list.getRealName() + " awaits moderator approval", text, null);
    }

    /**
     * Tells owners and moderators a post awaits their decision.
     *
     * @param list     Mailing list.
     * @param record   Hold record.
     * @param original Held message, attached unchanged.
     * @throws IOException Unable to enqueue.
     */
    public void moderatorNotice(MailingList list, HoldRecord record, byte[] original) throws IOException {
        String text = "As list administrator, your authorization is requested for the following mailing list posting:\n\n" +
                "    List:    " + list.getPostingAddress() + "\n" +
                "    From:    " + record.getSender() + "\n" +
                "    Subject: " + subject(record.getSubject()) + "\n" +
                "    Hold id: " + record.getId() + "\n\n" +
                "Reasons:\n" + describe(record.getHoldReasons()) + "\n" +
                "The message is held until you approve, reject or discard it.\n";
        send(list, list.getOwnerAddress(), list.getModerationRecipients(),
                list.getRealName() + " post from " + record.getSender() + " requires approval", text, original);
    }

    /**
     * Warns a member whose delivery was disabled by bounces.
     *
     * @param list        Mailing list.
     * @param address     Member address.
     * @param noticesLeft Warnings left before removal.
     * @throws IOException Unable to enqueue.
     */
    public void disableWarning(MailingList list, String address, int noticesLeft) throws IOException {
        String text = "Your membership in the mailing list " + list.getRealName() + " has been disabled due to excessive bounces.\n\n" +
                "You will receive " + noticesLeft + " more reminders like this before your membership in the list is deleted.\n\n" +
                "To re-enable your membership, contact the list owner at " + list.getOwnerAddress() + "\n";
        send(list, list.getRequestAddress(), List.of(address),
                "Your " + list.getRealName() + " mailing list membership has been disabled", text, null);
    }

    /**
     * Tells owners about a bounce processing event.
     *
     * @param list    Mailing list.
     * @param address Member address.
     * @param event   What happened.
     * @param bounce  Triggering bounce message, may be null.
     * @throws IOException Unable to enqueue.
     */
    public void ownerBounceNotice(MailingList list, String address, String event, byte[] bounce) throws IOException {
        String text = "This is a bounce processing notice for the " + list.getRealName() + " mailing list.\n\n" +
                "    Member: " + address + "\n" +
                "    Event:  " + event + "\n";
        send(list, list.getOwnerAddress(), list.getModerationRecipients(),
                "Bounce action notification: " + address, text, bounce);
    }

    /**
     * Forwards a bounce whose recipient could not be determined.
     *
     * @param list   Mailing list.
     * @param bounce Bounce message, attached unchanged.
     * @throws IOException Unable to enqueue.
     */
    public void forwardUnrecognizedBounce(MailingList list, byte[] bounce) throws IOException {
        String text = "The attached message was received as a bounce, but either the bounce format was not recognized, " +
                "or no member addresses could be extracted from it. This mailing list has been configured to send all " +
                "unrecognized bounce messages to the list administrator(s).\n";
        send(list, list.getOwnerAddress(), list.getModerationRecipients(), "Uncaught bounce notification", text, bounce);
    }

    /**
     * Replies with the results of an email command.
     *
     * @param list    Mailing list.
     * @param sender  Command sender.
     * @param results Result lines.
     * @throws IOException Unable to enqueue.
     */
    public void commandResults(MailingList list, String sender, List<String> results) throws IOException {
        String text = "The results of your email command are provided below.\n\n" +
                String.join("\n", results) + "\n";
        send(list, list.getRequestAddress(), List.of(sender), "The results of your email commands", text, null);
    }

    /**
     * Builds and enqueues a notice.
     *
     * @param list       Mailing list.
     * @param from       Header sender.
     * @param recipients Recipients.
     * @param subject    Subject.
     * @param text       Body text.
     * @param original   Attachment, may be null.
     * @return Queue identifier.
     * @throws IOException Unable to build or enqueue.
     */
    public String send(MailingList list, String from, List<String> recipients, String subject, String text, byte[] original) throws IOException {
        NoticeBuilder builder = new NoticeBuilder(from)
                .to(recipients)
                .subject(subject)
                .text(text)
                .date(clock.instant())
                .header("X-List-Administrivia", "yes")
                .header("Precedence", "bulk");
        if (original != null) {
            builder.attach(original);
        }

        MessageMetadata metadata = new MessageMetadata()
                .setString(MessageMetadata.LISTNAME, list.getName())
                .setString(MessageMetadata.PIPELINE, VIRGIN_PIPELINE)
                .setString(MessageMetadata.ENVSENDER, list.getBouncesAddress())
                .setString(MessageMetadata.WHICHQ, QueueKind.VIRGIN.getDirectory())
                .setLong(MessageMetadata.RECEIVED_TIME, clock.millis())
                .setBoolean(MessageMetadata.NODECORATE, true)
                .setStringList(MessageMetadata.RECIPS, recipients);

        String id = switchboards.get(QueueKind.VIRGIN).enqueue(builder.build(), metadata);
        QueueMetrics.incrementEnqueued(QueueKind.VIRGIN.getDirectory());
        log.info("Notice queued: list={}, id={}, subject={}, recipients={}", list.getName(), id, subject, recipients.size());
        return id;
    }

    private static String subject(String subject) {
        return subject == null || subject.isBlank() ? "(no subject)" : subject;
    }

    private static String describe(List<HoldReason> reasons) {
        return reasons.stream()
                .map(reason -> "    " + reason.getDescription())
                .collect(Collectors.joining("\n")) + "\n";
    }
}
