package com.mimecast.listrunner.pipeline;

import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.hold.HoldRecord;
import com.mimecast.listrunner.hold.HoldStore;
import com.mimecast.listrunner.main.Services;
import com.mimecast.listrunner.message.MessageRenderer;
import com.mimecast.listrunner.message.ParsedMessage;
import com.mimecast.listrunner.metrics.QueueMetrics;
import com.mimecast.listrunner.queue.MessageMetadata;
import com.mimecast.listrunner.queue.QueueKind;
import com.mimecast.listrunner.queue.QueuedMessage;
import com.mimecast.listrunner.queue.Switchboard;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Locale;
import java.util.Optional;

/**
 * Applies the effects of terminal outcomes.
 *
 * <p>Called before the queue entry is finished, so every effect here is repeated if the runner crashes in between.
 * Holds are idempotent by id, notices and deliveries are at least once.
 */
public class Disposition {
    private static final Logger log = LogManager.getLogger(Disposition.class);

    private final Services services;

    /**
     * Constructs a new Disposition instance.
     *
     * @param services Shared collaborators.
     */
    public Disposition(Services services) {
        this.services = services;
    }

    /**
     * Applies a terminal outcome.
     *
     * @param context Pipeline context.
     * @param outcome Terminal outcome.
     * @throws IOException Unable to apply.
     */
    public void apply(PipelineContext context, Outcome outcome) throws IOException {
        switch (outcome.getKind()) {
            case HOLD -> hold(context, outcome);
            case REJECT -> reject(context, outcome);
            case DISCARD -> log.info("Message discarded: list={}, id={}, reason={}",
                    context.getList().getName(), context.getId(), outcome.getReason());
            case DELIVER -> deliver(context);
            default -> throw new IllegalArgumentException("Not a terminal outcome: " + outcome);
        }
    }

    private void hold(PipelineContext context, Outcome outcome) throws IOException {
        MailingList list = context.getList();
        HoldStore store = services.getHoldStore();
        Optional<HoldRecord> existing = store.get(list.getName(), context.getId());
        if (existing.isPresent()) {
            log.info("Hold already recorded: list={}, id={}, state={}",
                    list.getName(), context.getId(), existing.get().getState());
            return;
        }

        ParsedMessage message = context.getParsed();
        String sender = context.getSender();
        QueuedMessage held = new QueuedMessage(context.getId(), context.getPayload(), context.getMetadata());
        HoldRecord record = store.hold(list.getName(), held, outcome.getHoldReasons(),
                sender, message.getSubject(), message.getMessageId());

        if (list.getPolicy().isRespondToPostRequests() && StringUtils.isNotBlank(sender) && wantsAck(message)) {
            services.getNotifier().heldToSender(list, record);
        }
        if (list.getPolicy().isAdminImmedNotify()) {
            services.getNotifier().moderatorNotice(list, record, context.getPayload());
        }
    }

    /**
     * Bulk, junk and list traffic gets no acknowledgement unless it asks for one.
     */
    static boolean wantsAck(ParsedMessage message) {
        String precedence = StringUtils.defaultString(message.getHeader("Precedence")).trim().toLowerCase(Locale.ROOT);
        if (precedence.equals("bulk") || precedence.equals("junk") || precedence.equals("list")) {
            return "yes".equalsIgnoreCase(StringUtils.trimToEmpty(message.getHeader("X-Ack")));
        }
        return true;
    }

    private void reject(PipelineContext context, Outcome outcome) throws IOException {
        MailingList list = context.getList();
        String sender = context.getSender();
        log.info("Message rejected: list={}, id={}, sender={}, reason={}",
                list.getName(), context.getId(), sender, outcome.getReason());
        if (StringUtils.isBlank(sender)) {
            log.warn("Rejection notice skipped, no sender: list={}, id={}", list.getName(), context.getId());
            return;
        }
        services.getNotifier().rejection(list, sender, context.getParsed().getSubject(),
                outcome.getReason(), context.getPayload());
    }

    private void deliver(PipelineContext context) throws IOException {
        MailingList list = context.getList();
        MessageMetadata metadata = context.getMetadata();
        byte[] rendered = MessageRenderer.render(context.getPayload(), metadata);

        MessageMetadata out = new MessageMetadata()
                .setString(MessageMetadata.LISTNAME, list.getName())
                .setStringList(MessageMetadata.RECIPS, metadata.getStringList(MessageMetadata.RECIPS))
                .setString(MessageMetadata.ENVSENDER, list.getBouncesAddress())
                .setBoolean(MessageMetadata.VERP, list.getPolicy().isVerpDelivery())
                .setString(MessageMetadata.WHICHQ, QueueKind.OUT.getDirectory())
                .setLong(MessageMetadata.RECEIVED_TIME, services.getClock().millis());

        Switchboard switchboard = services.switchboard(QueueKind.OUT);
        String id = switchboard.enqueue(rendered, out);
        QueueMetrics.incrementEnqueued(QueueKind.OUT.getDirectory());
        log.info("Message delivered: list={}, id={}, outId={}, recipients={}",
                list.getName(), context.getId(), id, out.getStringList(MessageMetadata.RECIPS).size());
    }
}
