package com.mimecast.listrunner.entry;

import com.mimecast.listrunner.directory.ListDirectory;
import com.mimecast.listrunner.message.MessageRenderer;
import com.mimecast.listrunner.message.ParsedMessage;
import com.mimecast.listrunner.metrics.QueueMetrics;
import com.mimecast.listrunner.queue.MessageMetadata;
import com.mimecast.listrunner.queue.SwitchboardProvider;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Arrays;
import java.util.Locale;

/**
 * Synchronous adapter between the mail transport and the switchboards.
 *
 * <p>One call per inbound message: the list is resolved, routing metadata attached and the message durably enqueued.
 * Only a returned id means the transport may consider the message accepted.
 */
public class QueueEntry {
    private static final Logger log = LogManager.getLogger(QueueEntry.class);

    private static final byte[] MBOX_FROM = "From ".getBytes(StandardCharsets.US_ASCII);

    private final ListDirectory directory;
    private final SwitchboardProvider switchboards;
    private final Clock clock;

    /**
     * Constructs a new QueueEntry instance.
     *
     * @param directory    List directory.
     * @param switchboards Switchboard provider.
     * @param clock        Clock stamping {@code received_time}.
     */
    public QueueEntry(ListDirectory directory, SwitchboardProvider switchboards, Clock clock) {
        this.directory = directory;
        this.switchboards = switchboards;
        this.clock = clock;
    }

    /**
     * Enqueues an inbound message.
     *
     * @param listName  Target list name.
     * @param role      Address role.
     * @param raw       Raw message bytes, an mbox From line is stripped.
     * @param envsender Envelope sender, null to take it from Return-Path.
     * @return New queue id.
     * @throws UnknownListException      No such list, nothing enqueued.
     * @throws MalformedMessageException Not a mail message, nothing enqueued.
     * @throws IOException               Unable to read the list or enqueue.
     */
    public String submit(String listName, Role role, byte[] raw, String envsender)
            throws UnknownListException, MalformedMessageException, IOException {
        String name = StringUtils.trimToEmpty(listName).toLowerCase(Locale.ROOT);
        if (name.isEmpty() || directory.resolve(name).isEmpty()) {
            log.warn("Unknown list: list={}, role={}", listName, role);
            throw new UnknownListException(listName);
        }

        byte[] payload = stripMboxFrom(raw);
        if (payload.length == 0 || !MessageRenderer.hasHeaderBlock(payload)) {
            throw new MalformedMessageException("Input is not a mail message");
        }

        String sender = envsender;
        if (StringUtils.isBlank(sender)) {
            sender = returnPath(payload);
        }

        MessageMetadata metadata = new MessageMetadata()
                .setString(MessageMetadata.LISTNAME, name)
                .setString(MessageMetadata.PIPELINE, role.getPipeline())
                .setBoolean(role.getFlag(), true)
                .setString(MessageMetadata.ENVSENDER, StringUtils.defaultString(sender).trim())
                .setLong(MessageMetadata.RECEIVED_TIME, clock.millis())
                .setString(MessageMetadata.WHICHQ, role.getQueue().getDirectory())
                .setInt(MessageMetadata.PIPELINE_POSITION, 0)
                .setInt(MessageMetadata.FAILURES, 0);

        String id = switchboards.get(role.getQueue()).enqueue(payload, metadata);
        QueueMetrics.incrementEnqueued(role.getQueue().getDirectory());
        log.info("Message enqueued: list={}, role={}, queue={}, id={}, size={}",
                name, role, role.getQueue().getDirectory(), id, payload.length);
        return id;
    }

    /**
     * Drops a leading mbox {@code From } separator line.
     */
    static byte[] stripMboxFrom(byte[] raw) {
        if (raw == null) {
            return new byte[0];
        }
        if (raw.length < MBOX_FROM.length || !Arrays.equals(raw, 0, MBOX_FROM.length, MBOX_FROM, 0, MBOX_FROM.length)) {
            return raw;
        }
        for (int i = 0; i < raw.length; i++) {
            if (raw[i] == '\n') {
                return Arrays.copyOfRange(raw, i + 1, raw.length);
            }
        }
        return new byte[0];
    }

    private static String returnPath(byte[] payload) throws MalformedMessageException {
        try {
            String value = ParsedMessage.parse(payload).getHeader("Return-Path");
            return StringUtils.strip(StringUtils.trimToEmpty(value), "<>");
        } catch (IOException e) {
            throw new MalformedMessageException("Unable to parse headers: " + e.getMessage(), e);
        }
    }
}
