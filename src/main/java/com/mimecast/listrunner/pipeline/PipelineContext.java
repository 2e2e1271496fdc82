package com.mimecast.listrunner.pipeline;

import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.main.Services;
import com.mimecast.listrunner.message.ParsedMessage;
import com.mimecast.listrunner.queue.MessageMetadata;
import com.mimecast.listrunner.queue.QueuedMessage;

import java.io.IOException;

/**
 * State of one pipeline run.
 *
 * <p>The payload is shared read only, the metadata is the run's working copy.
 */
public class PipelineContext {

    private final MailingList list;
    private final QueuedMessage message;
    private final MessageMetadata metadata;
    private final Services services;
    private ParsedMessage parsed;

    /**
     * Constructs a new PipelineContext instance.
     *
     * @param list     Target list.
     * @param message  Dequeued message.
     * @param services Shared collaborators.
     */
    public PipelineContext(MailingList list, QueuedMessage message, Services services) {
        this.list = list;
        this.message = message;
        this.metadata = message.getMetadata();
        this.services = services;
    }

    public MailingList getList() {
        return list;
    }

    public String getId() {
        return message.getId();
    }

    public byte[] getPayload() {
        return message.getPayload();
    }

    public MessageMetadata getMetadata() {
        return metadata;
    }

    public Services getServices() {
        return services;
    }

    /**
     * Gets parsed view of the payload.
     *
     * @return ParsedMessage instance.
     * @throws IOException Unable to parse.
     */
    public ParsedMessage getParsed() throws IOException {
        if (parsed == null) {
            parsed = ParsedMessage.parse(message.getPayload());
        }
        return parsed;
    }

    /**
     * Gets sender address.
     *
     * @return Lower case address or empty string.
     * @throws IOException Unable to parse.
     */
    public String getSender() throws IOException {
        return getParsed().getSender(metadata.getString(MessageMetadata.ENVSENDER));
    }
}
