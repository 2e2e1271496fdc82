package com.mimecast.listrunner.queue;

/**
 * Unit of work read from a switchboard.
 *
 * <p>The payload is the raw message as received and is never rewritten by the queue layer.
 */
public class QueuedMessage {

    private final String id;
    private final byte[] payload;
    private final MessageMetadata metadata;

    /**
     * Constructs a new QueuedMessage instance.
     *
     * @param id       Identifier.
     * @param payload  Raw message bytes.
     * @param metadata Metadata.
     */
    public QueuedMessage(String id, byte[] payload, MessageMetadata metadata) {
        this.id = id;
        this.payload = payload;
        this.metadata = metadata;
    }

    public String getId() {
        return id;
    }

    public byte[] getPayload() {
        return payload;
    }

    public MessageMetadata getMetadata() {
        return metadata;
    }
}
