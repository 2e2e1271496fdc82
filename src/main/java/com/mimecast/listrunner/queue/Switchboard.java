package com.mimecast.listrunner.queue;

import java.util.List;
import java.util.Optional;

/**
 * Durable queue scoped to a single queue kind.
 *
 * <p>Multi-producer and multi-consumer: producers enqueue, consumers claim before they dequeue.
 * <p>Implementations isolate the storage mechanics so runners do not depend on the backing store.
 *
 * @see FileSwitchboard
 * @see InMemorySwitchboard
 */
public interface Switchboard {

    /**
     * Gets queue kind.
     *
     * @return QueueKind.
     */
    QueueKind getKind();

    /**
     * Durably stores a message.
     * <p>Readers never observe a partially written entry.
     *
     * @param payload  Raw message bytes.
     * @param metadata Metadata.
     * @return New identifier.
     * @throws QueueException Storage failure.
     */
    String enqueue(byte[] payload, MessageMetadata metadata) throws QueueException;

    /**
     * Lists identifiers currently present.
     * <p>Each call rescans the store and grants no ownership.
     *
     * @return List of identifiers sorted by enqueue time.
     * @throws QueueException Storage failure.
     */
    List<String> files() throws QueueException;

    /**
     * Attempts to take exclusive ownership without blocking.
     *
     * @param id Identifier.
     * @return Optional of MessageClaim, empty if owned elsewhere or gone.
     * @throws QueueException Storage failure.
     */
    Optional<MessageClaim> claim(String id) throws QueueException;

    /**
     * Reads payload and metadata.
     *
     * @param id Identifier.
     * @return Optional of QueuedMessage, empty if either half is missing.
     * @throws QueueException Storage failure.
     */
    Optional<QueuedMessage> dequeue(String id) throws QueueException;

    /**
     * Replaces the metadata of an entry.
     *
     * @param id       Identifier.
     * @param metadata Metadata.
     * @throws QueueException Storage failure.
     */
    void update(String id, MessageMetadata metadata) throws QueueException;

    /**
     * Removes an entry after it reached a terminal outcome.
     *
     * @param id Identifier.
     * @throws QueueException Storage failure.
     */
    void finish(String id) throws QueueException;

    /**
     * Moves an entry unchanged into the shunt queue with the reason recorded in its metadata.
     *
     * @param id     Identifier.
     * @param reason Failure detail.
     * @throws QueueException Storage failure.
     */
    void shunt(String id, String reason) throws QueueException;

    /**
     * Gets number of entries.
     *
     * @return Count.
     * @throws QueueException Storage failure.
     */
    default int size() throws QueueException {
        return files().size();
    }

    /**
     * Repairs leftovers of interrupted writes.
     *
     * @param graceMillis Minimum age of a leftover before it is touched.
     * @return Number of entries repaired.
     * @throws QueueException Storage failure.
     */
    default int recover(long graceMillis) throws QueueException {
        return 0;
    }
}
