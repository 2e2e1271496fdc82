package com.mimecast.listrunner.queue;

import java.io.Closeable;

/**
 * Exclusive ownership of a queued message.
 *
 * <p>Closing releases ownership without removing the entry.
 * <p>A claim held by a process that dies lapses with it.
 */
public interface MessageClaim extends Closeable {

    /**
     * Gets claimed identifier.
     *
     * @return Identifier.
     */
    String getId();

    /**
     * Releases ownership.
     * <p>Never throws, release failures are logged by the implementation.
     */
    @Override
    void close();
}
