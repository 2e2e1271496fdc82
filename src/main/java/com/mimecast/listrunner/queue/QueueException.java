package com.mimecast.listrunner.queue;

import java.io.IOException;

/**
 * Switchboard storage failure.
 * <p>Surfaced to callers so the inbound message is never acknowledged before it is durable.
 */
public class QueueException extends IOException {

    /**
     * Constructs a new QueueException instance.
     *
     * @param message Message.
     */
    public QueueException(String message) {
        super(message);
    }

    /**
     * Constructs a new QueueException instance with cause.
     *
     * @param message Message.
     * @param cause   Cause.
     */
    public QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
