package com.mimecast.listrunner.entry;

/**
 * Inbound bytes are not a mail message.
 */
public class MalformedMessageException extends Exception {

    /**
     * Constructs a new MalformedMessageException instance.
     *
     * @param message Detail.
     */
    public MalformedMessageException(String message) {
        super(message);
    }

    /**
     * Constructs a new MalformedMessageException instance with cause.
     *
     * @param message Detail.
     * @param cause   Cause.
     */
    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
