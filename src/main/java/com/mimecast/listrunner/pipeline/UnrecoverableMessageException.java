package com.mimecast.listrunner.pipeline;

/**
 * Handler failure that retrying cannot fix.
 * <p>The message is shunted on the first occurrence.
 */
public class UnrecoverableMessageException extends PipelineException {

    /**
     * Constructs a new UnrecoverableMessageException instance.
     *
     * @param message Message.
     */
    public UnrecoverableMessageException(String message) {
        super(message);
    }

    /**
     * Constructs a new UnrecoverableMessageException instance with cause.
     *
     * @param message Message.
     * @param cause   Cause.
     */
    public UnrecoverableMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
