package com.mimecast.listrunner.pipeline;

/**
 * Handler failure.
 * <p>Counted against the message and retried until the failure limit shunts it.
 */
public class PipelineException extends Exception {

    /**
     * Constructs a new PipelineException instance.
     *
     * @param message Message.
     */
    public PipelineException(String message) {
        super(message);
    }

    /**
     * Constructs a new PipelineException instance with cause.
     *
     * @param message Message.
     * @param cause   Cause.
     */
    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
