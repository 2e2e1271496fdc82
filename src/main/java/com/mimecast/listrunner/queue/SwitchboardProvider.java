package com.mimecast.listrunner.queue;

/**
 * Supplies the switchboard of a queue kind.
 */
@FunctionalInterface
public interface SwitchboardProvider {

    /**
     * Gets switchboard.
     *
     * @param kind Queue kind.
     * @return Switchboard instance.
     * @throws QueueException Unable to open the queue.
     */
    Switchboard get(QueueKind kind) throws QueueException;
}
