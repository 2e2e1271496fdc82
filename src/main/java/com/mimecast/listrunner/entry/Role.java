package com.mimecast.listrunner.entry;

import com.mimecast.listrunner.pipeline.PipelineRegistry;
import com.mimecast.listrunner.queue.MessageMetadata;
import com.mimecast.listrunner.queue.QueueKind;

import java.util.Locale;
import java.util.Optional;

/**
 * List address a message was sent to.
 *
 * <p>Decides the queue, the pipeline and the metadata flag written at entry.
 */
public enum Role {
    POST(QueueKind.IN, PipelineRegistry.POST, MessageMetadata.TO_LIST),
    OWNER(QueueKind.IN, PipelineRegistry.OWNER, MessageMetadata.TO_OWNER),
    REQUEST(QueueKind.COMMANDS, PipelineRegistry.COMMAND, MessageMetadata.TO_REQUEST),
    JOIN(QueueKind.COMMANDS, PipelineRegistry.COMMAND, MessageMetadata.TO_JOIN),
    LEAVE(QueueKind.COMMANDS, PipelineRegistry.COMMAND, MessageMetadata.TO_LEAVE),
    BOUNCES(QueueKind.BOUNCES, PipelineRegistry.BOUNCE, MessageMetadata.TO_BOUNCE);

    private final QueueKind queue;
    private final String pipeline;
    private final String flag;

    Role(QueueKind queue, String pipeline, String flag) {
        this.queue = queue;
        this.pipeline = pipeline;
        this.flag = flag;
    }

    public QueueKind getQueue() {
        return queue;
    }

    public String getPipeline() {
        return pipeline;
    }

    public String getFlag() {
        return flag;
    }

    /**
     * Finds role by name, case insensitive.
     *
     * @param name Role name.
     * @return Optional of Role.
     */
    public static Optional<Role> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
