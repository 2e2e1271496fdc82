package com.mimecast.listrunner.queue;

import java.util.Optional;

/**
 * Queue kinds, one switchboard directory each.
 */
public enum QueueKind {
    IN("in"),
    BOUNCES("bounces"),
    COMMANDS("commands"),
    OUT("out"),
    VIRGIN("virgin"),
    DIGEST("digest"),
    ARCHIVE("archive"),
    SHUNT("shunt");

    private final String directory;

    QueueKind(String directory) {
        this.directory = directory;
    }

    /**
     * Gets directory name under the queue root.
     *
     * @return Directory name.
     */
    public String getDirectory() {
        return directory;
    }

    /**
     * Finds kind by directory name.
     *
     * @param directory Directory name.
     * @return Optional of QueueKind.
     */
    public static Optional<QueueKind> fromDirectory(String directory) {
        for (QueueKind kind : values()) {
            if (kind.directory.equalsIgnoreCase(directory)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
