package com.mimecast.listrunner.bounce;

/**
 * Bounce severity.
 */
public enum BounceSeverity {
    /**
     * Permanent failure like an unknown user.
     */
    HARD,

    /**
     * Transient failure like a full mailbox.
     */
    SOFT
}
