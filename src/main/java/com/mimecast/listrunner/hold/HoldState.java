package com.mimecast.listrunner.hold;

/**
 * Hold record decision state.
 */
public enum HoldState {
    PENDING,
    APPROVED,
    REJECTED,
    DISCARDED
}
