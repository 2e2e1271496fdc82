package com.mimecast.listrunner.directory;

/**
 * Member delivery status.
 * <p>Every value other than {@link #ENABLED} stops regular delivery and names who disabled it.
 */
public enum DeliveryStatus {
    ENABLED,
    BY_USER,
    BY_ADMIN,
    BY_BOUNCE
}
