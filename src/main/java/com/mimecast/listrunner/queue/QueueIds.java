package com.mimecast.listrunner.queue;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Queue message identifier generator.
 *
 * <p>Identifiers read {@code <epochMillis>+<sha1hex>} so they sort by enqueue time.
 * <p>The hash covers a random UUID, a process counter and the nano time, hence ids are never reused.
 */
public final class QueueIds {

    private static final AtomicLong counter = new AtomicLong();
    private static final Pattern VALID = Pattern.compile("^\\d+\\+[0-9a-f]{40}$");

    /**
     * Private constructor for utility class.
     */
    private QueueIds() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Generates a new identifier.
     *
     * @param epochMillis Enqueue time.
     * @return Identifier string.
     */
    public static String next(long epochMillis) {
        String seed = UUID.randomUUID() + ":" + counter.incrementAndGet() + ":" + System.nanoTime();
        return epochMillis + "+" + DigestUtils.sha1Hex(seed);
    }

    /**
     * Checks an identifier is well formed.
     * <p>Guards file operations against path traversal through crafted ids.
     *
     * @param id Identifier.
     * @return Boolean.
     */
    public static boolean isValid(String id) {
        return id != null && VALID.matcher(id).matches();
    }

    /**
     * Gets the enqueue time encoded in an identifier.
     *
     * @param id Identifier.
     * @return Epoch millis, 0 if malformed.
     */
    public static long timestamp(String id) {
        if (!isValid(id)) {
            return 0L;
        }
        return Long.parseLong(id.substring(0, id.indexOf('+')));
    }
}
