package com.mimecast.listrunner.util;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive sections guarded across threads and processes.
 *
 * <p>A JVM level lock per path serializes threads, an OS file lock serializes processes.
 * <p>File locks are held per JVM so the JVM lock must be taken first.
 */
public final class FileLocks {

    private static final Map<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Private constructor for utility class.
     */
    private FileLocks() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Section body.
     *
     * @param <T> Result type.
     */
    @FunctionalInterface
    public interface LockedSection<T> {
        T run() throws IOException;
    }

    /**
     * Runs a section while holding the lock on the given marker file.
     * <p>Blocks until the lock is available. Nested calls on the same path by one thread re-enter.
     *
     * @param lockFile Marker file, created if missing.
     * @param section  Section body.
     * @param <T>      Result type.
     * @return Section result.
     * @throws IOException Section failure or unable to lock.
     */
    public static <T> T withLock(Path lockFile, LockedSection<T> section) throws IOException {
        Path key = lockFile.toAbsolutePath().normalize();
        ReentrantLock jvmLock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        jvmLock.lock();
        try {
            if (jvmLock.getHoldCount() > 1) {
                return section.run();
            }
            Files.createDirectories(key.getParent());
            try (FileChannel channel = FileChannel.open(key, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return section.run();
            }
        } finally {
            jvmLock.unlock();
        }
    }
}
