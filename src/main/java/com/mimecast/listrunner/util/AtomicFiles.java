package com.mimecast.listrunner.util;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Whole file writes through a temporary name and an atomic rename.
 *
 * <p>Readers see either the previous content or the new content, never a torn file.
 */
public final class AtomicFiles {

    /**
     * Suffix of in-progress temporary files.
     */
    public static final String TMP_SUFFIX = ".tmp";

    /**
     * Private constructor for utility class.
     */
    private AtomicFiles() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Writes data to target.
     * <p>The temporary file is flushed to disk before it is renamed into place.
     *
     * @param target Target file.
     * @param data   Content.
     * @param tmpDir Directory for the temporary file, must be on the same file system as target.
     * @throws IOException Unable to write or rename.
     */
    public static void write(Path target, byte[] data, Path tmpDir) throws IOException {
        Files.createDirectories(tmpDir);
        Path tmp = tmpDir.resolve(target.getFileName() + "." + UUID.randomUUID() + TMP_SUFFIX);
        try {
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(data);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            move(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Renames a file, replacing the target.
     *
     * @param source Source file.
     * @param target Target file.
     * @throws IOException Unable to rename.
     */
    public static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            throw new IOException("Atomic rename unsupported between " + source.getParent() + " and " + target.getParent(), e);
        }
    }
}
