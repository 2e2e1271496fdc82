package com.mimecast.listrunner.queue;

import com.mimecast.listrunner.util.AtomicFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Filesystem backed switchboard.
 *
 * <p>Layout under {@code <root>/<kind>/}:
 * <ul>
 *     <li>{@code <id>.msg} raw payload.</li>
 *     <li>{@code <id>.json} metadata, written last and acting as the commit marker.</li>
 *     <li>{@code <id>.lck} ownership marker locked with {@link FileChannel#tryLock()}.</li>
 *     <li>{@code tmp/} in-progress writes renamed into place.</li>
 * </ul>
 * <p>Shunted entries keep the same pairing under {@code <root>/shunt/}.
 */
public class FileSwitchboard implements Switchboard {
    private static final Logger log = LogManager.getLogger(FileSwitchboard.class);

    public static final String PAYLOAD_SUFFIX = ".msg";
    public static final String METADATA_SUFFIX = ".json";
    public static final String LOCK_SUFFIX = ".lck";
    private static final String TMP_DIR = "tmp";

    private final QueueKind kind;
    private final Path dir;
    private final Path tmpDir;
    private final Path shuntDir;
    private final Clock clock;

    /**
     * Constructs a new FileSwitchboard instance.
     *
     * @param root Queue root directory.
     * @param kind Queue kind.
     * @throws QueueException Unable to create directories.
     */
    public FileSwitchboard(Path root, QueueKind kind) throws QueueException {
        this(root, kind, Clock.systemUTC());
    }

    /**
     * Constructs a new FileSwitchboard instance with given clock.
     *
     * @param root  Queue root directory.
     * @param kind  Queue kind.
     * @param clock Clock for identifiers and file ages.
     * @throws QueueException Unable to create directories.
     */
    public FileSwitchboard(Path root, QueueKind kind, Clock clock) throws QueueException {
        this.kind = kind;
        this.dir = root.resolve(kind.getDirectory());
        this.tmpDir = dir.resolve(TMP_DIR);
        this.shuntDir = root.resolve(QueueKind.SHUNT.getDirectory());
        this.clock = clock;
        try {
            Files.createDirectories(tmpDir);
            Files.createDirectories(shuntDir.resolve(TMP_DIR));
        } catch (IOException e) {
            throw new QueueException("Unable to create queue directory " + dir + ": " + e.getMessage(), e);
        }
    }

    @Override
    public QueueKind getKind() {
        return kind;
    }

    /**
     * Gets queue directory.
     *
     * @return Path.
     */
    public Path getDirectory() {
        return dir;
    }

    @Override
    public String enqueue(byte[] payload, MessageMetadata metadata) throws QueueException {
        String id = QueueIds.next(clock.millis());
        Path payloadFile = dir.resolve(id + PAYLOAD_SUFFIX);
        try {
            AtomicFiles.write(payloadFile, payload, tmpDir);
            AtomicFiles.write(dir.resolve(id + METADATA_SUFFIX), metadata.toJson().getBytes(StandardCharsets.UTF_8), tmpDir);
        } catch (IOException e) {
            // Roll back the payload so no orphan is left for recovery.
            try {
                Files.deleteIfExists(payloadFile);
            } catch (IOException rollback) {
                log.error("Rollback failed: queue={}, id={}, error={}", kind.getDirectory(), id, rollback.getMessage());
            }
            throw new QueueException("Enqueue failed in " + dir + ": " + e.getMessage(), e);
        }

        log.debug("Enqueued: queue={}, id={}, bytes={}", kind.getDirectory(), id, payload.length);
        return id;
    }

    @Override
    public List<String> files() throws QueueException {
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + METADATA_SUFFIX)) {
            for (Path path : stream) {
                String id = stripSuffix(path.getFileName().toString(), METADATA_SUFFIX);
                if (QueueIds.isValid(id)) {
                    ids.add(id);
                }
            }
        } catch (IOException e) {
            throw new QueueException("Unable to list " + dir + ": " + e.getMessage(), e);
        }
        Collections.sort(ids);
        return ids;
    }

    @Override
    public Optional<MessageClaim> claim(String id) throws QueueException {
        if (!QueueIds.isValid(id) || !Files.exists(dir.resolve(id + METADATA_SUFFIX))) {
            return Optional.empty();
        }

        Path lockFile = dir.resolve(id + LOCK_SUFFIX);
        FileChannel channel = null;
        try {
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock;
            try {
                lock = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                // Held by another runner in this JVM.
                lock = null;
            }
            if (lock == null) {
                channel.close();
                return Optional.empty();
            }

            // The owner may have finished it between listing and locking.
            if (!Files.exists(dir.resolve(id + METADATA_SUFFIX))) {
                Files.deleteIfExists(lockFile);
                lock.release();
                channel.close();
                return Optional.empty();
            }

            log.trace("Claimed: queue={}, id={}", kind.getDirectory(), id);
            return Optional.of(new FileClaim(id, channel, lock));
        } catch (IOException e) {
            closeQuietly(channel, id);
            throw new QueueException("Unable to claim " + id + " in " + dir + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<QueuedMessage> dequeue(String id) throws QueueException {
        if (!QueueIds.isValid(id)) {
            return Optional.empty();
        }
        try {
            byte[] payload = Files.readAllBytes(dir.resolve(id + PAYLOAD_SUFFIX));
            String json = Files.readString(dir.resolve(id + METADATA_SUFFIX), StandardCharsets.UTF_8);
            return Optional.of(new QueuedMessage(id, payload, MessageMetadata.fromJson(json)));
        } catch (NoSuchFileException e) {
            log.debug("Incomplete entry skipped: queue={}, id={}, missing={}", kind.getDirectory(), id, e.getFile());
            return Optional.empty();
        } catch (QueueException e) {
            throw e;
        } catch (IOException e) {
            throw new QueueException("Unable to read " + id + " from " + dir + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void update(String id, MessageMetadata metadata) throws QueueException {
        Path metadataFile = dir.resolve(id + METADATA_SUFFIX);
        if (!QueueIds.isValid(id) || !Files.exists(metadataFile)) {
            throw new QueueException("No such entry " + id + " in " + dir);
        }
        try {
            AtomicFiles.write(metadataFile, metadata.toJson().getBytes(StandardCharsets.UTF_8), tmpDir);
        } catch (IOException e) {
            throw new QueueException("Unable to update " + id + " in " + dir + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void finish(String id) throws QueueException {
        if (!QueueIds.isValid(id)) {
            return;
        }
        try {
            // Payload first so a crash leaves a metadata-only entry that dequeue skips.
            Files.deleteIfExists(dir.resolve(id + PAYLOAD_SUFFIX));
            Files.deleteIfExists(dir.resolve(id + METADATA_SUFFIX));
            Files.deleteIfExists(dir.resolve(id + LOCK_SUFFIX));
        } catch (IOException e) {
            throw new QueueException("Unable to finish " + id + " in " + dir + ": " + e.getMessage(), e);
        }
        log.debug("Finished: queue={}, id={}", kind.getDirectory(), id);
    }

    @Override
    public void shunt(String id, String reason) throws QueueException {
        if (!QueueIds.isValid(id)) {
            throw new QueueException("Invalid id " + id);
        }
        Path payloadFile = dir.resolve(id + PAYLOAD_SUFFIX);
        Path metadataFile = dir.resolve(id + METADATA_SUFFIX);
        try {
            if (Files.exists(payloadFile)) {
                AtomicFiles.move(payloadFile, shuntDir.resolve(id + PAYLOAD_SUFFIX));
            }

            MessageMetadata metadata = readForShunt(metadataFile);
            metadata.setString(MessageMetadata.SHUNT_REASON, reason)
                    .setString(MessageMetadata.WHICHQ, kind.getDirectory())
                    .setLong(MessageMetadata.SHUNTED_TIME, clock.millis());
            AtomicFiles.write(shuntDir.resolve(id + METADATA_SUFFIX),
                    metadata.toJson().getBytes(StandardCharsets.UTF_8), shuntDir.resolve(TMP_DIR));

            if (kind != QueueKind.SHUNT) {
                Files.deleteIfExists(metadataFile);
            }
            Files.deleteIfExists(dir.resolve(id + LOCK_SUFFIX));
        } catch (IOException e) {
            throw new QueueException("Unable to shunt " + id + " from " + dir + ": " + e.getMessage(), e);
        }
        log.warn("Shunted: queue={}, id={}, reason={}", kind.getDirectory(), id, reason);
    }

    /**
     * Reads metadata of an entry being shunted.
     * <p>Unreadable metadata is preserved as text inside fresh metadata.
     */
    private MessageMetadata readForShunt(Path metadataFile) throws IOException {
        if (!Files.exists(metadataFile)) {
            return new MessageMetadata();
        }
        String json = Files.readString(metadataFile, StandardCharsets.UTF_8);
        try {
            return MessageMetadata.fromJson(json);
        } catch (QueueException e) {
            return new MessageMetadata().setString("original_metadata", json);
        }
    }

    /**
     * Repairs leftovers of interrupted writes older than the grace period.
     * <ul>
     *     <li>Temporary files are deleted.</li>
     *     <li>Payloads without metadata are shunted.</li>
     *     <li>Metadata without payload is completed: an interrupted shunt is finished, an interrupted finish is removed.</li>
     *     <li>Lock markers of vanished entries are deleted when nobody holds them.</li>
     * </ul>
     *
     * @param graceMillis Minimum file age.
     * @return Number of entries repaired.
     * @throws QueueException Storage failure.
     */
    @Override
    public int recover(long graceMillis) throws QueueException {
        long cutoff = clock.millis() - graceMillis;
        int repaired = 0;
        try {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(tmpDir)) {
                for (Path tmp : stream) {
                    if (olderThan(tmp, cutoff)) {
                        Files.deleteIfExists(tmp);
                        log.info("Removed stale temporary file: queue={}, file={}", kind.getDirectory(), tmp.getFileName());
                    }
                }
            }

            List<Path> entries = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                stream.forEach(entries::add);
            }
            for (Path path : entries) {
                String name = path.getFileName().toString();
                if (name.endsWith(PAYLOAD_SUFFIX)) {
                    String id = stripSuffix(name, PAYLOAD_SUFFIX);
                    if (QueueIds.isValid(id) && !Files.exists(dir.resolve(id + METADATA_SUFFIX)) && olderThan(path, cutoff)) {
                        shunt(id, "orphaned payload");
                        repaired++;
                    }
                } else if (name.endsWith(METADATA_SUFFIX) && kind != QueueKind.SHUNT) {
                    String id = stripSuffix(name, METADATA_SUFFIX);
                    if (QueueIds.isValid(id) && !Files.exists(dir.resolve(id + PAYLOAD_SUFFIX)) && olderThan(path, cutoff)) {
                        repaired += completeInterrupted(id);
                    }
                } else if (name.endsWith(LOCK_SUFFIX)) {
                    String id = stripSuffix(name, LOCK_SUFFIX);
                    if (!Files.exists(dir.resolve(id + METADATA_SUFFIX)) && olderThan(path, cutoff)) {
                        removeUnheldLock(path);
                    }
                }
            }
        } catch (IOException e) {
            throw new QueueException("Recovery failed in " + dir + ": " + e.getMessage(), e);
        }

        if (repaired > 0) {
            log.warn("Recovered entries: queue={}, count={}", kind.getDirectory(), repaired);
        }
        return repaired;
    }

    /**
     * Completes an entry whose payload is gone.
     */
    private int completeInterrupted(String id) throws IOException {
        Optional<MessageClaim> claim = claim(id);
        if (claim.isEmpty()) {
            return 0;
        }
        try (MessageClaim ignored = claim.get()) {
            if (Files.exists(shuntDir.resolve(id + PAYLOAD_SUFFIX))) {
                shunt(id, "interrupted shunt");
            } else {
                finish(id);
                log.info("Removed payload-less entry: queue={}, id={}", kind.getDirectory(), id);
            }
        }
        return 1;
    }

    private void removeUnheldLock(Path lockFile) {
        try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.WRITE)) {
            FileLock lock = channel.tryLock();
            if (lock != null) {
                Files.deleteIfExists(lockFile);
                lock.release();
            }
        } catch (OverlappingFileLockException | IOException e) {
            log.debug("Lock marker in use: file={}", lockFile);
        }
    }

    private boolean olderThan(Path path, long cutoff) throws IOException {
        try {
            return Files.getLastModifiedTime(path).toMillis() <= cutoff;
        } catch (NoSuchFileException e) {
            return false;
        }
    }

    private static String stripSuffix(String name, String suffix) {
        return name.substring(0, name.length() - suffix.length());
    }

    private void closeQuietly(FileChannel channel, String id) {
        if (channel != null) {
            try {
                channel.close();
            } catch (IOException e) {
                log.warn("Unable to close lock channel: queue={}, id={}, error={}", kind.getDirectory(), id, e.getMessage());
            }
        }
    }

    /**
     * Claim backed by an OS level file lock.
     */
    private class FileClaim implements MessageClaim {
        private final String id;
        private final FileChannel channel;
        private final FileLock lock;

        FileClaim(String id, FileChannel channel, FileLock lock) {
            this.id = id;
            this.channel = channel;
            this.lock = lock;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public void close() {
            try {
                if (lock.isValid()) {
                    lock.release();
                }
            } catch (IOException e) {
                log.warn("Unable to release claim: queue={}, id={}, error={}", kind.getDirectory(), id, e.getMessage());
            } finally {
                closeQuietly(channel, id);
            }
        }
    }
}
