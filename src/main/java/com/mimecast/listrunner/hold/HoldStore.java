package com.mimecast.listrunner.hold;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.metrics.QueueMetrics;
import com.mimecast.listrunner.notice.Notifier;
import com.mimecast.listrunner.queue.MessageMetadata;
import com.mimecast.listrunner.queue.QueueKind;
import com.mimecast.listrunner.queue.QueueException;
import com.mimecast.listrunner.queue.QueuedMessage;
import com.mimecast.listrunner.queue.SwitchboardProvider;
import com.mimecast.listrunner.util.AtomicFiles;
import com.mimecast.listrunner.util.FileLocks;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Filesystem store of held messages.
 *
 * <p>Layout under {@code <holdsDir>/<list>/}:
 * <ul>
 *     <li>{@code <id>.msg} the payload exactly as it was queued.</li>
 *     <li>{@code <id>.meta.json} the queue metadata at hold time.</li>
 *     <li>{@code <id>.json} the hold record, written last.</li>
 * </ul>
 * <p>A pending record always has its payload. Deciding a hold drops the payload and metadata
 * and keeps the record with its terminal state until {@link #prune} deletes it.
 */
public class HoldStore {
    private static final Logger log = LogManager.getLogger(HoldStore.class);

    private static final String RECORD_SUFFIX = ".json";
    private static final String PAYLOAD_SUFFIX = ".msg";
    private static final String METADATA_SUFFIX = ".meta.json";
    private static final String LOCK_FILE = "holds.lck";

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final Path holdsDir;
    private final SwitchboardProvider switchboards;
    private final Notifier notifier;
    private final Clock clock;

    /**
     * Constructs a new HoldStore instance.
     *
     * @param holdsDir     Holds root directory.
     * @param switchboards Switchboard provider, used to re-enqueue approved messages.
     * @param notifier     Notifier, used for rejections.
     * @param clock        Clock.
     */
    public HoldStore(Path holdsDir, SwitchboardProvider switchboards, Notifier notifier, Clock clock) {
        this.holdsDir = holdsDir;
        this.switchboards = switchboards;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * Holds a message.
     * <p>The hold id is the queue id, holding the same message twice returns the existing record.
     *
     * @param listName  List name.
     * @param message   Queued message.
     * @param reasons   Hold reasons.
     * @param sender    Sender address.
     * @param subject   Subject.
     * @param messageId Message-ID header.
     * @return HoldRecord instance.
     * @throws IOException Unable to write.
     */
    public HoldRecord hold(String listName, QueuedMessage message, List<HoldReason> reasons,
                           String sender, String subject, String messageId) throws IOException {
        Path dir = listDir(listName);
        String id = message.getId();
        return FileLocks.withLock(dir.resolve(LOCK_FILE), () -> {
            HoldRecord existing = read(dir.resolve(id + RECORD_SUFFIX));
            if (existing != null) {
                log.debug("Hold exists: list={}, id={}, state={}", listName, id, existing.getState());
                return existing;
            }

            HoldRecord record = new HoldRecord(id, listName, reasons, clock.millis())
                    .setSender(sender)
                    .setSubject(subject)
                    .setMessageId(messageId);

            Path tmpDir = dir.resolve("tmp");
            AtomicFiles.write(dir.resolve(id + PAYLOAD_SUFFIX), message.getPayload(), tmpDir);
            AtomicFiles.write(dir.resolve(id + METADATA_SUFFIX),
                    message.getMetadata().toJson().getBytes(StandardCharsets.UTF_8), tmpDir);
            write(dir, record);

            log.info("Message held: list={}, id={}, sender={}, reasons={}", listName, id, sender, record.getReasons());
            return record;
        });
    }

    /**
     * Gets hold record.
     *
     * @param listName List name.
     * @param id       Hold id.
     * @return Optional of HoldRecord.
     * @throws IOException Unable to read.
     */
    public Optional<HoldRecord> get(String listName, String id) throws IOException {
        return Optional.ofNullable(read(listDir(listName).resolve(id + RECORD_SUFFIX)));
    }

    /**
     * Lists hold records of a list, oldest first.
     *
     * @param listName List name.
     * @return List of HoldRecord.
     * @throws IOException Unable to read.
     */
    public List<HoldRecord> list(String listName) throws IOException {
        List<HoldRecord> records = new ArrayList<>();
        Path dir = listDir(listName);
        if (!Files.isDirectory(dir)) {
            return records;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + RECORD_SUFFIX)) {
            for (Path path : stream) {
                if (path.getFileName().toString().endsWith(METADATA_SUFFIX)) {
                    continue;
                }
                HoldRecord record = read(path);
                if (record != null) {
                    records.add(record);
                }
            }
        }
        records.sort(Comparator.comparingLong(HoldRecord::getTimestamp).thenComparing(HoldRecord::getId));
        return records;
    }

    /**
     * Counts pending holds of a list.
     *
     * @param listName List name.
     * @return Pending count.
     * @throws IOException Unable to read.
     */
    public int countPending(String listName) throws IOException {
        Path dir = listDir(listName);
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        // Only pending holds retain a payload.
        int pending = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + PAYLOAD_SUFFIX)) {
            for (Path ignored : stream) {
                pending++;
            }
        }
        return pending;
    }

    /**
     * Gets the retained payload of a pending hold.
     *
     * @param listName List name.
     * @param id       Hold id.
     * @return Optional of byte array.
     * @throws IOException Unable to read.
     */
    public Optional<byte[]> payload(String listName, String id) throws IOException {
        Path file = listDir(listName).resolve(id + PAYLOAD_SUFFIX);
        return Files.exists(file) ? Optional.of(Files.readAllBytes(file)) : Optional.empty();
    }

    /**
     * Gets the retained metadata of a pending hold.
     *
     * @param listName List name.
     * @param id       Hold id.
     * @return Optional of MessageMetadata.
     * @throws IOException Unable to read.
     */
    public Optional<MessageMetadata> metadata(String listName, String id) throws IOException {
        Path file = listDir(listName).resolve(id + METADATA_SUFFIX);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(MessageMetadata.fromJson(Files.readString(file, StandardCharsets.UTF_8)));
    }

    /**
     * Applies a moderator decision.
     * <p>Approved messages go back to the queue they came from with {@code approved} set,
     * so the hold criteria are skipped and the original bytes are delivered.
     *
     * @param list     Mailing list.
     * @param id       Hold id.
     * @param decision Terminal state.
     * @param comment  Moderator comment, used as rejection text when present.
     * @return Updated HoldRecord.
     * @throws IOException Unable to read, write or enqueue.
     */
    public HoldRecord decide(MailingList list, String id, HoldState decision, String comment) throws IOException {
        if (decision == HoldState.PENDING) {
            throw new IllegalArgumentException("Decision must be terminal");
        }
        Path dir = listDir(list.getName());
        return FileLocks.withLock(dir.resolve(LOCK_FILE), () -> {
            HoldRecord record = read(dir.resolve(id + RECORD_SUFFIX));
            if (record == null) {
                throw new IOException("No hold record: list=" + list.getName() + ", id=" + id);
            }
            if (!record.isPending()) {
                throw new IllegalStateException("Hold " + id + " already decided: " + record.getState());
            }

            byte[] payload = payload(list.getName(), id)
                    .orElseThrow(() -> new IOException("Pending hold without payload: " + id));

            switch (decision) {
                case APPROVED:
                    approve(list.getName(), id, payload);
                    break;
                case REJECTED:
                    String reason = comment != null && !comment.isBlank() ? comment :
                            record.getPrimaryReason().map(HoldReason::getRejection).orElse("No reason given");
                    notifier.rejection(list, record.getSender(), record.getSubject(), reason, payload);
                    break;
                default:
                    break;
            }

            record.decide(decision, clock.millis(), comment);
            write(dir, record);
            Files.deleteIfExists(dir.resolve(id + PAYLOAD_SUFFIX));
            Files.deleteIfExists(dir.resolve(id + METADATA_SUFFIX));

            log.info("Hold decided: list={}, id={}, decision={}", list.getName(), id, decision);
            return record;
        });
    }

    /**
     * Discards pending holds older than the given age.
     *
     * @param list          Mailing list.
     * @param maxDaysToHold Maximum age in days, 0 disables expiry.
     * @param now           Current time.
     * @return Number of expired holds.
     * @throws IOException Unable to read or write.
     */
    public int expire(MailingList list, int maxDaysToHold, Instant now) throws IOException {
        if (maxDaysToHold <= 0) {
            return 0;
        }
        long cutoff = now.minus(Duration.ofDays(maxDaysToHold)).toEpochMilli();
        int expired = 0;
        for (HoldRecord record : list(list.getName())) {
            if (record.isPending() && record.getTimestamp() < cutoff) {
                try {
                    decide(list, record.getId(), HoldState.DISCARDED, "expired");
                    expired++;
                } catch (IllegalStateException e) {
                    log.debug("Hold decided concurrently: list={}, id={}", list.getName(), record.getId());
                }
            }
        }
        if (expired > 0) {
            log.info("Holds expired: list={}, count={}", list.getName(), expired);
        }
        return expired;
    }

    /**
     * Deletes decided hold records older than the given age.
     *
     * @param list          Mailing list.
     * @param retentionDays Days a decided record is kept, 0 keeps them forever.
     * @param now           Current time.
     * @return Number of records deleted.
     * @throws IOException Unable to read or delete.
     */
    public int prune(MailingList list, int retentionDays, Instant now) throws IOException {
        if (retentionDays <= 0) {
            return 0;
        }
        long cutoff = now.minus(Duration.ofDays(retentionDays)).toEpochMilli();
        Path dir = listDir(list.getName());
        int pruned = 0;
        for (HoldRecord record : list(list.getName())) {
            if (!record.isPending() && record.getDecidedTime() < cutoff) {
                boolean deleted = FileLocks.withLock(dir.resolve(LOCK_FILE), () -> {
                    HoldRecord current = read(dir.resolve(record.getId() + RECORD_SUFFIX));
                    return current != null && !current.isPending() &&
                            Files.deleteIfExists(dir.resolve(record.getId() + RECORD_SUFFIX));
                });
                if (deleted) {
                    pruned++;
                }
            }
        }
        if (pruned > 0) {
            log.info("Decided holds pruned: list={}, count={}", list.getName(), pruned);
        }
        return pruned;
    }

    private void approve(String listName, String id, byte[] payload) throws IOException {
        MessageMetadata metadata = metadata(listName, id).orElseGet(MessageMetadata::new);
        QueueKind kind = QueueKind.fromDirectory(metadata.getString(MessageMetadata.WHICHQ, ""))
                .orElse(QueueKind.IN);

        metadata.setString(MessageMetadata.LISTNAME, listName)
                .setBoolean(MessageMetadata.APPROVED, true)
                .setInt(MessageMetadata.PIPELINE_POSITION, 0)
                .setInt(MessageMetadata.FAILURES, 0)
                .setString(MessageMetadata.WHICHQ, kind.getDirectory())
                .remove(MessageMetadata.HOLD_REASONS)
                .remove(MessageMetadata.LAST_ERROR);

        String queued = switchboards.get(kind).enqueue(payload, metadata);
        QueueMetrics.incrementEnqueued(kind.getDirectory());
        log.info("Approved message requeued: list={}, hold={}, queue={}, id={}", listName, id, kind.getDirectory(), queued);
    }

    private void write(Path dir, HoldRecord record) throws IOException {
        AtomicFiles.write(dir.resolve(record.getId() + RECORD_SUFFIX),
                gson.toJson(record).getBytes(StandardCharsets.UTF_8), dir.resolve("tmp"));
    }

    private HoldRecord read(Path file) throws IOException {
        if (!Files.exists(file)) {
            return null;
        }
        try {
            return gson.fromJson(Files.readString(file, StandardCharsets.UTF_8), HoldRecord.class);
        } catch (JsonParseException e) {
            throw new QueueException("Unreadable hold record " + file + ": " + e.getMessage(), e);
        }
    }

    private Path listDir(String listName) {
        return holdsDir.resolve(listName);
    }
}
