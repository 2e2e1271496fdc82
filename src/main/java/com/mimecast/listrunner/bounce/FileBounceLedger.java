package com.mimecast.listrunner.bounce;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.mimecast.listrunner.directory.Member;
import com.mimecast.listrunner.util.AtomicFiles;
import com.mimecast.listrunner.util.FileLocks;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Bounce ledger keeping one JSON file per member.
 *
 * <p>Files are named by the SHA-1 of the normalized address.
 * <p>Each update holds the member lock marker so the daily check-and-increment is atomic.
 */
public class FileBounceLedger implements BounceLedger {
    private static final Logger log = LogManager.getLogger(FileBounceLedger.class);

    public static final String DIRECTORY = "bounces";
    private static final String RECORD_SUFFIX = ".json";
    private static final String LOCK_SUFFIX = ".lck";

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final Path dir;
    private final Path tmpDir;

    /**
     * Constructs a new FileBounceLedger instance.
     *
     * @param dir Ledger directory.
     */
    public FileBounceLedger(Path dir) {
        this.dir = dir;
        this.tmpDir = dir.resolve("tmp");
    }

    @Override
    public Optional<BounceRecord> get(String address) throws IOException {
        return Optional.ofNullable(read(recordFile(address)));
    }

    @Override
    public List<BounceRecord> records() throws IOException {
        List<BounceRecord> records = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return records;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + RECORD_SUFFIX)) {
            for (Path path : stream) {
                BounceRecord record = read(path);
                if (record != null) {
                    records.add(record);
                }
            }
        }
        return records;
    }

    @Override
    public BounceRecord update(String address, UnaryOperator<BounceRecord> mutation) throws IOException {
        Path file = recordFile(address);
        return FileLocks.withLock(lockFile(address), () -> {
            BounceRecord updated = mutation.apply(read(file));
            if (updated == null) {
                Files.deleteIfExists(file);
            } else {
                AtomicFiles.write(file, gson.toJson(updated).getBytes(StandardCharsets.UTF_8), tmpDir);
            }
            return updated;
        });
    }

    @Override
    public boolean remove(String address) throws IOException {
        Path file = recordFile(address);
        boolean removed = FileLocks.withLock(lockFile(address), () -> Files.deleteIfExists(file));
        if (removed) {
            log.debug("Bounce record removed: dir={}, address={}", dir, address);
        }
        return removed;
    }

    private BounceRecord read(Path file) throws IOException {
        if (!Files.exists(file)) {
            return null;
        }
        try {
            return gson.fromJson(Files.readString(file, StandardCharsets.UTF_8), BounceRecord.class);
        } catch (JsonParseException e) {
            throw new IOException("Unreadable bounce record " + file + ": " + e.getMessage(), e);
        }
    }

    private Path recordFile(String address) {
        return dir.resolve(key(address) + RECORD_SUFFIX);
    }

    private Path lockFile(String address) {
        return dir.resolve(key(address) + LOCK_SUFFIX);
    }

    private static String key(String address) {
        return DigestUtils.sha1Hex(Member.normalize(address));
    }
}
