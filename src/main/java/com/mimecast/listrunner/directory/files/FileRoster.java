package com.mimecast.listrunner.directory.files;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.mimecast.listrunner.directory.DeliveryStatus;
import com.mimecast.listrunner.directory.Member;
import com.mimecast.listrunner.directory.Roster;
import com.mimecast.listrunner.util.AtomicFiles;
import com.mimecast.listrunner.util.FileLocks;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Roster stored as a JSON array in {@code members.json}.
 *
 * <p>Mutations read, modify and rename the whole file under an exclusive lock on {@code members.lck}.
 */
public class FileRoster implements Roster {
    private static final Logger log = LogManager.getLogger(FileRoster.class);

    static final String MEMBERS_FILE = "members.json";
    private static final String LOCK_FILE = "members.lck";

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final Path file;
    private final Path lockFile;
    private final Path tmpDir;

    /**
     * Constructs a new FileRoster instance.
     *
     * @param listDir List directory.
     */
    public FileRoster(Path listDir) {
        this.file = listDir.resolve(MEMBERS_FILE);
        this.lockFile = listDir.resolve(LOCK_FILE);
        this.tmpDir = listDir.resolve("tmp");
    }

    @Override
    public Optional<Member> getMember(String address) throws IOException {
        return read().stream().filter(member -> member.matches(address)).findFirst();
    }

    @Override
    public List<Member> members() throws IOException {
        return read();
    }

    @Override
    public void addMember(Member member) throws IOException {
        mutate(members -> {
            members.removeIf(existing -> existing.matches(member.getAddress()));
            members.add(member);
            return true;
        });
        log.info("Member added: file={}, address={}", file, member.getAddress());
    }

    @Override
    public boolean removeMember(String address) throws IOException {
        boolean removed = mutate(members -> members.removeIf(existing -> existing.matches(address)));
        if (removed) {
            log.info("Member removed: file={}, address={}", file, address);
        }
        return removed;
    }

    @Override
    public boolean setDeliveryStatus(String address, DeliveryStatus status) throws IOException {
        return mutate(members -> {
            for (Member member : members) {
                if (member.matches(address)) {
                    member.setDeliveryStatus(status);
                    return true;
                }
            }
            return false;
        });
    }

    /**
     * Locked read-modify-write.
     * <p>The file is rewritten only when the mutation reports a change.
     */
    private boolean mutate(Function<List<Member>, Boolean> mutation) throws IOException {
        return FileLocks.withLock(lockFile, () -> {
            List<Member> members = read();
            boolean changed = mutation.apply(members);
            if (changed) {
                AtomicFiles.write(file, gson.toJson(members).getBytes(StandardCharsets.UTF_8), tmpDir);
            }
            return changed;
        });
    }

    private List<Member> read() throws IOException {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            List<Member> members = gson.fromJson(Files.readString(file, StandardCharsets.UTF_8),
                    new TypeToken<List<Member>>() {
                    }.getType());
            return members != null ? new ArrayList<>(members) : new ArrayList<>();
        } catch (JsonParseException e) {
            throw new IOException("Unreadable roster " + file + ": " + e.getMessage(), e);
        }
    }
}
