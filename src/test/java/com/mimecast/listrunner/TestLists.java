package com.mimecast.listrunner;

import com.mimecast.listrunner.config.site.SiteConfig;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.directory.files.FilesListDirectory;
import com.mimecast.listrunner.main.Services;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.MessageMetadata;
import com.mimecast.listrunner.queue.QueuedMessage;
import com.mimecast.listrunner.queue.InMemorySwitchboard;
import com.mimecast.listrunner.queue.QueueKind;
import com.mimecast.listrunner.queue.SwitchboardProvider;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Shared fixtures: the sample list, a site config rooted in a temporary directory and in-memory queues.
 */
public final class TestLists {

    public static final String HOSTNAME = "lists.example.com";
    public static final String LIST = "test";
    public static final Path RESOURCES = Paths.get("src/test/resources");

    private TestLists() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Copies the sample list into a lists directory.
     *
     * @param listsDir Lists root.
     * @return List directory.
     */
    public static Path install(Path listsDir) throws IOException {
        Path target = listsDir.resolve(LIST);
        Files.createDirectories(target);
        for (String file : new String[]{"list.json5", "members.json"}) {
            Files.copy(RESOURCES.resolve("lists").resolve(LIST).resolve(file), target.resolve(file),
                    StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    /**
     * Replaces the sample list policy.
     *
     * @param listsDir Lists root.
     * @param json5    Policy text.
     */
    public static void policy(Path listsDir, String json5) throws IOException {
        Files.writeString(listsDir.resolve(LIST).resolve("list.json5"), json5, StandardCharsets.UTF_8);
    }

    /**
     * Builds a site config under a root directory.
     *
     * @param root Root directory.
     * @return SiteConfig instance.
     */
    public static SiteConfig site(Path root) {
        Map<String, Object> map = new HashMap<>();
        map.put("hostname", HOSTNAME);
        map.put("siteOwner", "postmaster@example.com");
        map.put("queueDir", root.resolve("queue").toString());
        map.put("listsDir", root.resolve("lists").toString());
        map.put("holdsDir", root.resolve("holds").toString());
        return new SiteConfig(map);
    }

    public static FilesListDirectory directory(Path root) {
        return new FilesListDirectory(root.resolve("lists"), HOSTNAME);
    }

    public static MailingList resolve(Path root) throws IOException {
        return directory(root).resolve(LIST).orElseThrow();
    }

    /**
     * Clock pinned to noon UTC of a day.
     *
     * @param date ISO date.
     * @return Clock instance.
     */
    public static Clock clock(String date) {
        return Clock.fixed(Instant.parse(date + "T12:00:00Z"), ZoneOffset.UTC);
    }

    public static Services services(Path root, Queues queues, Clock clock) {
        return new Services(site(root), queues, clock);
    }

    /**
     * Pipeline context of a post.
     */
    public static PipelineContext context(MailingList list, Services services, byte[] payload, MessageMetadata metadata) {
        return new PipelineContext(list, new QueuedMessage("1+0000000000000000000000000000000000000000", payload, metadata), services);
    }

    /**
     * Raw message.
     */
    public static byte[] message(String from, String to, String subject, String body) {
        String text = "From: " + from + "\r\n" +
                "To: " + to + "\r\n" +
                "Subject: " + subject + "\r\n" +
                "Message-ID: <" + Math.abs((from + subject).hashCode()) + "@example.com>\r\n" +
                "Content-Type: text/plain; charset=utf-8\r\n" +
                "\r\n" +
                body;
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * In-memory queues sharing one shunt.
     */
    public static class Queues implements SwitchboardProvider {
        private final Clock clock;
        private final Map<QueueKind, InMemorySwitchboard> queues = new EnumMap<>(QueueKind.class);

        public Queues(Clock clock) {
            this.clock = clock;
            queues.put(QueueKind.SHUNT, new InMemorySwitchboard(QueueKind.SHUNT, null, clock));
        }

        @Override
        public synchronized InMemorySwitchboard get(QueueKind kind) {
            return queues.computeIfAbsent(kind, k -> new InMemorySwitchboard(k, queues.get(QueueKind.SHUNT), clock));
        }
    }

    /**
     * Clock moved by the test.
     */
    public static class MutableClock extends Clock {
        private Instant instant;

        public MutableClock(String date) {
            this.instant = Instant.parse(date + "T12:00:00Z");
        }

        public MutableClock plusDays(long days) {
            instant = instant.plusSeconds(days * 86400L);
            return this;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
