package com.mimecast.listrunner.queue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FileSwitchboardTest {

    @TempDir
    Path root;

    private FileSwitchboard switchboard;

    @BeforeEach
    void setUp() throws QueueException {
        switchboard = new FileSwitchboard(root, QueueKind.IN);
    }

    private static byte[] payload(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void enqueueWritesBothHalves() throws Exception {
        // Given: one entry.
        String id = switchboard.enqueue(payload("Subject: a\r\n\r\nbody"), new MessageMetadata().setString(MessageMetadata.LISTNAME, "test"));

        // Then: payload and metadata files exist and are listed.
        assertTrue(Files.exists(root.resolve("in").resolve(id + FileSwitchboard.PAYLOAD_SUFFIX)));
        assertTrue(Files.exists(root.resolve("in").resolve(id + FileSwitchboard.METADATA_SUFFIX)));
        assertEquals(List.of(id), switchboard.files());
        assertEquals(1, switchboard.size());

        QueuedMessage message = switchboard.dequeue(id).orElseThrow();
        assertEquals("Subject: a\r\n\r\nbody", new String(message.getPayload(), StandardCharsets.UTF_8));
        assertEquals("test", message.getMetadata().getListName());
    }

    @Test
    void identifiersAreUniqueAndOrdered() throws Exception {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            ids.add(switchboard.enqueue(payload("Subject: " + i + "\r\n\r\n"), new MessageMetadata()));
        }
        assertEquals(50, ids.size());

        List<String> listed = switchboard.files();
        assertEquals(50, listed.size());
        for (int i = 1; i < listed.size(); i++) {
            assertTrue(listed.get(i - 1).compareTo(listed.get(i)) < 0);
        }
    }

    @Test
    void claimIsExclusiveUntilReleased() throws Exception {
        String id = switchboard.enqueue(payload("Subject: a\r\n\r\n"), new MessageMetadata());

        // When: claimed once.
        Optional<MessageClaim> first = switchboard.claim(id);
        assertTrue(first.isPresent());

        // Then: a second claim fails until the first is released.
        assertTrue(switchboard.claim(id).isEmpty());
        first.get().close();

        Optional<MessageClaim> again = switchboard.claim(id);
        assertTrue(again.isPresent());
        again.get().close();
    }

    @Test
    void roundTripKeepsArbitraryBytesAndMetadata() throws Exception {
        // Given: every byte value and non-ASCII metadata.
        byte[] binary = new byte[256];
        for (int i = 0; i < binary.length; i++) {
            binary[i] = (byte) i;
        }
        MessageMetadata metadata = new MessageMetadata()
                .setString(MessageMetadata.LISTNAME, "test")
                .setString(MessageMetadata.ENVSENDER, "zoë@example.com")
                .setString(MessageMetadata.SUBJECT_PREFIX, "[Prüfung 測試] ")
                .setLong(MessageMetadata.RECEIVED_TIME, 1792368000123L)
                .setBoolean(MessageMetadata.TO_LIST, true)
                .setStringList(MessageMetadata.RECIPS, List.of("alice@example.com", "bob@example.com"));

        // When: enqueued alongside an empty payload.
        String binaryId = switchboard.enqueue(binary, metadata);
        String emptyId = switchboard.enqueue(new byte[0], new MessageMetadata());

        // Then: both read back unchanged.
        QueuedMessage message = switchboard.dequeue(binaryId).orElseThrow();
        assertArrayEquals(binary, message.getPayload());
        assertEquals(metadata, message.getMetadata());

        QueuedMessage empty = switchboard.dequeue(emptyId).orElseThrow();
        assertEquals(0, empty.getPayload().length);
        assertEquals(new MessageMetadata(), empty.getMetadata());
    }

    @Test
    void entriesSurviveRestart() throws Exception {
        // Given: entries written by one instance.
        String first = switchboard.enqueue(payload("Subject: one\r\n\r\n"), new MessageMetadata().setString(MessageMetadata.LISTNAME, "test"));
        String second = switchboard.enqueue(payload("Subject: two\r\n\r\n"), new MessageMetadata().setInt(MessageMetadata.FAILURES, 2));

        // When: a fresh instance opens the same directory.
        FileSwitchboard restarted = new FileSwitchboard(root, QueueKind.IN);

        // Then: it sees the same entries.
        assertEquals(List.of(first, second), restarted.files());
        assertEquals("Subject: one\r\n\r\n", new String(restarted.dequeue(first).orElseThrow().getPayload(), StandardCharsets.UTF_8));
        assertEquals("test", restarted.dequeue(first).orElseThrow().getMetadata().getListName());
        assertEquals(2, restarted.dequeue(second).orElseThrow().getMetadata().getFailures());
    }

    @Test
    void concurrentClaimsAreMutuallyExclusive() throws Exception {
        String id = switchboard.enqueue(payload("Subject: a\r\n\r\n"), new MessageMetadata());

        int threads = 8;
        CyclicBarrier barrier = new CyclicBarrier(threads);
        AtomicInteger holders = new AtomicInteger();
        AtomicInteger maxHolders = new AtomicInteger();
        AtomicInteger claims = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    // Each worker has its own instance, as separate runners would.
                    FileSwitchboard own = new FileSwitchboard(root, QueueKind.IN);
                    for (int round = 0; round < 20; round++) {
                        barrier.await(10, TimeUnit.SECONDS);
                        Optional<MessageClaim> claim = own.claim(id);
                        if (claim.isPresent()) {
                            claims.incrementAndGet();
                            maxHolders.accumulateAndGet(holders.incrementAndGet(), Math::max);
                            Thread.sleep(2);
                            holders.decrementAndGet();
                            claim.get().close();
                        }
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertTrue(claims.get() > 0);
        assertEquals(1, maxHolders.get());
    }

    @Test
    void claimOfMissingEntryIsEmpty() throws Exception {
        assertTrue(switchboard.claim("123+0000000000000000000000000000000000000000").isEmpty());
        assertTrue(switchboard.claim("../escape").isEmpty());
    }

    @Test
    void dequeueSkipsHalfWrittenEntry() throws Exception {
        // Given: metadata without payload.
        String id = switchboard.enqueue(payload("Subject: a\r\n\r\n"), new MessageMetadata());
        Files.delete(root.resolve("in").resolve(id + FileSwitchboard.PAYLOAD_SUFFIX));

        // Then: nothing to dequeue.
        assertTrue(switchboard.dequeue(id).isEmpty());
    }

    @Test
    void dequeueOfCorruptMetadataThrows() throws Exception {
        String id = switchboard.enqueue(payload("Subject: a\r\n\r\n"), new MessageMetadata());
        Files.writeString(root.resolve("in").resolve(id + FileSwitchboard.METADATA_SUFFIX), "{not json");

        assertThrows(QueueException.class, () -> switchboard.dequeue(id));
    }

    @Test
    void updateReplacesMetadata() throws Exception {
        String id = switchboard.enqueue(payload("Subject: a\r\n\r\n"), new MessageMetadata());

        switchboard.update(id, new MessageMetadata().setInt(MessageMetadata.PIPELINE_POSITION, 4));

        assertEquals(4, switchboard.dequeue(id).orElseThrow().getMetadata().getPipelinePosition());
        assertThrows(QueueException.class, () -> switchboard.update("1+0000000000000000000000000000000000000000", new MessageMetadata()));
    }

    @Test
    void finishRemovesEntry() throws Exception {
        String id = switchboard.enqueue(payload("Subject: a\r\n\r\n"), new MessageMetadata());

        switchboard.finish(id);

        assertTrue(switchboard.files().isEmpty());
        assertTrue(switchboard.dequeue(id).isEmpty());
        // Finishing twice is harmless.
        switchboard.finish(id);
    }

    @Test
    void shuntMovesEntryWithReason() throws Exception {
        // Given: an entry in the in queue.
        String id = switchboard.enqueue(payload("Subject: a\r\n\r\n"), new MessageMetadata().setString(MessageMetadata.LISTNAME, "test"));

        // When: shunted.
        switchboard.shunt(id, "failed 3 times: boom");

        // Then: it left the in queue with payload intact.
        assertTrue(switchboard.files().isEmpty());
        FileSwitchboard shunt = new FileSwitchboard(root, QueueKind.SHUNT);
        QueuedMessage message = shunt.dequeue(id).orElseThrow();
        assertEquals("Subject: a\r\n\r\n", new String(message.getPayload(), StandardCharsets.UTF_8));
        assertEquals("failed 3 times: boom", message.getMetadata().getString(MessageMetadata.SHUNT_REASON));
        assertEquals("in", message.getMetadata().getString(MessageMetadata.WHICHQ));
        assertEquals("test", message.getMetadata().getListName());
        assertTrue(message.getMetadata().has(MessageMetadata.SHUNTED_TIME));
    }

    @Test
    void recoverShuntsOrphanedPayload() throws Exception {
        // Given: a payload without metadata and a stale temp file.
        String id = QueueIds.next(System.currentTimeMillis());
        Files.write(root.resolve("in").resolve(id + FileSwitchboard.PAYLOAD_SUFFIX), payload("Subject: orphan\r\n\r\n"));
        Files.write(root.resolve("in").resolve("tmp").resolve("partial.tmp"), payload("x"));

        // When: recovered without grace.
        int repaired = switchboard.recover(0L);

        // Then: the payload is in the shunt queue and the temp file is gone.
        assertEquals(1, repaired);
        assertFalse(Files.exists(root.resolve("in").resolve(id + FileSwitchboard.PAYLOAD_SUFFIX)));
        assertFalse(Files.exists(root.resolve("in").resolve("tmp").resolve("partial.tmp")));
        MessageMetadata metadata = new FileSwitchboard(root, QueueKind.SHUNT).dequeue(id).orElseThrow().getMetadata();
        assertEquals("orphaned payload", metadata.getString(MessageMetadata.SHUNT_REASON));
    }

    @Test
    void recoverRemovesPayloadlessEntry() throws Exception {
        // Given: an interrupted finish left metadata only.
        String id = switchboard.enqueue(payload("Subject: a\r\n\r\n"), new MessageMetadata());
        Files.delete(root.resolve("in").resolve(id + FileSwitchboard.PAYLOAD_SUFFIX));

        assertEquals(1, switchboard.recover(0L));
        assertTrue(switchboard.files().isEmpty());
    }

    @Test
    void recoverRespectsGracePeriod() throws Exception {
        String id = QueueIds.next(System.currentTimeMillis());
        Files.write(root.resolve("in").resolve(id + FileSwitchboard.PAYLOAD_SUFFIX), payload("Subject: young\r\n\r\n"));

        assertEquals(0, switchboard.recover(3_600_000L));
        assertTrue(Files.exists(root.resolve("in").resolve(id + FileSwitchboard.PAYLOAD_SUFFIX)));
    }
}
