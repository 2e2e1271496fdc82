package com.mimecast.listrunner.hold;

import com.mimecast.listrunner.TestLists;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.notice.Notifier;
import com.mimecast.listrunner.queue.MessageMetadata;
import com.mimecast.listrunner.queue.QueueKind;
import com.mimecast.listrunner.queue.QueuedMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HoldStoreTest {

    private static final String SENDER = "stranger@example.org";

    @TempDir
    Path root;

    private TestLists.MutableClock clock;
    private TestLists.Queues queues;
    private MailingList list;
    private HoldStore store;

    @BeforeEach
    void setUp() throws Exception {
        TestLists.install(root.resolve("lists"));
        clock = new TestLists.MutableClock("2026-10-19");
        queues = new TestLists.Queues(clock);
        list = TestLists.resolve(root);
        store = new HoldStore(root.resolve("holds"), queues, new Notifier(queues, clock), clock);
    }

    private QueuedMessage queued(String id) {
        byte[] payload = TestLists.message(SENDER, "test@lists.example.com", "Hi there", "Hello.\r\n");
        MessageMetadata metadata = new MessageMetadata()
                .setString(MessageMetadata.LISTNAME, TestLists.LIST)
                .setString(MessageMetadata.ENVSENDER, SENDER)
                .setString(MessageMetadata.WHICHQ, QueueKind.IN.getDirectory())
                .setInt(MessageMetadata.PIPELINE_POSITION, 4)
                .setInt(MessageMetadata.FAILURES, 1)
                .setStringList(MessageMetadata.HOLD_REASONS, List.of(HoldReason.NON_MEMBER_POST.name()));
        return new QueuedMessage(id, payload, metadata);
    }

    private HoldRecord hold(String id) throws Exception {
        return store.hold(TestLists.LIST, queued(id), List.of(HoldReason.NON_MEMBER_POST), SENDER, "Hi there", "<m@example.org>");
    }

    @Test
    void holdKeepsPayloadAndRecord() throws Exception {
        // When:
        HoldRecord record = hold("1");

        // Then:
        assertTrue(record.isPending());
        assertEquals(List.of("NON_MEMBER_POST"), record.getReasons());
        assertEquals(SENDER, record.getSender());
        assertArrayEquals(queued("1").getPayload(), store.payload(TestLists.LIST, "1").orElseThrow());
        assertEquals(4, store.metadata(TestLists.LIST, "1").orElseThrow().getPipelinePosition());
        assertEquals(1, store.countPending(TestLists.LIST));
    }

    @Test
    void holdingTwiceKeepsFirstRecord() throws Exception {
        HoldRecord first = hold("1");
        clock.plusDays(1);
        HoldRecord second = hold("1");

        assertEquals(first.getTimestamp(), second.getTimestamp());
        assertEquals(1, store.list(TestLists.LIST).size());
    }

    @Test
    void listIsOldestFirst() throws Exception {
        hold("b");
        clock.plusDays(1);
        hold("a");

        List<HoldRecord> records = store.list(TestLists.LIST);
        assertEquals("b", records.get(0).getId());
        assertEquals("a", records.get(1).getId());
    }

    @Test
    void approveRequeuesOriginalBytes() throws Exception {
        // Given:
        hold("1");

        // When:
        HoldRecord record = store.decide(list, "1", HoldState.APPROVED, null);

        // Then: the original goes back to the incoming queue from the start.
        assertEquals(HoldState.APPROVED, record.getState());
        List<String> ids = queues.get(QueueKind.IN).files();
        assertEquals(1, ids.size());
        QueuedMessage requeued = queues.get(QueueKind.IN).dequeue(ids.get(0)).orElseThrow();
        assertArrayEquals(queued("1").getPayload(), requeued.getPayload());
        assertTrue(requeued.getMetadata().getBoolean(MessageMetadata.APPROVED));
        assertEquals(0, requeued.getMetadata().getPipelinePosition());
        assertEquals(0, requeued.getMetadata().getFailures());
        assertFalse(requeued.getMetadata().has(MessageMetadata.HOLD_REASONS));

        // The record stays, the payload goes.
        assertTrue(store.payload(TestLists.LIST, "1").isEmpty());
        assertEquals(HoldState.APPROVED, store.get(TestLists.LIST, "1").orElseThrow().getState());
        assertEquals(0, store.countPending(TestLists.LIST));
    }

    @Test
    void rejectNotifiesSender() throws Exception {
        hold("1");

        store.decide(list, "1", HoldState.REJECTED, null);

        List<String> ids = queues.get(QueueKind.VIRGIN).files();
        assertEquals(1, ids.size());
        MessageMetadata notice = queues.get(QueueKind.VIRGIN).dequeue(ids.get(0)).orElseThrow().getMetadata();
        assertEquals(List.of(SENDER), notice.getStringList(MessageMetadata.RECIPS));
        assertTrue(queues.get(QueueKind.IN).files().isEmpty());
    }

    @Test
    void discardIsSilent() throws Exception {
        hold("1");

        store.decide(list, "1", HoldState.DISCARDED, "spam");

        assertTrue(queues.get(QueueKind.VIRGIN).files().isEmpty());
        assertEquals("spam", store.get(TestLists.LIST, "1").orElseThrow().getComment());
    }

    @Test
    void decidingTwiceFails() throws Exception {
        hold("1");
        store.decide(list, "1", HoldState.DISCARDED, null);

        assertThrows(IllegalStateException.class, () -> store.decide(list, "1", HoldState.APPROVED, null));
        assertThrows(IllegalArgumentException.class, () -> store.decide(list, "1", HoldState.PENDING, null));
        assertTrue(queues.get(QueueKind.IN).files().isEmpty());
    }

    @Test
    void expireDiscardsOldHolds() throws Exception {
        // Given: one hold three days old, one fresh.
        hold("old");
        clock.plusDays(3);
        hold("new");

        // When:
        assertEquals(0, store.expire(list, 0, clock.instant()));
        int expired = store.expire(list, 2, Instant.now(clock));

        // Then:
        assertEquals(1, expired);
        HoldRecord old = store.get(TestLists.LIST, "old").orElseThrow();
        assertEquals(HoldState.DISCARDED, old.getState());
        assertEquals("expired", old.getComment());
        assertTrue(store.get(TestLists.LIST, "new").orElseThrow().isPending());
    }

    @Test
    void pruneDeletesOnlyOldDecidedRecords() throws Exception {
        // Given: one hold decided six days ago, one decided three days ago and one still pending.
        hold("early");
        hold("late");
        hold("waiting");
        store.decide(list, "early", HoldState.DISCARDED, null);
        clock.plusDays(3);
        store.decide(list, "late", HoldState.REJECTED, null);
        clock.plusDays(3);

        // When:
        assertEquals(0, store.prune(list, 0, clock.instant()));
        int pruned = store.prune(list, 5, clock.instant());

        // Then: only the old decided record is gone.
        assertEquals(1, pruned);
        assertTrue(store.get(TestLists.LIST, "early").isEmpty());
        assertEquals(HoldState.REJECTED, store.get(TestLists.LIST, "late").orElseThrow().getState());
        assertTrue(store.get(TestLists.LIST, "waiting").orElseThrow().isPending());
        assertEquals(2, store.list(TestLists.LIST).size());
        assertEquals(1, store.countPending(TestLists.LIST));
    }
}
