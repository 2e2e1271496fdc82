package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.TestLists;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.hold.HoldReason;
import com.mimecast.listrunner.main.Services;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.MessageMetadata;
import com.mimecast.listrunner.queue.QueuedMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HoldDecisionHandlerTest {

    @TempDir
    Path root;

    private final HoldDecisionHandler handler = new HoldDecisionHandler();
    private MailingList list;
    private Services services;

    @BeforeEach
    void setUp() throws Exception {
        TestLists.install(root.resolve("lists"));
        Clock clock = TestLists.clock("2026-10-19");
        list = TestLists.resolve(root);
        services = TestLists.services(root, new TestLists.Queues(clock), clock);
    }

    private PipelineContext context(MessageMetadata metadata) {
        return TestLists.context(list, services,
                TestLists.message("stranger@elsewhere.org", "test@lists.example.com", "Hello", "Hi\r\n"), metadata);
    }

    @Test
    void noReasonsContinues() throws Exception {
        assertEquals(Outcome.Kind.CONTINUE, handler.process(context(new MessageMetadata())).getKind());
    }

    @Test
    void reasonsHold() throws Exception {
        MessageMetadata metadata = new MessageMetadata();
        metadata.addToList(MessageMetadata.HOLD_REASONS, "NON_MEMBER_POST");
        metadata.addToList(MessageMetadata.HOLD_REASONS, "MESSAGE_TOO_BIG");

        Outcome outcome = handler.process(context(metadata));

        assertEquals(Outcome.Kind.HOLD, outcome.getKind());
        assertEquals(List.of(HoldReason.NON_MEMBER_POST, HoldReason.MESSAGE_TOO_BIG), outcome.getHoldReasons());
    }

    @Test
    void approvedIgnoresReasons() throws Exception {
        MessageMetadata metadata = new MessageMetadata().setBoolean(MessageMetadata.APPROVED, true);
        metadata.addToList(MessageMetadata.HOLD_REASONS, "NON_MEMBER_POST");

        assertEquals(Outcome.Kind.CONTINUE, handler.process(context(metadata)).getKind());
    }

    @Test
    void fullModerationQueueRejects() throws Exception {
        // Given: a list holding at most one message, already holding one.
        TestLists.policy(root.resolve("lists"), "{maxHeldMessages: 1}");
        list = TestLists.resolve(root);
        services.getHoldStore().hold("test", new QueuedMessage("1+1111111111111111111111111111111111111111",
                        TestLists.message("x@example.org", "test@lists.example.com", "Old", "Hi\r\n"), new MessageMetadata()),
                List.of(HoldReason.NON_MEMBER_POST), "x@example.org", "Old", "<old@example.org>");
        MessageMetadata metadata = new MessageMetadata();
        metadata.addToList(MessageMetadata.HOLD_REASONS, "NON_MEMBER_POST");

        // When: another message should be held.
        Outcome outcome = handler.process(context(metadata));

        // Then: it is rejected instead.
        assertEquals(Outcome.Kind.REJECT, outcome.getKind());
        assertEquals(HoldDecisionHandler.QUEUE_FULL, outcome.getReason());
    }
}
