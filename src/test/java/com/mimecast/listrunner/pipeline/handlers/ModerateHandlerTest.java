package com.mimecast.listrunner.pipeline.handlers;

import com.mimecast.listrunner.TestLists;
import com.mimecast.listrunner.directory.MailingList;
import com.mimecast.listrunner.main.Services;
import com.mimecast.listrunner.pipeline.Outcome;
import com.mimecast.listrunner.pipeline.PipelineContext;
import com.mimecast.listrunner.queue.MessageMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModerateHandlerTest {

    @TempDir
    java.nio.file.Path root;

    private final ModerateHandler handler = new ModerateHandler();
    private MailingList list;
    private Services services;

    @BeforeEach
    void setUp() throws Exception {
        TestLists.install(root.resolve("lists"));
        Clock clock = TestLists.clock("2026-10-19");
        list = TestLists.resolve(root);
        services = TestLists.services(root, new TestLists.Queues(clock), clock);
    }

    private PipelineContext post(String from) {
        return TestLists.context(list, services,
                TestLists.message(from, "test@lists.example.com", "Hello", "Hi all\r\n"), new MessageMetadata());
    }

    @Test
    void memberPostPasses() throws Exception {
        PipelineContext context = post("alice@example.com");

        assertEquals(Outcome.Kind.CONTINUE, handler.process(context).getKind());
        assertTrue(context.getMetadata().getHoldReasons().isEmpty());
    }

    @Test
    void moderatedMemberIsHeld() throws Exception {
        PipelineContext context = post("Bob <BOB@example.com>");

        assertEquals(Outcome.Kind.CONTINUE, handler.process(context).getKind());
        assertEquals(List.of("MODERATED_POST"), context.getMetadata().getHoldReasons());
    }

    @Test
    void nonMemberIsHeld() throws Exception {
        PipelineContext context = post("stranger@elsewhere.org");

        handler.process(context);

        assertEquals(List.of("NON_MEMBER_POST"), context.getMetadata().getHoldReasons());
    }

    @Test
    void acceptListWinsOverGenericAction() throws Exception {
        PipelineContext context = post("partner@trusted.example.com");

        handler.process(context);

        assertTrue(context.getMetadata().getHoldReasons().isEmpty());
    }

    @Test
    void discardListDiscards() throws Exception {
        Outcome outcome = handler.process(post("spammer@example.net"));

        assertEquals(Outcome.Kind.DISCARD, outcome.getKind());
    }

    @Test
    void approvedMessageSkipsModeration() throws Exception {
        PipelineContext context = TestLists.context(list, services,
                TestLists.message("stranger@elsewhere.org", "test@lists.example.com", "Hello", "Hi\r\n"),
                new MessageMetadata().setBoolean(MessageMetadata.APPROVED, true));

        assertEquals(Outcome.Kind.CONTINUE, handler.process(context).getKind());
        assertTrue(context.getMetadata().getHoldReasons().isEmpty());
    }

    @Test
    void rejectingListRejectsWithNotice() throws Exception {
        // Given: non-members are rejected with a custom notice.
        TestLists.policy(root.resolve("lists"), "{nonMemberAction: \"reject\", nonMemberRejectionNotice: \"Members only\"}");
        list = TestLists.resolve(root);

        // When: a non-member posts.
        Outcome outcome = handler.process(post("stranger@elsewhere.org"));

        // Then: the post is rejected with the notice.
        assertEquals(Outcome.Kind.REJECT, outcome.getKind());
        assertEquals("Members only", outcome.getReason());
    }
}
